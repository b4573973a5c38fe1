package org.nd.proof;

/**
 * Citazione di una riga precedente, con l'eventuale scaricamento di un'assunzione.
 *
 * @param line indice (base 0) della riga citata
 * @param discharge assunzione chiusa dalla citazione
 */
public record Reference(int line, Discharge discharge) {

    public Reference {
        if (line < 0) {
            throw new IllegalArgumentException("Indice di riga negativo: " + line);
        }
        if (discharge == null) {
            throw new IllegalArgumentException("Scaricamento non può essere null, usare Discharge.none()");
        }
    }

    public static Reference of(int line) {
        return new Reference(line, Discharge.none());
    }

    public static Reference vacuous(int line) {
        return new Reference(line, Discharge.vacuous());
    }

    public static Reference discharging(int line, int assumptionIndex) {
        return new Reference(line, Discharge.of(assumptionIndex));
    }

    /**
     * Notazione compatta: "3", "3[]" oppure "3[2]".
     */
    @Override
    public String toString() {
        return line + discharge.toString();
    }
}
