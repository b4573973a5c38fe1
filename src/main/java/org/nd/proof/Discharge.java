package org.nd.proof;

/**
 * SCARICAMENTO DI UN'ASSUNZIONE - Variante a tre casi di un riferimento
 *
 * CASI:
 * - NONE: il riferimento non chiude alcuna assunzione
 * - VACUOUS: chiude un'assunzione non usata per derivare la riga citata
 * - INDEX: chiude esattamente l'assunzione con l'indice indicato
 *
 * L'indice è significativo solo per {@link Kind#INDEX}; negli altri casi vale -1.
 */
public record Discharge(Kind kind, int index) {

    public enum Kind {
        NONE,
        VACUOUS,
        INDEX
    }

    private static final Discharge NONE = new Discharge(Kind.NONE, -1);
    private static final Discharge VACUOUS = new Discharge(Kind.VACUOUS, -1);

    public Discharge {
        if (kind == null) {
            throw new IllegalArgumentException("Tipo di scaricamento non può essere null");
        }
        if (kind == Kind.INDEX && index < 0) {
            throw new IllegalArgumentException("Indice di assunzione negativo: " + index);
        }
        if (kind != Kind.INDEX && index != -1) {
            throw new IllegalArgumentException("Indice ammesso solo per scaricamenti di tipo INDEX");
        }
    }

    public static Discharge none() {
        return NONE;
    }

    public static Discharge vacuous() {
        return VACUOUS;
    }

    public static Discharge of(int assumptionIndex) {
        return new Discharge(Kind.INDEX, assumptionIndex);
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    public boolean isVacuous() {
        return kind == Kind.VACUOUS;
    }

    public boolean isIndex() {
        return kind == Kind.INDEX;
    }

    /**
     * Notazione di citazione: vuota, "[]" per vacuo, "[i]" per indice.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "";
            case VACUOUS -> "[]";
            case INDEX -> "[" + index + "]";
        };
    }
}
