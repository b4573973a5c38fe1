package org.nd.expression;

/**
 * FORMULA PROPOSIZIONALE - Albero immutabile di una formula
 *
 * Rappresenta una formula della logica proposizionale come albero di nodi
 * immutabili, condivisibili liberamente tra righe diverse di una dimostrazione.
 *
 * VARIANTI SUPPORTATE:
 * - Atomo: variabile proposizionale opaca (p, q, r, ...)
 * - Contraddizione: costante ⊥, uguale solo a sé stessa
 * - Negazione: ~A
 * - Congiunzione: A ^ B
 * - Disgiunzione: A v B
 * - Implicazione: A -> B
 *
 * UGUAGLIANZA:
 * - Strutturale: stessa variante e figli uguali ricorsivamente
 * - Sensibile all'ordine degli operandi: A ^ B è diverso da B ^ A
 *
 * La scelta della variante avviene tramite {@link #type()} e switch esaustivo,
 * senza ispezione dinamica dei tipi.
 */
public interface Expression {

    /**
     * Varianti di nodo con relativa precedenza di stampa.
     * Precedenza decrescente: negazione, congiunzione, disgiunzione, implicazione.
     */
    enum Type {
        ATOM(5, false),
        BOTTOM(5, false),
        NOT(4, true),
        AND(3, true),
        OR(2, true),
        IMPLIES(1, true);

        private final int precedence;
        private final boolean composite;

        Type(int precedence, boolean composite) {
            this.precedence = precedence;
            this.composite = composite;
        }

        public int precedence() {
            return precedence;
        }

        /**
         * @return true per i nodi con sottoformule (mai per atomi e ⊥)
         */
        public boolean isComposite() {
            return composite;
        }
    }

    /**
     * @return variante del nodo radice
     */
    Type type();

    /**
     * Genera la rappresentazione infissa canonica con parentesi minime.
     *
     * @param notation glifi da usare per i connettivi
     * @return formula in notazione infissa, rileggibile dal parser
     */
    default String render(Notation notation) {
        return ExpressionPrinter.print(this, notation);
    }

    /**
     * Rappresentazione infissa nella notazione di default (ASCII).
     */
    default String render() {
        return render(Notation.ASCII);
    }
}
