package org.nd.rules;

import java.util.Optional;

/**
 * Regole di inferenza della deduzione naturale, con il simbolo usato
 * nella colonna "regola" di una dimostrazione.
 */
public enum Rule {
    ASSUMPTION("A"),
    AND_ELIM("&E"),
    AND_INTRO("&I"),
    DNE("~~E"),          // Eliminazione doppia negazione
    NOT_ELIM("~E"),
    NOT_INTRO("~I"),
    OR_INTRO("vI"),
    OR_ELIM("vE"),
    IMPLIES_INTRO("-->I"),
    IMPLIES_ELIM("-->E"),
    RAA("RAA");          // Reductio ad absurdum

    private final String symbol;

    Rule(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Cerca la regola con il simbolo indicato.
     *
     * @param symbol simbolo come stampato da {@link #toString()}
     * @return regola corrispondente, vuota per simboli sconosciuti
     */
    public static Optional<Rule> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        for (Rule rule : values()) {
            if (rule.symbol.equals(trimmed)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
