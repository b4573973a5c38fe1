package org.nd.parser;

/**
 * Simboli canonici a un carattere usati nella forma prefissa intermedia.
 *
 * PRIORITÀ DEI CONNETTIVI (crescente):
 * - Implicazione: 1
 * - Disgiunzione: 2
 * - Congiunzione: 3
 * - Negazione: 4
 *
 * Le parentesi non sono operatori e non partecipano al confronto di priorità.
 */
final class Symbols {

    static final char NOT = '~';
    static final char AND = '^';
    static final char OR = 'v';
    static final char IMPLIES = '→';
    static final char BOTTOM = '⊥';
    static final char LPAR = '(';
    static final char RPAR = ')';

    private Symbols() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    static boolean isOperator(char symbol) {
        return symbol == NOT || isBinary(symbol);
    }

    static boolean isUnary(char symbol) {
        return symbol == NOT;
    }

    static boolean isBinary(char symbol) {
        return symbol == AND || symbol == OR || symbol == IMPLIES;
    }

    /**
     * @return numero di operandi richiesti dal connettivo
     */
    static int arity(char operator) {
        return isUnary(operator) ? 1 : 2;
    }

    /**
     * @param operator connettivo canonico
     * @return priorità del connettivo (più alta = lega di più)
     * @throws IllegalArgumentException se il simbolo non è un connettivo
     */
    static int priority(char operator) {
        return switch (operator) {
            case IMPLIES -> 1;
            case OR -> 2;
            case AND -> 3;
            case NOT -> 4;
            default -> throw new IllegalArgumentException("Simbolo non è un connettivo: " + operator);
        };
    }
}
