package org.nd.parser;

/**
 * Token normalizzato: simbolo canonico e colonna (base 0) nel testo originale.
 */
record FormulaToken(char symbol, int position) {

    boolean isOperand() {
        return symbol != Symbols.LPAR && symbol != Symbols.RPAR && !Symbols.isOperator(symbol);
    }

    @Override
    public String toString() {
        return symbol + "@" + position;
    }
}
