package org.nd.expression;

/**
 * Costante di contraddizione ⊥. Istanza unica, uguale solo a sé stessa.
 */
public enum Bottom implements Expression {
    INSTANCE;

    /** Glifo usato in stampa e riconosciuto dal parser */
    public static final String SYMBOL = "⊥";

    @Override
    public Type type() {
        return Type.BOTTOM;
    }

    @Override
    public String toString() {
        return SYMBOL;
    }
}
