package org.nd.expression;

/**
 * Variabile proposizionale. Due atomi sono uguali se hanno lo stesso nome.
 *
 * @param name nome della variabile (non null, non vuoto)
 */
public record Atom(String name) implements Expression {

    public Atom {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile atomica non può essere null o vuoto");
        }
        name = name.trim();
    }

    @Override
    public Type type() {
        return Type.ATOM;
    }

    @Override
    public String toString() {
        return name;
    }
}
