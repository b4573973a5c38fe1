package org.nd.expression;

/**
 * Negazione ~A.
 *
 * @param operand sottoformula negata (non null)
 */
public record Not(Expression operand) implements Expression {

    public Not {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
    }

    @Override
    public Type type() {
        return Type.NOT;
    }

    @Override
    public String toString() {
        return render();
    }
}
