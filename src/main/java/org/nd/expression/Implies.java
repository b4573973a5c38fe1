package org.nd.expression;

/**
 * Implicazione A -> B.
 *
 * @param left antecedente
 * @param right conseguente
 */
public record Implies(Expression left, Expression right) implements BinaryExpression {

    public Implies {
        ExpressionPrinter.requireOperands(left, right, "implicazione");
    }

    @Override
    public Type type() {
        return Type.IMPLIES;
    }

    @Override
    public String toString() {
        return render();
    }
}
