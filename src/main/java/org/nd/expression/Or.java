package org.nd.expression;

/**
 * Disgiunzione A v B.
 */
public record Or(Expression left, Expression right) implements BinaryExpression {

    public Or {
        ExpressionPrinter.requireOperands(left, right, "disgiunzione");
    }

    @Override
    public Type type() {
        return Type.OR;
    }

    @Override
    public String toString() {
        return render();
    }
}
