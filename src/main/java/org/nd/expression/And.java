package org.nd.expression;

/**
 * Congiunzione A ^ B.
 */
public record And(Expression left, Expression right) implements BinaryExpression {

    public And {
        ExpressionPrinter.requireOperands(left, right, "congiunzione");
    }

    @Override
    public Type type() {
        return Type.AND;
    }

    @Override
    public String toString() {
        return render();
    }
}
