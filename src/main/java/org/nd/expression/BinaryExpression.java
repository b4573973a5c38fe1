package org.nd.expression;

/**
 * Nodo con due operandi ordinati (congiunzione, disgiunzione, implicazione).
 */
public interface BinaryExpression extends Expression {

    Expression left();

    Expression right();
}
