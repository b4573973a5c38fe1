package org.nd.expression;

/**
 * STAMPA FORMULE - Rappresentazione infissa con parentesi minime
 *
 * REGOLE DI PARENTESIZZAZIONE:
 * - Un figlio composto va tra parentesi se la sua precedenza è minore di quella del padre
 * - Il figlio destro di un nodo binario va tra parentesi anche a parità di precedenza
 * - Atomi e ⊥ non sono mai tra parentesi
 *
 * I connettivi binari associano a sinistra, quindi le catene (p ^ q) ^ r
 * vengono stampate senza raggruppamento come p ^ q ^ r, mentre p ^ (q ^ r)
 * mantiene le parentesi. Ogni stampa è rileggibile dal parser e produce lo
 * stesso albero.
 *
 * FORMATO OUTPUT:
 * - Negazioni: ~p, ~~p, ~(p ^ q)
 * - Binari: operando simbolo operando, separati da un singolo spazio
 */
final class ExpressionPrinter {

    private ExpressionPrinter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    static String print(Expression expression, Notation notation) {
        return switch (expression.type()) {
            case ATOM -> ((Atom) expression).name();
            case BOTTOM -> notation.symbol(Expression.Type.BOTTOM);
            case NOT -> printNegation((Not) expression, notation);
            case AND, OR, IMPLIES -> printBinary((BinaryExpression) expression, notation);
        };
    }

    private static String printNegation(Not negation, Notation notation) {
        Expression operand = negation.operand();
        String inside = print(operand, notation);

        if (needsParentheses(operand, Expression.Type.NOT, false)) {
            inside = "(" + inside + ")";
        }
        return notation.symbol(Expression.Type.NOT) + inside;
    }

    private static String printBinary(BinaryExpression binary, Notation notation) {
        String left = print(binary.left(), notation);
        String right = print(binary.right(), notation);

        if (needsParentheses(binary.left(), binary.type(), false)) {
            left = "(" + left + ")";
        }
        if (needsParentheses(binary.right(), binary.type(), true)) {
            right = "(" + right + ")";
        }
        return left + " " + notation.symbol(binary.type()) + " " + right;
    }

    /**
     * Decide se un figlio richiede parentesi rispetto al nodo padre.
     *
     * @param child sottoformula da stampare
     * @param parent variante del nodo padre
     * @param rightOperand true se il figlio è l'operando destro di un nodo binario
     */
    private static boolean needsParentheses(Expression child, Expression.Type parent, boolean rightOperand) {
        Expression.Type childType = child.type();
        if (!childType.isComposite()) {
            return false;
        }
        if (rightOperand) {
            return childType.precedence() <= parent.precedence();
        }
        return childType.precedence() < parent.precedence();
    }

    /**
     * Valida gli operandi dei nodi binari al momento della costruzione.
     *
     * @throws IllegalArgumentException se uno degli operandi è null
     */
    static void requireOperands(Expression left, Expression right, String operatorName) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi null per " + operatorName);
        }
    }
}
