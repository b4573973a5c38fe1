package org.nd.parser;

import org.nd.expression.And;
import org.nd.expression.Atom;
import org.nd.expression.Bottom;
import org.nd.expression.Expression;
import org.nd.expression.Implies;
import org.nd.expression.Not;
import org.nd.expression.Or;
import org.nd.parser.FormulaParseException.Reason;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * FASE 2 - Costruzione dell'albero dalla forma prefissa
 *
 * Scansione da sinistra a destra con una pila di nodi in attesa:
 * - su un connettivo si apre un nuovo nodo in attesa dei figli
 * - su un operando si aggiunge una foglia al nodo in cima
 * - dopo ogni aggiunta, finché il nodo in cima è saturo (1 figlio per la
 *   negazione, 2 per i binari) lo si chiude, si istanzia l'Expression e la si
 *   aggiunge come figlio al nodo sottostante
 * - quando la pila si svuota il nodo chiuso è il risultato
 */
final class PrefixTreeBuilder {

    private static final Logger LOGGER = Logger.getLogger(PrefixTreeBuilder.class.getName());

    /**
     * Nodo in costruzione: connettivo e figli raccolti finora.
     */
    private static final class PendingNode {
        final char operator;
        final List<Expression> children = new ArrayList<>(2);

        PendingNode(char operator) {
            this.operator = operator;
        }

        boolean isSaturated() {
            return children.size() == Symbols.arity(operator);
        }

        Expression toExpression() {
            return switch (operator) {
                case Symbols.NOT -> new Not(children.get(0));
                case Symbols.AND -> new And(children.get(0), children.get(1));
                case Symbols.OR -> new Or(children.get(0), children.get(1));
                case Symbols.IMPLIES -> new Implies(children.get(0), children.get(1));
                default -> throw new IllegalStateException("Connettivo sconosciuto: " + operator);
            };
        }
    }

    /**
     * Ricostruisce l'albero della formula dalla stringa prefissa.
     *
     * @param prefix formula prefissa a simboli canonici
     * @return albero della formula
     * @throws FormulaParseException se la stringa non descrive esattamente una formula
     */
    Expression build(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new FormulaParseException(Reason.EMPTY_INPUT, "Forma prefissa vuota");
        }

        Deque<PendingNode> frames = new ArrayDeque<>();

        for (int i = 0; i < prefix.length(); i++) {
            char symbol = prefix.charAt(i);

            if (Symbols.isOperator(symbol)) {
                frames.push(new PendingNode(symbol));
                continue;
            }

            Expression completed = attach(frames, leaf(symbol));
            if (completed != null) {
                if (i != prefix.length() - 1) {
                    throw new FormulaParseException(Reason.UNEXPECTED_OPERAND,
                            "Simboli in eccesso dopo la formula completa: " + prefix.substring(i + 1));
                }
                LOGGER.finest("Albero ricostruito da " + prefix + ": " + completed);
                return completed;
            }
        }

        throw new FormulaParseException(Reason.MISSING_OPERAND,
                "Forma prefissa incompleta, nodi in attesa: " + frames.size());
    }

    /**
     * Aggiunge un figlio al nodo in cima e chiude a cascata i nodi saturi.
     *
     * @return la formula completa se la pila si è svuotata, altrimenti null
     */
    private Expression attach(Deque<PendingNode> frames, Expression child) {
        Expression node = child;

        while (true) {
            if (frames.isEmpty()) {
                return node;
            }

            PendingNode top = frames.peek();
            top.children.add(node);
            if (!top.isSaturated()) {
                return null;
            }

            frames.pop();
            node = top.toExpression();
        }
    }

    private Expression leaf(char symbol) {
        if (symbol == Symbols.BOTTOM) {
            return Bottom.INSTANCE;
        }
        if (!Character.isLetter(symbol)) {
            throw new FormulaParseException(Reason.INVALID_SYMBOL, "Simbolo non valido nella forma prefissa: " + symbol);
        }
        return new Atom(String.valueOf(symbol));
    }
}
