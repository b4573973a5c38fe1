package org.nd.parser;

import org.nd.parser.FormulaParseException.Reason;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * FASE 1 - Linearizzazione da notazione infissa a prefissa
 *
 * Algoritmo a doppia pila (operatori e operandi) in stile shunting-yard:
 * - '(' viene impilata sulla pila operatori
 * - ')' riduce gli operatori fino alla '(' corrispondente, che viene scartata
 * - un operando viene impilato sulla pila operandi
 * - un connettivo binario riduce gli operatori in cima con priorità maggiore
 *   o uguale, poi viene impilato (associatività a sinistra)
 * - la negazione è prefissa: viene impilata senza ridurre nulla
 * - a fine input si riducono tutti gli operatori rimasti
 *
 * RIDUZIONE:
 * - unaria: operatore + operando
 * - binaria: operatore + operandoSinistro + operandoDestro, dove il sinistro è
 *   il secondo estratto dalla pila; la fase 2 ricostruisce i figli da sinistra
 *   a destra nello stesso ordine
 *
 * VALIDAZIONE:
 * Lo scanner tiene traccia di cosa si aspetta (operando o connettivo binario)
 * per rifiutare input come "p q", "p ^", "^ p" senza produrre output parziale.
 */
final class InfixToPrefixConverter {

    private static final Logger LOGGER = Logger.getLogger(InfixToPrefixConverter.class.getName());

    /**
     * Converte i token infissi nella stringa prefissa equivalente.
     *
     * @param tokens token normalizzati (non vuota)
     * @return formula in notazione prefissa a simboli canonici
     * @throws FormulaParseException se la sequenza non è una formula ben formata
     */
    String convert(List<FormulaToken> tokens) {
        if (tokens.isEmpty()) {
            throw new FormulaParseException(Reason.EMPTY_INPUT, "Formula vuota");
        }

        Deque<Character> operators = new ArrayDeque<>();
        Deque<String> operands = new ArrayDeque<>();
        boolean expectOperand = true;

        for (FormulaToken token : tokens) {
            char symbol = token.symbol();

            if (symbol == Symbols.LPAR) {
                requireOperandPosition(expectOperand, token);
                operators.push(symbol);
            } else if (symbol == Symbols.RPAR) {
                requireOperatorPosition(expectOperand, token);
                closeParenthesis(operators, operands, token);
            } else if (token.isOperand()) {
                requireOperandPosition(expectOperand, token);
                operands.push(String.valueOf(symbol));
                expectOperand = false;
            } else if (Symbols.isUnary(symbol)) {
                requireOperandPosition(expectOperand, token);
                operators.push(symbol);
            } else {
                requireOperatorPosition(expectOperand, token);
                // Riduce gli operatori con priorità maggiore o uguale (associatività a sinistra)
                while (!operators.isEmpty() && operators.peek() != Symbols.LPAR
                        && Symbols.priority(operators.peek()) >= Symbols.priority(symbol)) {
                    reduce(operators.pop(), operands);
                }
                operators.push(symbol);
                expectOperand = true;
            }
        }

        if (expectOperand) {
            throw new FormulaParseException(Reason.MISSING_OPERAND, "Formula terminata senza l'ultimo operando");
        }

        // Svuotamento finale della pila operatori
        while (!operators.isEmpty()) {
            char operator = operators.pop();
            if (operator == Symbols.LPAR) {
                throw new FormulaParseException(Reason.UNBALANCED_PARENTHESES, "Parentesi aperta non chiusa");
            }
            reduce(operator, operands);
        }

        String prefix = operands.pop();
        LOGGER.finest("Forma prefissa: " + prefix);
        return prefix;
    }

    /**
     * Riduce gli operatori fino alla parentesi aperta corrispondente.
     */
    private void closeParenthesis(Deque<Character> operators, Deque<String> operands, FormulaToken token) {
        while (!operators.isEmpty() && operators.peek() != Symbols.LPAR) {
            reduce(operators.pop(), operands);
        }
        if (operators.isEmpty()) {
            throw new FormulaParseException(Reason.UNBALANCED_PARENTHESES,
                    "Parentesi chiusa senza apertura in posizione " + token.position());
        }
        operators.pop();
    }

    /**
     * Combina un operatore con i suoi operandi in cima alla pila operandi.
     */
    private void reduce(char operator, Deque<String> operands) {
        if (operands.size() < Symbols.arity(operator)) {
            throw new FormulaParseException(Reason.MISSING_OPERAND,
                    "Operandi insufficienti per il connettivo '" + operator + "'");
        }

        if (Symbols.isUnary(operator)) {
            operands.push(operator + operands.pop());
        } else {
            String first = operands.pop();
            String second = operands.pop();
            operands.push(operator + second + first);
        }
    }

    private void requireOperandPosition(boolean expectOperand, FormulaToken token) {
        if (!expectOperand) {
            throw new FormulaParseException(Reason.UNEXPECTED_OPERAND,
                    "Atteso un connettivo binario in posizione " + token.position()
                            + ", trovato '" + token.symbol() + "' (gli atomi sono di un solo carattere)");
        }
    }

    private void requireOperatorPosition(boolean expectOperand, FormulaToken token) {
        if (expectOperand) {
            throw new FormulaParseException(Reason.MISSING_OPERAND,
                    "Operando mancante prima di '" + token.symbol() + "' in posizione " + token.position());
        }
    }
}
