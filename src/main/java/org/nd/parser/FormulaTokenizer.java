package org.nd.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * TOKENIZER - Normalizzazione del testo tramite lexer ANTLR
 *
 * Converte il testo della formula in una sequenza di token a simbolo canonico,
 * riconducendo ogni grafia accettata al suo connettivo:
 * - Negazione: ~ ! ¬
 * - Congiunzione: ^ & ∧
 * - Disgiunzione: v | ∨
 * - Implicazione: → -> -->
 * - Contraddizione: ⊥
 *
 * Gli spazi sono scartati dal lexer; ogni lettera diversa da 'v' è un atomo.
 */
final class FormulaTokenizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaTokenizer.class.getName());

    /**
     * Esegue l'analisi lessicale completa del testo.
     *
     * @param text formula in notazione infissa
     * @return token normalizzati nell'ordine del testo (vuota se solo spazi)
     * @throws FormulaParseException se il testo contiene simboli non riconosciuti
     */
    List<FormulaToken> tokenize(String text) {
        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();

        List<FormulaToken> tokens = new ArrayList<>();
        for (Token token : lexer.getAllTokens()) {
            tokens.add(new FormulaToken(canonicalSymbol(token), token.getStartIndex()));
        }

        LOGGER.finest("Token riconosciuti: " + tokens);
        return tokens;
    }

    /**
     * Riconduce il token ANTLR al simbolo canonico a un carattere.
     */
    private char canonicalSymbol(Token token) {
        return switch (token.getType()) {
            case FormulaLexer.NOT -> Symbols.NOT;
            case FormulaLexer.AND -> Symbols.AND;
            case FormulaLexer.OR -> Symbols.OR;
            case FormulaLexer.IMPLIES -> Symbols.IMPLIES;
            case FormulaLexer.BOTTOM -> Symbols.BOTTOM;
            case FormulaLexer.LPAR -> Symbols.LPAR;
            case FormulaLexer.RPAR -> Symbols.RPAR;
            case FormulaLexer.ATOM -> token.getText().charAt(0);
            default -> throw new FormulaParseException(FormulaParseException.Reason.INVALID_SYMBOL,
                    "Simbolo non riconosciuto '" + token.getText() + "' in posizione " + token.getStartIndex());
        };
    }
}
