package org.nd.parser;

import org.nd.expression.Expression;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Da testo infisso ad albero {@link Expression}
 *
 * PIPELINE:
 * 1. Tokenizzazione ANTLR: grafie multiple ricondotte a simboli canonici
 * 2. Linearizzazione infissa -> prefissa (doppia pila, priorità dei connettivi)
 * 3. Costruzione dell'albero dalla stringa prefissa
 *
 * SINTASSI ACCETTATA:
 * - Negazione ~, congiunzione ^, disgiunzione v, implicazione →, ->, -->
 *   (più le varianti Unicode e ! & |)
 * - Contraddizione ⊥
 * - Atomi di una sola lettera, parentesi e spazi opzionali
 *
 * Il parser è privo di stato: ogni invocazione è una funzione pura dal testo
 * alla formula e la stessa istanza può essere condivisa tra thread.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private final FormulaTokenizer tokenizer = new FormulaTokenizer();
    private final InfixToPrefixConverter linearizer = new InfixToPrefixConverter();
    private final PrefixTreeBuilder treeBuilder = new PrefixTreeBuilder();

    /**
     * Converte una formula testuale nel suo albero.
     *
     * @param text formula in notazione infissa
     * @return albero della formula
     * @throws FormulaParseException se il testo è vuoto o malformato
     */
    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaParseException(FormulaParseException.Reason.EMPTY_INPUT, "Formula vuota");
        }

        List<FormulaToken> tokens = tokenizer.tokenize(text);
        String prefix = linearizer.convert(tokens);
        Expression expression = treeBuilder.build(prefix);

        LOGGER.fine("Formula analizzata: " + text.trim() + " -> " + expression);
        return expression;
    }

    /**
     * Variante senza eccezioni di {@link #parse(String)}.
     *
     * @param text formula in notazione infissa
     * @return albero della formula, vuoto se il testo è malformato
     */
    public Optional<Expression> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (FormulaParseException e) {
            LOGGER.fine("Formula rifiutata [" + e.getReason() + "]: " + e.getMessage());
            return Optional.empty();
        }
    }
}
