package org.nd.parser;

/**
 * Errore di parsing di una formula testuale malformata.
 *
 * Il motivo è esposto come {@link Reason} per permettere al chiamante di
 * distinguere i casi senza analizzare il messaggio.
 */
public class FormulaParseException extends RuntimeException {

    /**
     * Cause di fallimento del parsing.
     */
    public enum Reason {
        EMPTY_INPUT,            // Stringa vuota o composta solo da spazi
        UNBALANCED_PARENTHESES, // Parentesi non chiuse o chiuse senza apertura
        MISSING_OPERAND,        // Connettivo senza uno dei suoi operandi
        UNEXPECTED_OPERAND,     // Due operandi consecutivi, es. atomi multi-carattere
        INVALID_SYMBOL          // Carattere non riconosciuto dal lessico
    }

    private final Reason reason;

    public FormulaParseException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
