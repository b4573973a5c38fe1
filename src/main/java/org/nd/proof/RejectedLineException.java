package org.nd.proof;

import org.nd.rules.Rule;

/**
 * Riga rifiutata da {@link Proof#addLine(ProofLine)}.
 *
 * Il motivo del rifiuto non è dettagliato: la verifica è binaria e la causa
 * è disponibile solo nel log a livello FINE.
 */
public class RejectedLineException extends RuntimeException {

    private final int lineIndex;
    private final Rule rule;

    public RejectedLineException(int lineIndex, ProofLine line) {
        super("Riga " + lineIndex + " non giustificata dalla regola " + line.rule() + ": " + line);
        this.lineIndex = lineIndex;
        this.rule = line.rule();
    }

    /**
     * Indice che la riga avrebbe avuto se accettata.
     */
    public int getLineIndex() {
        return lineIndex;
    }

    public Rule getRule() {
        return rule;
    }
}
