package org.nd.proof;

import org.nd.expression.Expression;

/**
 * Vista in sola lettura dello stato di una dimostrazione, usata dai
 * controlli delle regole.
 */
public interface ProofState {

    /**
     * Numero di righe accettate; coincide con l'indice della prossima riga.
     */
    int lineCount();

    /**
     * @throws IndexOutOfBoundsException se la riga non esiste
     */
    ProofLine line(int index);

    /**
     * Numero di assunzioni introdotte; coincide con il prossimo indice libero.
     */
    int assumptionCount();

    /**
     * @throws IndexOutOfBoundsException se l'assunzione non esiste
     */
    Expression assumption(int index);
}
