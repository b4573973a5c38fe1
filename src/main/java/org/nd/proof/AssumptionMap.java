package org.nd.proof;

import org.nd.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MAPPA DELLE ASSUNZIONI - Sequenza ordinata in sola aggiunta
 *
 * Associa a ogni assunzione mai introdotta (premessa o regola A) il suo indice,
 * pari alla posizione nella sequenza. Le voci non vengono mai rimosse né
 * modificate: un indice resta valido per tutta la vita della dimostrazione.
 */
public final class AssumptionMap {

    private final List<Expression> entries = new ArrayList<>();

    /**
     * Registra una nuova assunzione.
     *
     * @param assumption formula assunta
     * @return indice assegnato (pari alla dimensione precedente)
     */
    int append(Expression assumption) {
        if (assumption == null) {
            throw new IllegalArgumentException("Assunzione non può essere null");
        }
        entries.add(assumption);
        return entries.size() - 1;
    }

    /**
     * @throws IndexOutOfBoundsException se l'indice non è mai stato assegnato
     */
    public Expression get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Vista in sola lettura, aggiornata con le aggiunte successive.
     */
    public List<Expression> asList() {
        return Collections.unmodifiableList(entries);
    }
}
