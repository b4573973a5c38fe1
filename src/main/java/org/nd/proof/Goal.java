package org.nd.proof;

import org.nd.expression.Expression;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Obiettivo della dimostrazione: formula da derivare e assunzioni ammesse.
 */
public record Goal(Set<Integer> assumptions, Expression content) {

    public Goal {
        if (assumptions == null || content == null) {
            throw new IllegalArgumentException("Assunzioni e contenuto dell'obiettivo non possono essere null");
        }
        assumptions = Collections.unmodifiableSet(new TreeSet<>(assumptions));
    }

    /**
     * @return true se la riga ha esattamente le assunzioni e il contenuto dell'obiettivo
     */
    public boolean isReachedBy(ProofLine line) {
        return line.assumptions().equals(assumptions) && line.content().equals(content);
    }
}
