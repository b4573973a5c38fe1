package org.nd.rules;

import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

import java.util.Set;

/**
 * Regola A: introduzione di una nuova assunzione.
 *
 * La riga non cita nulla, dipende solo da sé stessa e riceve il prossimo
 * indice libero della mappa delle assunzioni. Il contenuto è libero.
 */
public final class AssumptionRule extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.ASSUMPTION;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (!candidate.references().isEmpty()) {
            return reject(candidate, "un'assunzione non cita righe");
        }

        int freshIndex = proof.assumptionCount();
        if (!candidate.assumptions().equals(Set.of(freshIndex))) {
            return reject(candidate, "assunzioni attese {" + freshIndex + "}");
        }
        return true;
    }
}
