package org.nd.rules;

import org.nd.expression.And;
import org.nd.expression.Expression;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Regola &E: da A ^ B si ricava A oppure B, con le stesse assunzioni.
 */
public final class AndElimination extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.AND_ELIM;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (!hasReferenceShape(candidate, Discharge.Kind.NONE)) {
            return reject(candidate, "attesa una citazione senza scaricamento");
        }

        ProofLine conjunctionLine = cited(proof, candidate, 0);
        if (!candidate.assumptions().equals(conjunctionLine.assumptions())) {
            return reject(candidate, "assunzioni diverse dalla riga citata");
        }

        Expression cited = conjunctionLine.content();
        if (cited.type() != Expression.Type.AND) {
            return reject(candidate, "la riga citata non è una congiunzione");
        }

        And conjunction = (And) cited;
        if (!candidate.content().equals(conjunction.left()) && !candidate.content().equals(conjunction.right())) {
            return reject(candidate, "il contenuto non è un congiunto di " + conjunction);
        }
        return true;
    }
}
