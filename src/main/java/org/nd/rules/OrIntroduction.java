package org.nd.rules;

import org.nd.expression.Expression;
import org.nd.expression.Or;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Regola vI: da A si ricava A v B oppure B v A, con le stesse assunzioni.
 */
public final class OrIntroduction extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.OR_INTRO;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (candidate.content().type() != Expression.Type.OR) {
            return reject(candidate, "il contenuto non è una disgiunzione");
        }

        if (!hasReferenceShape(candidate, Discharge.Kind.NONE)) {
            return reject(candidate, "attesa una citazione senza scaricamento");
        }

        ProofLine disjunctLine = cited(proof, candidate, 0);
        if (!candidate.assumptions().equals(disjunctLine.assumptions())) {
            return reject(candidate, "assunzioni diverse dalla riga citata");
        }

        Or disjunction = (Or) candidate.content();
        Expression disjunct = disjunctLine.content();
        if (!disjunct.equals(disjunction.left()) && !disjunct.equals(disjunction.right())) {
            return reject(candidate, "la riga citata non è un disgiunto di " + disjunction);
        }
        return true;
    }
}
