package org.nd.rules;

import org.nd.expression.Expression;
import org.nd.expression.Not;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Regola ~~E: da ~~A si ricava A, con le stesse assunzioni.
 */
public final class DoubleNegationElimination extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.DNE;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (!hasReferenceShape(candidate, Discharge.Kind.NONE)) {
            return reject(candidate, "attesa una citazione senza scaricamento");
        }

        ProofLine citedLine = cited(proof, candidate, 0);
        if (!candidate.assumptions().equals(citedLine.assumptions())) {
            return reject(candidate, "assunzioni diverse dalla riga citata");
        }

        Expression outer = citedLine.content();
        if (outer.type() != Expression.Type.NOT || ((Not) outer).operand().type() != Expression.Type.NOT) {
            return reject(candidate, "la riga citata non è una doppia negazione");
        }

        Expression inner = ((Not) ((Not) outer).operand()).operand();
        if (!inner.equals(candidate.content())) {
            return reject(candidate, "il contenuto non è " + inner);
        }
        return true;
    }
}
