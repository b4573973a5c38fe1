package org.nd.rules;

import org.nd.expression.Expression;
import org.nd.expression.Implies;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Regola -->E (modus ponens): da A -> B e A, citate in qualsiasi ordine, si ricava B.
 * Le assunzioni sono l'unione di quelle delle due righe.
 */
public final class ImpliesElimination extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.IMPLIES_ELIM;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (!hasReferenceShape(candidate, Discharge.Kind.NONE, Discharge.Kind.NONE)) {
            return reject(candidate, "attese due citazioni senza scaricamento");
        }

        ProofLine first = cited(proof, candidate, 0);
        ProofLine second = cited(proof, candidate, 1);
        if (!candidate.assumptions().equals(union(first, second))) {
            return reject(candidate, "assunzioni diverse dall'unione delle righe citate");
        }

        Expression conclusion = candidate.content();
        if (!isModusPonens(first.content(), second.content(), conclusion)
                && !isModusPonens(second.content(), first.content(), conclusion)) {
            return reject(candidate, "le righe citate non formano un modus ponens verso " + conclusion);
        }
        return true;
    }

    private static boolean isModusPonens(Expression implication, Expression antecedent, Expression conclusion) {
        if (implication.type() != Expression.Type.IMPLIES) {
            return false;
        }
        Implies implies = (Implies) implication;
        return implies.left().equals(antecedent) && implies.right().equals(conclusion);
    }
}
