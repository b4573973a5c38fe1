package org.nd.rules;

import org.nd.expression.Bottom;
import org.nd.expression.Expression;
import org.nd.expression.Not;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Regola ~E: da A e ~A, citate in qualsiasi ordine, si ricava ⊥.
 * Le assunzioni sono l'unione di quelle delle due righe.
 */
public final class NotElimination extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.NOT_ELIM;
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

        if (!isNegationOf(first.content(), second.content()) && !isNegationOf(second.content(), first.content())) {
            return reject(candidate, "le righe citate non sono una formula e la sua negazione");
        }

        if (candidate.content() != Bottom.INSTANCE) {
            return reject(candidate, "il contenuto deve essere " + Bottom.SYMBOL);
        }
        return true;
    }

    private static boolean isNegationOf(Expression negation, Expression formula) {
        return negation.type() == Expression.Type.NOT && ((Not) negation).operand().equals(formula);
    }
}
