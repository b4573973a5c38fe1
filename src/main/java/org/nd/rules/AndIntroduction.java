package org.nd.rules;

import org.nd.expression.And;
import org.nd.expression.Expression;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Regola &I: da A (prima citazione) e B (seconda citazione) si ricava A ^ B.
 *
 * L'ordine delle citazioni è significativo: il primo congiunto deve essere
 * il contenuto della prima riga citata. Le assunzioni sono l'unione di
 * quelle delle due righe.
 */
public final class AndIntroduction extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.AND_INTRO;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (!hasReferenceShape(candidate, Discharge.Kind.NONE, Discharge.Kind.NONE)) {
            return reject(candidate, "attese due citazioni senza scaricamento");
        }

        ProofLine leftLine = cited(proof, candidate, 0);
        ProofLine rightLine = cited(proof, candidate, 1);
        if (!candidate.assumptions().equals(union(leftLine, rightLine))) {
            return reject(candidate, "assunzioni diverse dall'unione delle righe citate");
        }

        if (candidate.content().type() != Expression.Type.AND) {
            return reject(candidate, "il contenuto non è una congiunzione");
        }

        And conjunction = (And) candidate.content();
        if (!conjunction.left().equals(leftLine.content()) || !conjunction.right().equals(rightLine.content())) {
            return reject(candidate, "i congiunti non corrispondono alle righe citate, nell'ordine");
        }
        return true;
    }
}
