package org.nd.rules;

import org.nd.expression.Expression;
import org.nd.expression.Implies;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;
import org.nd.proof.Reference;

/**
 * REGOLA -->I - Introduzione dell'implicazione
 *
 * Dalla riga che deriva B si ricava A -> B scaricando un'assunzione.
 *
 * - Per indice i: i appartiene alle assunzioni della riga citata, le assunzioni
 *   della candidata sono quelle citate meno i, e A è l'assunzione i
 * - Vacuo: stesse assunzioni della riga citata, A libero
 */
public final class ImpliesIntroduction extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.IMPLIES_INTRO;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (candidate.references().size() != 1) {
            return reject(candidate, "attesa una sola citazione");
        }

        Reference reference = candidate.references().get(0);
        Discharge discharge = reference.discharge();
        if (discharge.isNone()) {
            return reject(candidate, "la citazione deve scaricare un'assunzione");
        }

        if (candidate.content().type() != Expression.Type.IMPLIES) {
            return reject(candidate, "il contenuto non è un'implicazione");
        }

        ProofLine consequentLine = proof.line(reference.line());
        Implies implication = (Implies) candidate.content();

        if (discharge.isVacuous()) {
            if (!candidate.assumptions().equals(consequentLine.assumptions())) {
                return reject(candidate, "assunzioni diverse dalla riga citata");
            }
        } else {
            int index = discharge.index();
            if (!consequentLine.assumptions().contains(index)) {
                return reject(candidate, "la riga citata non dipende dall'assunzione " + index);
            }
            if (!candidate.assumptions().equals(without(consequentLine.assumptions(), index))) {
                return reject(candidate, "assunzioni diverse da quelle citate meno " + index);
            }
            if (!implication.left().equals(proof.assumption(index))) {
                return reject(candidate, "l'antecedente non è l'assunzione " + index);
            }
        }

        if (!implication.right().equals(consequentLine.content())) {
            return reject(candidate, "il conseguente non è il contenuto della riga citata");
        }
        return true;
    }
}
