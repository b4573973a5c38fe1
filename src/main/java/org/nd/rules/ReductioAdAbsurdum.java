package org.nd.rules;

import org.nd.expression.Expression;
import org.nd.expression.Not;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;
import org.nd.proof.Reference;

/**
 * REGOLA RAA - Reductio ad absurdum
 *
 * CITAZIONI, IN ORDINE:
 * 1. Prima riga, senza scaricamento
 * 2. Seconda riga, con scaricamento vacuo o per indice i
 *
 * CONDIZIONI:
 * - Il contenuto della candidata è una negazione ~A
 * - Vacuo: assunzioni(candidata) = unione delle due righe, A libero
 * - Per indice: i appartiene alle assunzioni della seconda riga,
 *   assunzioni(candidata) = unione \ {i}, e A è l'assunzione i
 */
public final class ReductioAdAbsurdum extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.RAA;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (candidate.references().size() != 2) {
            return reject(candidate, "attese due citazioni");
        }

        Reference firstReference = candidate.references().get(0);
        Reference secondReference = candidate.references().get(1);
        Discharge discharge = secondReference.discharge();
        if (!firstReference.discharge().isNone() || discharge.isNone()) {
            return reject(candidate, "la prima citazione non scarica, la seconda deve scaricare");
        }

        ProofLine first = proof.line(firstReference.line());
        ProofLine second = proof.line(secondReference.line());

        if (candidate.content().type() != Expression.Type.NOT) {
            return reject(candidate, "il contenuto non è una negazione");
        }

        if (discharge.isVacuous()) {
            if (!candidate.assumptions().equals(union(first, second))) {
                return reject(candidate, "assunzioni diverse dall'unione delle righe citate");
            }
            return true;
        }

        int index = discharge.index();
        if (!second.assumptions().contains(index)) {
            return reject(candidate, "la seconda riga non dipende dall'assunzione " + index);
        }
        if (!candidate.assumptions().equals(without(union(first, second), index))) {
            return reject(candidate, "assunzioni diverse dall'unione meno " + index);
        }

        Expression negated = ((Not) candidate.content()).operand();
        if (!negated.equals(proof.assumption(index))) {
            return reject(candidate, "la formula negata non è l'assunzione " + index);
        }
        return true;
    }
}
