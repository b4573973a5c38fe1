package org.nd.rules;

import org.nd.expression.Bottom;
import org.nd.expression.Expression;
import org.nd.expression.Not;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;
import org.nd.proof.Reference;

/**
 * REGOLA ~I - Introduzione della negazione
 *
 * Da una riga che deriva ⊥ si ricava ~A scaricando un'assunzione.
 *
 * SCARICAMENTO PER INDICE i:
 * - i appartiene alle assunzioni della riga citata e non a quelle della candidata
 * - assunzioni(candidata) ∪ {i} = assunzioni(citata)
 * - A è esattamente l'assunzione i
 *
 * SCARICAMENTO VACUO:
 * - assunzioni(candidata) = assunzioni(citata)
 * - nessun vincolo su A: l'assunzione chiusa non ha contribuito alla contraddizione
 */
public final class NotIntroduction extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.NOT_INTRO;
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

        ProofLine contradiction = proof.line(reference.line());
        if (contradiction.content() != Bottom.INSTANCE) {
            return reject(candidate, "la riga citata non deriva " + Bottom.SYMBOL);
        }

        if (!hasDischargedAssumptions(candidate, contradiction, discharge)) {
            return reject(candidate, "assunzioni incompatibili con lo scaricamento " + discharge);
        }

        if (candidate.content().type() != Expression.Type.NOT) {
            return reject(candidate, "il contenuto non è una negazione");
        }

        if (discharge.isIndex()) {
            Expression negated = ((Not) candidate.content()).operand();
            if (!negated.equals(proof.assumption(discharge.index()))) {
                return reject(candidate, "la formula negata non è l'assunzione " + discharge.index());
            }
        }
        return true;
    }

    private boolean hasDischargedAssumptions(ProofLine candidate, ProofLine contradiction, Discharge discharge) {
        if (discharge.isVacuous()) {
            return candidate.assumptions().equals(contradiction.assumptions());
        }

        int index = discharge.index();
        return contradiction.assumptions().contains(index)
                && !candidate.assumptions().contains(index)
                && candidate.assumptions().equals(without(contradiction.assumptions(), index));
    }
}
