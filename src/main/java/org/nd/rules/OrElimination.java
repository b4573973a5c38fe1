package org.nd.rules;

import org.nd.expression.Expression;
import org.nd.expression.Or;
import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * REGOLA vE - Eliminazione della disgiunzione (ragionamento per casi)
 *
 * CITAZIONI, IN ORDINE:
 * 1. Riga con A v B, senza scaricamento
 * 2. Riga con C derivata assumendo un caso, scaricando l'indice i2
 * 3. Riga con C derivata assumendo l'altro caso, scaricando l'indice i3
 *
 * CONDIZIONI:
 * - i2 appartiene alle assunzioni della seconda riga, i3 a quelle della terza
 * - {assunzione i2, assunzione i3} = {A, B}, in qualsiasi ordine
 * - la candidata e le due righe dei casi hanno lo stesso contenuto C
 * - assunzioni(candidata) = (unione delle tre righe) \ {i2, i3}
 */
public final class OrElimination extends AbstractRuleChecker {

    @Override
    public Rule rule() {
        return Rule.OR_ELIM;
    }

    @Override
    protected boolean check(ProofState proof, ProofLine candidate) {
        if (!hasReferenceShape(candidate, Discharge.Kind.NONE, Discharge.Kind.INDEX, Discharge.Kind.INDEX)) {
            return reject(candidate, "attese tre citazioni: disgiunzione e due casi con scaricamento per indice");
        }

        ProofLine disjunctionLine = cited(proof, candidate, 0);
        ProofLine firstCase = cited(proof, candidate, 1);
        ProofLine secondCase = cited(proof, candidate, 2);
        int firstIndex = candidate.references().get(1).discharge().index();
        int secondIndex = candidate.references().get(2).discharge().index();

        if (!firstCase.assumptions().contains(firstIndex) || !secondCase.assumptions().contains(secondIndex)) {
            return reject(candidate, "un caso scarica un'assunzione da cui non dipende");
        }

        if (disjunctionLine.content().type() != Expression.Type.OR) {
            return reject(candidate, "la prima riga citata non è una disgiunzione");
        }

        Or disjunction = (Or) disjunctionLine.content();
        if (!matchesCases(disjunction, proof.assumption(firstIndex), proof.assumption(secondIndex))) {
            return reject(candidate, "le assunzioni scaricate non sono i disgiunti di " + disjunction);
        }

        if (!firstCase.content().equals(candidate.content()) || !secondCase.content().equals(candidate.content())) {
            return reject(candidate, "i due casi non concludono il contenuto della riga");
        }

        if (!candidate.assumptions().equals(
                without(union(disjunctionLine, firstCase, secondCase), firstIndex, secondIndex))) {
            return reject(candidate, "assunzioni diverse da unione meno assunzioni scaricate");
        }
        return true;
    }

    /**
     * Corrispondenza simmetrica tra le assunzioni dei casi e i disgiunti.
     */
    private static boolean matchesCases(Or disjunction, Expression firstCase, Expression secondCase) {
        return (firstCase.equals(disjunction.left()) && secondCase.equals(disjunction.right()))
                || (firstCase.equals(disjunction.right()) && secondCase.equals(disjunction.left()));
    }
}
