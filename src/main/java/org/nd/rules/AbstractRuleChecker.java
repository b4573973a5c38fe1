package org.nd.rules;

import org.nd.proof.Discharge;
import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;
import org.nd.proof.Reference;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * BASE DEI CONTROLLI DI REGOLA - Precondizioni comuni e algebra delle assunzioni
 *
 * PRECONDIZIONI VERIFICATE PER OGNI REGOLA:
 * - Ogni riga citata precede la candidata (nessun riferimento in avanti o a sé stessa)
 * - Ogni scaricamento per indice nomina un'assunzione già introdotta
 *
 * Superate le precondizioni, il controllo specifico segue sempre lo schema:
 * 1. Forma dei riferimenti (numero e tipo di scaricamento)
 * 2. Algebra degli insiemi di assunzioni (unione, differenza)
 * 3. Corrispondenza strutturale dei contenuti
 *
 * Il primo controllo fallito termina la verifica. Il motivo viene registrato
 * nel log a livello FINE; al chiamante arriva solo l'esito booleano.
 */
public abstract class AbstractRuleChecker implements RuleChecker {

    private static final Logger LOGGER = Logger.getLogger(AbstractRuleChecker.class.getName());

    //region PUNTO DI INGRESSO

    @Override
    public final boolean accepts(ProofState proof, ProofLine candidate) {
        for (Reference reference : candidate.references()) {
            if (reference.line() >= proof.lineCount()) {
                return reject(candidate, "riferimento alla riga " + reference.line()
                        + " non precedente (righe presenti: " + proof.lineCount() + ")");
            }

            Discharge discharge = reference.discharge();
            if (discharge.isIndex() && discharge.index() >= proof.assumptionCount()) {
                return reject(candidate, "scaricamento dell'assunzione inesistente " + discharge.index());
            }
        }

        return check(proof, candidate);
    }

    /**
     * Controllo specifico della regola, invocato solo se tutti i riferimenti
     * puntano a righe e assunzioni esistenti.
     */
    protected abstract boolean check(ProofState proof, ProofLine candidate);

    //endregion

    //region FORMA DEI RIFERIMENTI

    /**
     * Verifica numero di riferimenti e tipo di scaricamento di ciascuno.
     *
     * @param kinds tipo di scaricamento atteso per ogni riferimento, in ordine
     */
    protected boolean hasReferenceShape(ProofLine candidate, Discharge.Kind... kinds) {
        if (candidate.references().size() != kinds.length) {
            return false;
        }
        for (int i = 0; i < kinds.length; i++) {
            if (candidate.references().get(i).discharge().kind() != kinds[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Riga citata dal riferimento i-esimo della candidata.
     */
    protected ProofLine cited(ProofState proof, ProofLine candidate, int position) {
        return proof.line(candidate.references().get(position).line());
    }

    //endregion

    //region ALGEBRA DELLE ASSUNZIONI

    /**
     * Unione degli insiemi di assunzioni delle righe indicate.
     */
    protected static Set<Integer> union(ProofLine... lines) {
        Set<Integer> result = new HashSet<>();
        for (ProofLine line : lines) {
            result.addAll(line.assumptions());
        }
        return result;
    }

    /**
     * Differenza insiemistica: copia di {@code assumptions} senza gli indici scaricati.
     */
    protected static Set<Integer> without(Set<Integer> assumptions, int... discharged) {
        Set<Integer> result = new HashSet<>(assumptions);
        for (int index : discharged) {
            result.remove(index);
        }
        return result;
    }

    //endregion

    //region ESITO

    /**
     * Registra il motivo del rifiuto e restituisce sempre false.
     */
    protected boolean reject(ProofLine candidate, String reason) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Riga rifiutata [%s]: %s -> %s", rule(), candidate, reason));
        }
        return false;
    }

    //endregion
}
