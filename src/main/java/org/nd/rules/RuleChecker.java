package org.nd.rules;

import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

/**
 * Predicato di correttezza di una singola regola di inferenza.
 */
public interface RuleChecker {

    /**
     * Decide se la riga candidata è giustificata dalla regola nello stato dato.
     * Non modifica né la dimostrazione né la riga: chiamate ripetute con lo
     * stesso stato danno lo stesso esito.
     *
     * @param proof righe e assunzioni accettate finora
     * @param candidate riga da aggiungere in coda
     * @return true se la riga può essere aggiunta
     */
    boolean accepts(ProofState proof, ProofLine candidate);

    /**
     * @return regola verificata da questo controllo
     */
    Rule rule();
}
