package org.nd.rules;

import org.nd.proof.ProofLine;
import org.nd.proof.ProofState;

import java.util.logging.Logger;

/**
 * MOTORE DI VALIDAZIONE - Smistamento della riga candidata alla sua regola
 *
 * Ogni regola ha esattamente un controllo; la selezione avviene con uno switch
 * esaustivo sull'enum {@link Rule}, quindi aggiungere o rimuovere una regola
 * senza aggiornare lo smistamento è un errore di compilazione.
 *
 * I controlli sono privi di stato e non modificano la dimostrazione: la stessa
 * istanza può servire più dimostrazioni indipendenti.
 */
public final class RuleValidator {

    private static final Logger LOGGER = Logger.getLogger(RuleValidator.class.getName());

    private final RuleChecker assumption = new AssumptionRule();
    private final RuleChecker andElimination = new AndElimination();
    private final RuleChecker andIntroduction = new AndIntroduction();
    private final RuleChecker doubleNegationElimination = new DoubleNegationElimination();
    private final RuleChecker notElimination = new NotElimination();
    private final RuleChecker notIntroduction = new NotIntroduction();
    private final RuleChecker orIntroduction = new OrIntroduction();
    private final RuleChecker orElimination = new OrElimination();
    private final RuleChecker impliesIntroduction = new ImpliesIntroduction();
    private final RuleChecker impliesElimination = new ImpliesElimination();
    private final RuleChecker reductioAdAbsurdum = new ReductioAdAbsurdum();

    /**
     * Decide se la riga candidata può essere aggiunta in coda alla dimostrazione.
     *
     * @param proof stato corrente della dimostrazione
     * @param candidate riga proposta
     * @return true se la regola indicata dalla riga la giustifica
     */
    public boolean accepts(ProofState proof, ProofLine candidate) {
        if (candidate == null || candidate.rule() == null) {
            LOGGER.fine("Riga rifiutata: regola assente");
            return false;
        }
        return checkerFor(candidate.rule()).accepts(proof, candidate);
    }

    /**
     * @param rule regola richiesta
     * @return controllo dedicato alla regola
     */
    public RuleChecker checkerFor(Rule rule) {
        return switch (rule) {
            case ASSUMPTION -> assumption;
            case AND_ELIM -> andElimination;
            case AND_INTRO -> andIntroduction;
            case DNE -> doubleNegationElimination;
            case NOT_ELIM -> notElimination;
            case NOT_INTRO -> notIntroduction;
            case OR_INTRO -> orIntroduction;
            case OR_ELIM -> orElimination;
            case IMPLIES_INTRO -> impliesIntroduction;
            case IMPLIES_ELIM -> impliesElimination;
            case RAA -> reductioAdAbsurdum;
        };
    }
}
