package org.nd.proof;

import org.nd.expression.Expression;
import org.nd.parser.FormulaParser;
import org.nd.rules.Rule;
import org.nd.rules.RuleValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * DIMOSTRAZIONE - Sequenza di righe verificate in sola aggiunta
 *
 * Possiede la sequenza delle righe accettate, la mappa delle assunzioni e
 * l'obiettivo. Ogni riga proposta viene verificata dal motore delle regole
 * prima di essere accodata; una riga rifiutata non ha alcun effetto.
 *
 * INVARIANTI:
 * - La mappa delle assunzioni ha tante voci quante sono le righe con regola A
 * - Ogni insieme di assunzioni accettato è contenuto negli indici della mappa
 * - Ogni riferimento cita una riga precedente
 *
 * CICLO DI VITA:
 * 1. Costruzione con premesse e obiettivo: ogni premessa diventa una riga A
 * 2. Aggiunta di righe una alla volta, ciascuna validata
 * 3. La dimostrazione è completa quando l'ultima riga coincide con l'obiettivo
 *
 * Non è thread-safe: una dimostrazione è costruita da un solo chiamante in
 * sequenza. Dimostrazioni distinte non condividono stato mutabile.
 */
public class Proof implements ProofState {

    private static final Logger LOGGER = Logger.getLogger(Proof.class.getName());

    private static final RuleValidator VALIDATOR = new RuleValidator();

    private final List<ProofLine> lines = new ArrayList<>();
    private final AssumptionMap assumptionMap = new AssumptionMap();
    private final Goal goal;

    //region COSTRUZIONE

    /**
     * Crea una dimostrazione con le premesse date come prime righe.
     *
     * @param premises premesse, nell'ordine che ne determina gli indici
     * @param goal formula da derivare dalle sole premesse
     * @throws IllegalArgumentException se premesse o obiettivo sono null
     */
    public Proof(List<Expression> premises, Expression goal) {
        if (premises == null || premises.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista premesse null o con elementi null");
        }
        if (goal == null) {
            throw new IllegalArgumentException("Obiettivo non può essere null");
        }

        Set<Integer> premiseIndices = new TreeSet<>();
        for (Expression premise : premises) {
            int index = assumptionMap.append(premise);
            lines.add(ProofLine.assumption(index, premise));
            premiseIndices.add(index);
        }
        this.goal = new Goal(premiseIndices, goal);

        LOGGER.fine("Nuova dimostrazione: " + premises + " |- " + goal);
    }

    public static Proof of(Expression goal, Expression... premises) {
        return new Proof(Arrays.asList(premises), goal);
    }

    /**
     * Crea una dimostrazione da formule testuali.
     *
     * @throws org.nd.parser.FormulaParseException se una formula è malformata
     */
    public static Proof parse(String goal, String... premises) {
        FormulaParser parser = new FormulaParser();
        List<Expression> parsedPremises = new ArrayList<>();
        for (String premise : premises) {
            parsedPremises.add(parser.parse(premise));
        }
        return new Proof(parsedPremises, parser.parse(goal));
    }

    //endregion

    //region AGGIUNTA RIGHE

    /**
     * Verifica se la riga può essere accodata, senza effetti collaterali.
     *
     * @param line riga candidata
     * @return true se la regola indicata giustifica la riga
     */
    public boolean canAddLine(ProofLine line) {
        return VALIDATOR.accepts(this, line);
    }

    /**
     * Accoda la riga se giustificata. Per le righe con regola A registra anche
     * il contenuto nella mappa delle assunzioni.
     *
     * @param line riga candidata
     * @return true se la riga è stata aggiunta
     */
    public boolean tryAddLine(ProofLine line) {
        if (!canAddLine(line)) {
            return false;
        }

        if (line.rule() == Rule.ASSUMPTION) {
            assumptionMap.append(line.content());
        }
        lines.add(line);
        LOGGER.fine("Riga " + (lines.size() - 1) + " accettata: " + line);

        if (goal.isReachedBy(line)) {
            LOGGER.info("Dimostrazione completata: " + goal.content());
        }
        return true;
    }

    /**
     * Come {@link #tryAddLine(ProofLine)}, ma segnala il rifiuto con un'eccezione.
     *
     * @param line riga candidata
     * @return indice assegnato alla riga
     * @throws RejectedLineException se la riga non è giustificata
     * @throws IllegalArgumentException se la riga è null
     */
    public int addLine(ProofLine line) {
        if (line == null) {
            throw new IllegalArgumentException("Riga non può essere null");
        }
        int index = lines.size();
        if (!tryAddLine(line)) {
            throw new RejectedLineException(index, line);
        }
        return index;
    }

    /**
     * @return true se l'ultima riga ha le assunzioni e il contenuto dell'obiettivo
     */
    public boolean isComplete() {
        if (lines.isEmpty()) {
            return false;
        }
        return goal.isReachedBy(lines.get(lines.size() - 1));
    }

    //endregion

    //region VISTE IN SOLA LETTURA

    public List<ProofLine> lines() {
        return Collections.unmodifiableList(lines);
    }

    public List<Expression> assumptions() {
        return assumptionMap.asList();
    }

    public Goal goal() {
        return goal;
    }

    @Override
    public int lineCount() {
        return lines.size();
    }

    @Override
    public ProofLine line(int index) {
        return lines.get(index);
    }

    @Override
    public int assumptionCount() {
        return assumptionMap.size();
    }

    @Override
    public Expression assumption(int index) {
        return assumptionMap.get(index);
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            result.append(i).append(" | ").append(lines.get(i)).append('\n');
        }
        result.append("Obiettivo: ").append(goal.assumptions()).append(" |- ").append(goal.content());
        return result.toString();
    }
}
