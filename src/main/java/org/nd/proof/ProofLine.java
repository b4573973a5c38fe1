package org.nd.proof;

import org.nd.expression.Expression;
import org.nd.rules.Rule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * RIGA DI DIMOSTRAZIONE - Contenitore immutabile di un passo
 *
 * COMPONENTI:
 * - Assunzioni: indici delle assunzioni da cui la riga dipende
 * - Contenuto: formula asserita
 * - Riferimenti: righe precedenti citate, in ordine significativo per la regola
 *   (es. per vE: disgiunzione, primo caso, secondo caso)
 * - Regola: regola di inferenza che giustifica il passo
 *
 * La riga non si valida da sola: la correttezza dipende dalla dimostrazione
 * in cui viene inserita ed è decisa dal motore delle regole.
 */
public record ProofLine(Set<Integer> assumptions, Expression content, List<Reference> references, Rule rule) {

    public ProofLine {
        if (assumptions == null) {
            throw new IllegalArgumentException("Insieme di assunzioni non può essere null");
        }
        for (Integer index : assumptions) {
            if (index == null || index < 0) {
                throw new IllegalArgumentException("Indice di assunzione non valido: " + index);
            }
        }
        if (content == null) {
            throw new IllegalArgumentException("Contenuto della riga non può essere null");
        }
        if (references == null || references.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista riferimenti null o con elementi null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("Regola della riga non può essere null");
        }

        // Copie immutabili: le righe sono condivise in sola lettura
        assumptions = Collections.unmodifiableSet(new TreeSet<>(assumptions));
        references = List.copyOf(references);
    }

    /**
     * Costruzione compatta con riferimenti variadici.
     */
    public static ProofLine of(Set<Integer> assumptions, Expression content, Rule rule, Reference... references) {
        return new ProofLine(assumptions, content, Arrays.asList(references), rule);
    }

    /**
     * Riga di assunzione con il solo indice indicato.
     */
    public static ProofLine assumption(int index, Expression content) {
        return new ProofLine(Set.of(index), content, List.of(), Rule.ASSUMPTION);
    }

    /**
     * Formato: "{0, 1} | p ^ q | 0, 1 | &I".
     */
    @Override
    public String toString() {
        List<String> citations = new ArrayList<>();
        for (Reference reference : references) {
            citations.add(reference.toString());
        }
        String assumptionText = assumptions.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "{", "}"));

        return assumptionText + " | " + content + " | " + String.join(", ", citations) + " | " + rule;
    }
}
