package org.nd.proof;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.nd.expression.And;
import org.nd.expression.Atom;
import org.nd.expression.Bottom;
import org.nd.expression.Expression;
import org.nd.expression.Implies;
import org.nd.expression.Not;
import org.nd.expression.Or;
import org.nd.parser.FormulaParseException;
import org.nd.rules.Rule;

public class ProofTest {
	private static final Atom P = new Atom("p");
	private static final Atom Q = new Atom("q");

	private static Set<Integer> set(Integer... indices) {
		return new HashSet<>(Arrays.asList(indices));
	}

	private static void addAll(Proof proof, List<ProofLine> lines) {
		for (ProofLine line : lines) {
			assertTrue(proof.tryAddLine(line), "Riga rifiutata: " + line);
		}
	}

	// ==============================================================
	// Costruzione
	// ==============================================================

	@Test
	public void premisesBecomeAssumptionLines() {
		Proof proof = Proof.of(new And(P, Q), P, Q);

		assertEquals(2, proof.lineCount());
		assertEquals(ProofLine.assumption(0, P), proof.line(0));
		assertEquals(ProofLine.assumption(1, Q), proof.line(1));
		assertEquals(List.of(P, Q), proof.assumptions());
		assertEquals(new Goal(set(0, 1), new And(P, Q)), proof.goal());
	}

	@Test
	public void proofWithoutPremisesIsEmpty() {
		Proof proof = Proof.of(new Implies(Bottom.INSTANCE, P));

		assertEquals(0, proof.lineCount());
		assertEquals(0, proof.assumptionCount());
		assertTrue(proof.goal().assumptions().isEmpty());
		assertFalse(proof.isComplete());
	}

	@Test
	public void premiseAlreadyReachingTheGoalIsComplete() {
		assertTrue(Proof.of(P, P).isComplete());
		assertFalse(Proof.of(P, P, Q).isComplete());
	}

	@Test
	public void parseBuildsFromText() {
		Proof proof = Proof.parse("p ^ q", "p", "q");

		assertEquals(Proof.of(new And(P, Q), P, Q).toString(), proof.toString());
		assertThrows(FormulaParseException.class, () -> Proof.parse("p ^", "p"));
	}

	@Test
	public void nullArgumentsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> new Proof(null, P));
		assertThrows(IllegalArgumentException.class, () -> new Proof(List.of(P), null));
		assertThrows(IllegalArgumentException.class, () -> new Proof(Arrays.asList(P, null), Q));
	}

	// ==============================================================
	// Dimostrazioni complete
	// ==============================================================

	@Test
	public void conjunctionIntroduction() {
		Proof proof = Proof.of(new And(P, Q), P, Q);

		assertTrue(proof.tryAddLine(ProofLine.of(set(0, 1), new And(P, Q), Rule.AND_INTRO,
				Reference.of(0), Reference.of(1))));
		assertTrue(proof.isComplete());
	}

	@Test
	public void doubleNegationElimination() {
		Proof proof = Proof.of(P, new Not(new Not(P)));

		assertTrue(proof.tryAddLine(ProofLine.of(set(0), P, Rule.DNE, Reference.of(0))));
		assertTrue(proof.isComplete());
	}

	@Test
	public void contradictionFromComplementaryPremises() {
		Proof proof = Proof.of(Bottom.INSTANCE, P, new Not(P));

		assertTrue(proof.tryAddLine(ProofLine.of(set(0, 1), Bottom.INSTANCE, Rule.NOT_ELIM,
				Reference.of(0), Reference.of(1))));
		assertTrue(proof.isComplete());
	}

	@Test
	public void exFalsoWithoutPremises() {
		Expression goal = new Implies(Bottom.INSTANCE, P);
		Proof proof = Proof.of(goal);

		addAll(proof, List.of(
				ProofLine.assumption(0, Bottom.INSTANCE),
				ProofLine.of(set(0), new Not(new Not(P)), Rule.NOT_INTRO, Reference.vacuous(0)),
				ProofLine.of(set(0), P, Rule.DNE, Reference.of(1)),
				ProofLine.of(set(), goal, Rule.IMPLIES_INTRO, Reference.discharging(2, 0))));

		assertTrue(proof.isComplete());
		assertEquals(List.of(Bottom.INSTANCE), proof.assumptions());
	}

	@Test
	public void vacuousNegationOfAPremise() {
		Proof proof = Proof.of(new Not(P), P, Bottom.INSTANCE);

		addAll(proof, List.of(
				ProofLine.of(set(0, 1), new And(P, Bottom.INSTANCE), Rule.AND_INTRO, Reference.of(0), Reference.of(1)),
				ProofLine.of(set(0, 1), Bottom.INSTANCE, Rule.AND_ELIM, Reference.of(2)),
				ProofLine.of(set(0, 1), new Not(P), Rule.NOT_INTRO, Reference.vacuous(3))));

		assertTrue(proof.isComplete());
	}

	@Test
	public void vacuousImplicationFromAPremise() {
		Proof proof = Proof.of(new Implies(P, Q), Q);

		assertTrue(proof.tryAddLine(ProofLine.of(set(0), new Implies(P, Q), Rule.IMPLIES_INTRO, Reference.vacuous(0))));
		assertTrue(proof.isComplete());
	}

	@Test
	public void reductioThenProofByCases() {
		Expression goal = new Implies(new Not(P), Q);
		Proof proof = Proof.of(goal, new Or(P, Q));

		addAll(proof, List.of(
				ProofLine.assumption(1, new Not(P)),
				ProofLine.assumption(2, P),
				ProofLine.of(set(1, 2), new Not(new Not(Q)), Rule.RAA, Reference.of(1), Reference.vacuous(2)),
				ProofLine.of(set(1, 2), Q, Rule.DNE, Reference.of(3)),
				ProofLine.assumption(3, Q),
				ProofLine.of(set(0, 1), Q, Rule.OR_ELIM,
						Reference.of(0), Reference.discharging(4, 2), Reference.discharging(5, 3)),
				ProofLine.of(set(0), goal, Rule.IMPLIES_INTRO, Reference.discharging(6, 1))));

		assertTrue(proof.isComplete());
		assertEquals(4, proof.assumptionCount());
	}

	// ==============================================================
	// Aggiunta e rifiuto
	// ==============================================================

	@Test
	public void rejectedLineHasNoEffect() {
		Proof proof = Proof.of(Q, P);
		String before = proof.toString();

		assertFalse(proof.tryAddLine(ProofLine.of(set(0), Q, Rule.AND_ELIM, Reference.of(0))));
		assertFalse(proof.tryAddLine(ProofLine.assumption(3, Q)));
		assertFalse(proof.tryAddLine(null));

		assertEquals(before, proof.toString());
		assertEquals(1, proof.assumptionCount());
	}

	@Test
	public void canAddLineDoesNotAppend() {
		Proof proof = Proof.of(Q, P);
		ProofLine assumption = ProofLine.assumption(1, Q);

		assertTrue(proof.canAddLine(assumption));
		assertTrue(proof.canAddLine(assumption));
		assertEquals(1, proof.lineCount());
		assertEquals(1, proof.assumptionCount());
	}

	@Test
	public void assumptionMapFollowsAssumptionLines() {
		Proof proof = Proof.of(Q, P);

		addAll(proof, List.of(
				ProofLine.assumption(1, Q),
				ProofLine.of(set(0, 1), new And(P, Q), Rule.AND_INTRO, Reference.of(0), Reference.of(1)),
				ProofLine.assumption(2, new Not(P))));

		long assumptionLines = proof.lines().stream().filter(line -> line.rule() == Rule.ASSUMPTION).count();
		assertEquals(assumptionLines, proof.assumptionCount());
		assertEquals(List.of(P, Q, new Not(P)), proof.assumptions());
	}

	@Test
	public void addLineReturnsIndexOrThrows() {
		Proof proof = Proof.of(new And(P, Q), P, Q);

		assertEquals(2, proof.addLine(ProofLine.of(set(0, 1), new And(P, Q), Rule.AND_INTRO,
				Reference.of(0), Reference.of(1))));

		ProofLine bad = ProofLine.of(set(0), Q, Rule.AND_ELIM, Reference.of(0));
		RejectedLineException exception = assertThrows(RejectedLineException.class, () -> proof.addLine(bad));
		assertEquals(3, exception.getLineIndex());
		assertEquals(Rule.AND_ELIM, exception.getRule());
		assertEquals(3, proof.lineCount());

		assertThrows(IllegalArgumentException.class, () -> proof.addLine(null));
	}

	@Test
	public void completionTracksTheLastLine() {
		Proof proof = Proof.of(P, P);
		assertTrue(proof.isComplete());

		proof.addLine(ProofLine.assumption(1, Q));
		assertFalse(proof.isComplete());
	}

	// ==============================================================
	// Viste
	// ==============================================================

	@Test
	public void viewsAreReadOnly() {
		Proof proof = Proof.of(P, P);

		assertThrows(UnsupportedOperationException.class, () -> proof.lines().add(ProofLine.assumption(1, Q)));
		assertThrows(UnsupportedOperationException.class, () -> proof.assumptions().add(Q));
		assertThrows(UnsupportedOperationException.class, () -> proof.goal().assumptions().add(4));
		assertThrows(UnsupportedOperationException.class, () -> proof.line(0).assumptions().add(4));
	}

	@Test
	public void listing() {
		Proof proof = Proof.parse("p ^ q", "p", "q");
		proof.addLine(ProofLine.of(set(1, 0), new And(P, Q), Rule.AND_INTRO, Reference.of(0), Reference.of(1)));

		assertEquals(String.join("\n",
				"0 | {0} | p |  | A",
				"1 | {1} | q |  | A",
				"2 | {0, 1} | p ^ q | 0, 1 | &I",
				"Obiettivo: [0, 1] |- p ^ q"), proof.toString());
	}
}
