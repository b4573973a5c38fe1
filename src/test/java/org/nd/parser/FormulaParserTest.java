package org.nd.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.nd.expression.And;
import org.nd.expression.Atom;
import org.nd.expression.Bottom;
import org.nd.expression.Expression;
import org.nd.expression.Implies;
import org.nd.expression.Not;
import org.nd.expression.Notation;
import org.nd.expression.Or;
import org.nd.parser.FormulaParseException.Reason;

/**
 * Parsing end-to-end: grafie, precedenze, associatività, errori e rilettura.
 */
public class FormulaParserTest {
	private static final Atom P = new Atom("p");
	private static final Atom Q = new Atom("q");
	private static final Atom R = new Atom("r");
	private static final Atom S = new Atom("s");

	private final FormulaParser parser = new FormulaParser();

	// ==============================================================
	// Formule ben formate
	// ==============================================================

	@Test
	public void negatedDisjunctionAndImplication() {
		Expression expected = new And(new Not(new Or(P, Q)), new Implies(R, S));
		Expression parsed = parser.parse("~(pvq)^(r→s)");

		assertEquals(expected, parsed);
		assertEquals(expected, parser.parse(parsed.render()));
	}

	@Test
	public void singleAtom() {
		assertEquals(Q, parser.parse("q"));
		assertEquals(Q, parser.parse("  ((q)) "));
	}

	@Test
	public void precedenceOfConnectives() {
		assertEquals(new Or(P, new And(Q, R)), parser.parse("p v q ^ r"));
		assertEquals(new Or(new And(P, Q), R), parser.parse("p ^ q v r"));
		assertEquals(new Implies(P, new Or(Q, R)), parser.parse("p -> q v r"));
		assertEquals(new And(new Not(P), Q), parser.parse("~p ^ q"));
		assertEquals(new And(P, new Not(Q)), parser.parse("p^~q"));
	}

	@Test
	public void binaryConnectivesAssociateToTheLeft() {
		assertEquals(new Implies(new Implies(P, Q), R), parser.parse("p -> q -> r"));
		assertEquals(new And(new And(P, Q), R), parser.parse("p ^ q ^ r"));
		assertEquals(new Implies(P, new Implies(Q, R)), parser.parse("p -> (q -> r)"));
	}

	@Test
	public void negationNestsToTheRight() {
		assertEquals(new Not(new Not(P)), parser.parse("~~p"));
		assertEquals(new Not(new Not(P)), parser.parse("~ ~ p"));
		assertEquals(new Not(new Not(P)), parser.parse("~(~(p))"));
		assertEquals(new And(new And(P, new Not(Q)), R), parser.parse("p ^ ~q ^ r"));
	}

	@Test
	public void contradictionConstant() {
		assertEquals(new Implies(Bottom.INSTANCE, P), parser.parse("⊥ -> p"));
		assertEquals(new Not(Bottom.INSTANCE), parser.parse("~⊥"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "p -> q", "p --> q", "p → q", "p->q", "(p)-->(q)" })
	public void implicationSpellings(String text) {
		assertEquals(new Implies(P, Q), parser.parse(text));
	}

	@ParameterizedTest
	@ValueSource(strings = { "p ^ q", "p & q", "p ∧ q", "p^q" })
	public void conjunctionSpellings(String text) {
		assertEquals(new And(P, Q), parser.parse(text));
	}

	@ParameterizedTest
	@ValueSource(strings = { "p v q", "p | q", "p ∨ q", "pvq" })
	public void disjunctionSpellings(String text) {
		assertEquals(new Or(P, Q), parser.parse(text));
	}

	@ParameterizedTest
	@ValueSource(strings = { "~p", "!p", "¬p" })
	public void negationSpellings(String text) {
		assertEquals(new Not(P), parser.parse(text));
	}

	// ==============================================================
	// Formule malformate
	// ==============================================================

	private static Stream<Arguments> malformedFormulas() {
		return Stream.of(
				Arguments.of("", Reason.EMPTY_INPUT),
				Arguments.of("   ", Reason.EMPTY_INPUT),
				Arguments.of("(p ^ q", Reason.UNBALANCED_PARENTHESES),
				Arguments.of("p ^ q)", Reason.UNBALANCED_PARENTHESES),
				Arguments.of("((p)", Reason.UNBALANCED_PARENTHESES),
				Arguments.of("p ^", Reason.MISSING_OPERAND),
				Arguments.of("^ p", Reason.MISSING_OPERAND),
				Arguments.of("~", Reason.MISSING_OPERAND),
				Arguments.of("()", Reason.MISSING_OPERAND),
				Arguments.of("p v v q", Reason.MISSING_OPERAND),
				Arguments.of("pq", Reason.UNEXPECTED_OPERAND),
				Arguments.of("p q", Reason.UNEXPECTED_OPERAND),
				Arguments.of("p ~q", Reason.UNEXPECTED_OPERAND),
				Arguments.of("(p)(q)", Reason.UNEXPECTED_OPERAND),
				Arguments.of("p + q", Reason.INVALID_SYMBOL),
				Arguments.of("p1", Reason.INVALID_SYMBOL),
				Arguments.of("p - q", Reason.INVALID_SYMBOL));
	}

	@ParameterizedTest
	@MethodSource("malformedFormulas")
	public void malformedFormulaIsRejected(String text, Reason reason) {
		FormulaParseException exception = assertThrows(FormulaParseException.class, () -> parser.parse(text));
		assertEquals(reason, exception.getReason());
		assertFalse(parser.tryParse(text).isPresent());
	}

	@Test
	public void nullInputIsEmpty() {
		FormulaParseException exception = assertThrows(FormulaParseException.class, () -> parser.parse(null));
		assertEquals(Reason.EMPTY_INPUT, exception.getReason());
	}

	@Test
	public void tryParseWrapsResult() {
		assertTrue(parser.tryParse("p -> q").isPresent());
		assertEquals(new Implies(P, Q), parser.tryParse("p -> q").get());
	}

	// ==============================================================
	// Stampa e rilettura
	// ==============================================================

	private static Stream<Expression> expressions() {
		return Stream.of(
				P,
				Bottom.INSTANCE,
				new Not(new Not(new Not(P))),
				new And(P, Q),
				new And(new And(P, Q), R),
				new And(P, new And(Q, R)),
				new Or(new And(P, Q), new And(R, S)),
				new And(new Or(P, Q), new Or(R, S)),
				new Implies(new Implies(P, Q), new Implies(R, S)),
				new Implies(P, new Implies(Q, new Implies(R, S))),
				new Not(new Implies(P, new Or(Q, Bottom.INSTANCE))),
				new Implies(new Not(new And(P, new Not(Q))), new Or(new Not(R), new Implies(S, P))),
				new Or(P, new Or(Q, new Or(R, S))),
				new And(new Not(new Or(P, Q)), new Implies(R, S)));
	}

	@ParameterizedTest
	@MethodSource("expressions")
	public void renderedFormulaParsesBackToTheSameTree(Expression expression) {
		for (Notation notation : Notation.values()) {
			String text = expression.render(notation);
			assertEquals(expression, parser.parse(text), "Rilettura fallita per " + text);
		}
	}
}
