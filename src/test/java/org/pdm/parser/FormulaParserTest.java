package org.pdm.parser;

import org.junit.Test;
import org.pdm.formula.Formula;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static org.pdm.formula.Formula.and;
import static org.pdm.formula.Formula.atom;
import static org.pdm.formula.Formula.iff;
import static org.pdm.formula.Formula.implies;
import static org.pdm.formula.Formula.not;
import static org.pdm.formula.Formula.or;
import static org.pdm.formula.Formula.xor;

/**
 * Test del parser: precedenze, associatività a sinistra e segnalazione degli errori.
 */
public class FormulaParserTest {

    private static final Formula A = atom("A");
    private static final Formula B = atom("B");
    private static final Formula C = atom("C");

    @Test
    public void notBindsTighterThanAnd() {
        assertEquals(and(not(A), B), FormulaParser.parse("NOT A AND B"));

        Formula parsed = FormulaParser.parse("NOT A AND B");
        for (boolean a : new boolean[]{false, true}) {
            for (boolean b : new boolean[]{false, true}) {
                assertEquals(!a && b, parsed.evaluate(Map.of("A", a, "B", b)));
            }
        }
    }

    @Test
    public void implicationChainsFoldLeft() {
        assertEquals(implies(implies(A, B), C), FormulaParser.parse("A -> B -> C"));
        assertEquals(iff(iff(A, B), C), FormulaParser.parse("A <-> B <-> C"));
        assertEquals(and(and(A, B), C), FormulaParser.parse("A & B & C"));
    }

    @Test
    public void precedenceLadder() {
        assertEquals(or(and(A, B), C), FormulaParser.parse("A AND B OR C"));
        assertEquals(xor(or(A, B), C), FormulaParser.parse("A OR B XOR C"));
        assertEquals(xor(A, or(B, C)), FormulaParser.parse("A XOR B OR C"));
        assertEquals(implies(A, xor(B, C)), FormulaParser.parse("A -> B XOR C"));
        assertEquals(iff(implies(A, B), C), FormulaParser.parse("A -> B <-> C"));
    }

    @Test
    public void parenthesesOverridePrecedence() {
        assertEquals(implies(A, implies(B, C)), FormulaParser.parse("A -> (B -> C)"));
        assertEquals(not(and(A, B)), FormulaParser.parse("~(A & B)"));
        assertEquals(A, FormulaParser.parse("((A))"));
    }

    @Test
    public void doubleNegation() {
        assertEquals(not(not(A)), FormulaParser.parse("NOT NOT A"));
    }

    @Test
    public void atomCaseIsPreserved() {
        assertEquals(atom("fever"), FormulaParser.parse("fever"));
        assertNotEquals(atom("Fever"), FormulaParser.parse("fever"));
    }

    @Test
    public void parsesTokenListDirectly() {
        List<Token> tokens = List.of(Token.atom("X", 0), new Token(TokenType.OR, "|", 1), Token.atom("Y", 2),
                Token.end(3));
        assertEquals(or(atom("X"), atom("Y")), FormulaParser.parse(tokens));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tokensAfterEndAreRejected() {
        FormulaParser.parse(List.of(Token.atom("X", 0), Token.end(1), Token.atom("Y", 2)));
    }

    @Test
    public void emptyFormulaIsRejected() {
        FormulaParseException e = expectParseError("");
        assertEquals("END", e.getFound());
        assertEquals(0, e.getPosition());
    }

    @Test
    public void repeatedOperatorIsRejected() {
        FormulaParseException e = expectParseError("A AND AND B");
        assertEquals("AND", e.getFound());
        assertEquals(6, e.getPosition());
    }

    @Test
    public void trailingTokensAreRejected() {
        FormulaParseException e = expectParseError("A B");
        assertEquals("B", e.getFound());
        assertEquals(2, e.getPosition());
        assertTrue(e.getExpected().contains("END"));
    }

    @Test
    public void unmatchedParenthesisIsRejected() {
        assertEquals("END", expectParseError("(A AND B").getFound());
        expectParseError("A AND B)");
        expectParseError("()");
    }

    @Test
    public void lexErrorsSurfaceThroughParse() {
        try {
            FormulaParser.parse("A -> B - C");
            fail("Atteso FormulaLexException");
        } catch (FormulaLexException e) {
            assertEquals(7, e.getPosition());
        }
    }

    @Test
    public void atomStartingWithDigitIsRejected() {
        FormulaParseException e = expectParseError("A AND 1B");
        assertEquals("1B", e.getFound());
        assertEquals("ATOM", e.getExpected());
        assertEquals(6, e.getPosition());

        assertEquals(atom("_B1"), FormulaParser.parse("_B1"));
    }

    private static FormulaParseException expectParseError(String text) {
        try {
            FormulaParser.parse(text);
        } catch (FormulaParseException e) {
            return e;
        }
        throw new AssertionError("Atteso FormulaParseException per '" + text + "'");
    }
}
