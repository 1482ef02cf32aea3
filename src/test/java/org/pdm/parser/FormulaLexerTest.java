package org.pdm.parser;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Test del lexer: parole chiave, alias simbolici, operatori multi-carattere e caratteri non validi.
 */
public class FormulaLexerTest {

    private static List<TokenType> types(String text) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : FormulaLexer.tokenize(text)) {
            types.add(token.type());
        }
        return types;
    }

    @Test
    public void keywordsAreCaseInsensitive() {
        assertEquals(List.of(TokenType.ATOM, TokenType.AND, TokenType.ATOM, TokenType.OR, TokenType.ATOM,
                        TokenType.XOR, TokenType.NOT, TokenType.ATOM, TokenType.END),
                types("a and B Or c xOR not D"));
    }

    @Test
    public void symbolicAliasesMapToKeywords() {
        assertEquals(List.of(TokenType.NOT, TokenType.ATOM, TokenType.AND, TokenType.ATOM, TokenType.OR,
                        TokenType.ATOM, TokenType.END),
                types("~A & B | C"));
    }

    @Test
    public void arrowsAreMatchedGreedily() {
        assertEquals(List.of(TokenType.ATOM, TokenType.IFF, TokenType.ATOM, TokenType.IMPLIES, TokenType.ATOM,
                        TokenType.END),
                types("A<->B->C"));
    }

    @Test
    public void keywordMustBeWholeIdentifier() {
        List<Token> tokens = FormulaLexer.tokenize("ANDROID or_else NOTE");
        assertEquals(TokenType.ATOM, tokens.get(0).type());
        assertEquals("ANDROID", tokens.get(0).text());
        assertEquals(TokenType.ATOM, tokens.get(1).type());
        assertEquals(TokenType.ATOM, tokens.get(2).type());
    }

    @Test
    public void wordStartingWithDigitIsLexedAsAtom() {
        List<Token> tokens = FormulaLexer.tokenize("1A");
        assertEquals(TokenType.ATOM, tokens.get(0).type());
        assertEquals("1A", tokens.get(0).text());
    }

    @Test
    public void atomTextAndPositionsArePreserved() {
        List<Token> tokens = FormulaLexer.tokenize("  fever AND (Cough)");
        assertEquals(Token.atom("fever", 2), tokens.get(0));
        assertEquals(new Token(TokenType.AND, "AND", 8), tokens.get(1));
        assertEquals(TokenType.LPAREN, tokens.get(2).type());
        assertEquals(12, tokens.get(2).position());
        assertEquals(Token.end(19), tokens.get(tokens.size() - 1));
    }

    @Test
    public void emptyTextYieldsOnlyEnd() {
        assertEquals(List.of(Token.end(0)), FormulaLexer.tokenize(""));
        assertEquals(List.of(TokenType.END), types("   \t "));
    }

    @Test
    public void loneDashIsRejected() {
        try {
            FormulaLexer.tokenize("A - B");
            fail("Atteso FormulaLexException");
        } catch (FormulaLexException e) {
            assertEquals(2, e.getPosition());
            assertEquals('-', e.getCharacter());
        }
    }

    @Test
    public void unknownCharacterIsRejected() {
        try {
            FormulaLexer.tokenize("A AND $B");
            fail("Atteso FormulaLexException");
        } catch (FormulaLexException e) {
            assertEquals(6, e.getPosition());
            assertEquals('$', e.getCharacter());
            assertTrue(e.getMessage().contains("$"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativePositionIsRejected() {
        new Token(TokenType.ATOM, "A", -1);
    }
}
