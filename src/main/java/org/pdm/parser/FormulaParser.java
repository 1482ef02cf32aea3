package org.pdm.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.pdm.antlr.PropositionalFormulaParser;
import org.pdm.formula.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * PARSER FORMULE - Discesa ricorsiva sulla grammatica PropositionalFormula
 *
 * GRAMMATICA (dalla precedenza più bassa alla più alta):
 * <pre>
 * iff         := implication ( '&lt;-&gt;' implication )*
 * implication := xor_expr ( '-&gt;' xor_expr )*
 * xor_expr    := or_expr ( 'XOR' or_expr )*
 * or_expr     := and_expr ( 'OR' and_expr )*
 * and_expr    := not_expr ( 'AND' not_expr )*
 * not_expr    := 'NOT' not_expr | primary
 * primary     := ATOM | '(' iff ')'
 * </pre>
 *
 * Tutti gli operatori binari sono associativi a sinistra. Il parser rifiuta la
 * formula vuota e qualsiasi token residuo dopo un'espressione completa: il primo
 * errore solleva {@link FormulaParseException} e nessun albero parziale viene restituito.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Analizza il testo di una formula: tokenizzazione seguita da parsing.
     *
     * @param text testo della formula
     * @return albero sintattico
     * @throws FormulaLexException per caratteri non validi
     * @throws FormulaParseException per violazioni della grammatica
     */
    public static Formula parse(String text) {
        return parse(FormulaLexer.tokenize(text));
    }

    /**
     * Analizza una sequenza di token terminata da END.
     *
     * @param tokens token prodotti da {@link FormulaLexer#tokenize(String)}
     * @return albero sintattico
     * @throws FormulaParseException per violazioni della grammatica
     * @throws IllegalArgumentException se compaiono token dopo END
     */
    public static Formula parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");

        PropositionalFormulaParser parser = new PropositionalFormulaParser(
                new CommonTokenStream(new ListTokenSource(toAntlrTokens(tokens))));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastParserListener.INSTANCE);

        Formula formula = new FormulaBuilder().visit(parser.formula());
        LOGGER.fine(() -> "Formula analizzata: " + formula);
        return formula;
    }

    private static List<org.antlr.v4.runtime.Token> toAntlrTokens(List<Token> tokens) {
        List<org.antlr.v4.runtime.Token> antlrTokens = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.END && i != tokens.size() - 1) {
                throw new IllegalArgumentException("Token presenti dopo END in posizione " + token.position());
            }
            CommonToken antlrToken = new CommonToken(token.type().antlrType(), token.text());
            antlrToken.setStartIndex(token.position());
            antlrToken.setStopIndex(token.position() + token.text().length() - 1);
            antlrToken.setLine(1);
            antlrToken.setCharPositionInLine(token.position());
            antlrTokens.add(antlrToken);
        }
        return antlrTokens;
    }

    /**
     * Trasforma la prima segnalazione del parser ANTLR in {@link FormulaParseException},
     * impedendo il recupero automatico che produrrebbe un albero parziale.
     */
    private static final class FailFastParserListener extends BaseErrorListener {

        static final FailFastParserListener INSTANCE = new FailFastParserListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            Parser parser = (Parser) recognizer;
            org.antlr.v4.runtime.Token offending = (org.antlr.v4.runtime.Token) offendingSymbol;

            String expected = parser.getExpectedTokens()
                    .toString(parser.getVocabulary())
                    .replace("<EOF>", "END");
            boolean atEnd = offending.getType() == org.antlr.v4.runtime.Token.EOF;
            String found = atEnd ? "END" : offending.getText();

            throw new FormulaParseException(Math.max(offending.getStartIndex(), 0), expected, found);
        }
    }
}
