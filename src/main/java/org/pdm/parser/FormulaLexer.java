package org.pdm.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.pdm.antlr.PropositionalFormulaLexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * LEXER FORMULE - Scomposizione del testo in token
 *
 * Utilizza il lexer ANTLR generato dalla grammatica PropositionalFormula e converte
 * i suoi token nei valori immutabili {@link Token}.
 *
 * REGOLE LESSICALI:
 * • Spazi bianchi: separatori, scartati
 * • NOT/AND/OR/XOR: parole chiave riconosciute senza distinzione di maiuscole,
 *   solo come parola intera (ANDROID è un atomo)
 * • ~ & |: alias simbolici di NOT, AND, OR
 * • &lt;-&gt; e -&gt;: riconosciuti con match più lungo, un '-' isolato è un errore
 * • Ogni altro identificatore alfanumerico diventa un ATOM
 *
 * Il primo carattere non riconosciuto interrompe la scansione con {@link FormulaLexException}.
 */
public final class FormulaLexer {

    private static final Logger LOGGER = Logger.getLogger(FormulaLexer.class.getName());

    private FormulaLexer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Converte il testo di una formula nella sequenza di token, terminata da END.
     *
     * @param text testo della formula
     * @return lista immutabile di token
     * @throws FormulaLexException al primo carattere che non può iniziare un token
     */
    public static List<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text");

        PropositionalFormulaLexer lexer = new PropositionalFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new FailFastLexerListener(text));

        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token antlrToken : lexer.getAllTokens()) {
            tokens.add(new Token(TokenType.fromAntlrType(antlrToken.getType()),
                    antlrToken.getText(), antlrToken.getStartIndex()));
        }
        tokens.add(Token.end(text.length()));

        LOGGER.finest(() -> "Token prodotti: " + tokens.size() + " per '" + text + "'");
        return List.copyOf(tokens);
    }

    /**
     * Trasforma la prima segnalazione del lexer ANTLR in {@link FormulaLexException}
     * invece di stamparla su console e proseguire.
     */
    private static final class FailFastLexerListener extends BaseErrorListener {

        private final String text;

        FailFastLexerListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            int position = e instanceof LexerNoViableAltException
                    ? ((LexerNoViableAltException) e).getStartIndex()
                    : charPositionInLine;
            char character = position < text.length() ? text.charAt(position) : '\0';
            throw new FormulaLexException(position, character);
        }
    }
}
