package org.pdm.parser;

/**
 * Carattere che non può iniziare alcun token valido.
 */
public class FormulaLexException extends FormulaSyntaxException {

    private final char character;

    public FormulaLexException(int position, char character) {
        super(String.format("Carattere non valido '%s' in posizione %d", character, position), position);
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }
}
