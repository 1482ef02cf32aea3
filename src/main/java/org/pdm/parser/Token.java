package org.pdm.parser;

import java.util.Objects;

/**
 * Token immutabile prodotto dal lexer.
 *
 * @param type categoria del token
 * @param text testo originale (case preservato; vuoto per END)
 * @param position offset del primo carattere nel testo della formula
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        if (position < 0) {
            throw new IllegalArgumentException("Posizione negativa: " + position);
        }
    }

    public static Token atom(String name, int position) {
        return new Token(TokenType.ATOM, name, position);
    }

    public static Token end(int position) {
        return new Token(TokenType.END, "", position);
    }
}
