package org.pdm.parser;

import org.pdm.antlr.PropositionalFormulaLexer;

/**
 * Categorie di token della sintassi delle formule, allineate al vocabolario
 * del lexer generato dalla grammatica.
 */
public enum TokenType {
    ATOM(PropositionalFormulaLexer.ATOM),
    NOT(PropositionalFormulaLexer.NOT),
    AND(PropositionalFormulaLexer.AND),
    OR(PropositionalFormulaLexer.OR),
    XOR(PropositionalFormulaLexer.XOR),
    IMPLIES(PropositionalFormulaLexer.IMPLIES),
    IFF(PropositionalFormulaLexer.IFF),
    LPAREN(PropositionalFormulaLexer.LPAREN),
    RPAREN(PropositionalFormulaLexer.RPAREN),
    END(org.antlr.v4.runtime.Token.EOF);

    private final int antlrType;

    TokenType(int antlrType) {
        this.antlrType = antlrType;
    }

    int antlrType() {
        return antlrType;
    }

    static TokenType fromAntlrType(int antlrType) {
        for (TokenType type : values()) {
            if (type.antlrType == antlrType) {
                return type;
            }
        }
        throw new IllegalArgumentException("Tipo di token ANTLR sconosciuto: " + antlrType);
    }
}
