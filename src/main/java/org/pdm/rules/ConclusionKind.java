package org.pdm.rules;

import org.pdm.formula.Formula;

/**
 * Forma della conclusione di una regola, decisa con un match esplicito sul tipo di nodo.
 */
public enum ConclusionKind {
    /** Singolo atomo: l'unica forma utilizzabile come obiettivo nel backward chaining */
    POSITIVE_ATOM,
    /** Atomo negato: asserisce che l'atomo è falso */
    NEGATED_ATOM,
    /** Congiunzione di atomi e atomi negati */
    LITERAL_CONJUNCTION,
    /** Qualsiasi altra forma: ignorata dai motori di inferenza */
    COMPOUND;

    public static ConclusionKind classify(Formula conclusion) {
        return switch (conclusion.getType()) {
            case ATOM -> POSITIVE_ATOM;
            case NOT -> conclusion.getOperand().isAtom() ? NEGATED_ATOM : COMPOUND;
            case AND -> isLiteralConjunction(conclusion) ? LITERAL_CONJUNCTION : COMPOUND;
            default -> COMPOUND;
        };
    }

    private static boolean isLiteralConjunction(Formula formula) {
        return switch (formula.getType()) {
            case ATOM -> true;
            case NOT -> formula.getOperand().isAtom();
            case AND -> isLiteralConjunction(formula.getLeft()) && isLiteralConjunction(formula.getRight());
            default -> false;
        };
    }

    public boolean isChainable() {
        return this != COMPOUND;
    }
}
