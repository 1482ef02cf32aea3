package org.pdm.rules;

import java.util.Objects;

/**
 * Atomo con polarità: positivo asserisce che l'atomo è vero, negativo che è falso.
 */
public record Literal(String atom, boolean positive) {

    public Literal {
        Objects.requireNonNull(atom, "atom");
    }

    @Override
    public String toString() {
        return positive ? atom : "NOT " + atom;
    }
}
