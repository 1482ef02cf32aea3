package org.pdm.inference;

import java.util.Objects;

/**
 * Conflitto rilevato dal forward chaining: una regola ha asserito la polarità opposta
 * di un atomo già stabilito.
 */
public record Contradiction(String atom, String viaRule, String message) {

    public Contradiction {
        Objects.requireNonNull(atom, "atom");
        Objects.requireNonNull(viaRule, "viaRule");
    }
}
