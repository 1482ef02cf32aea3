package org.pdm.inference;

import java.util.Objects;

/**
 * Esito del backward chaining: verdetto e albero di prova con radice sull'obiettivo.
 */
public record BackwardChainResult(String goal, boolean proved, ProofNode proof) {

    public BackwardChainResult {
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(proof, "proof");
    }
}
