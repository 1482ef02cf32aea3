package org.pdm.inference;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Esito immutabile del forward chaining.
 */
public final class ForwardChainResult {

    private final Set<String> finalFacts;
    private final List<FiredRule> trace;
    private final List<Contradiction> contradictions;
    private final Set<String> refutedAtoms;
    private final List<String> skippedRules;
    private final int passes;

    ForwardChainResult(Set<String> finalFacts, List<FiredRule> trace, List<Contradiction> contradictions,
                       Set<String> refutedAtoms, List<String> skippedRules, int passes) {
        this.finalFacts = Collections.unmodifiableSet(new LinkedHashSet<>(finalFacts));
        this.trace = List.copyOf(trace);
        this.contradictions = List.copyOf(contradictions);
        this.refutedAtoms = Collections.unmodifiableSet(new LinkedHashSet<>(refutedAtoms));
        this.skippedRules = List.copyOf(skippedRules);
        this.passes = passes;
    }

    /** Fatti veri al punto fisso, nell'ordine in cui sono stati stabiliti. */
    public Set<String> getFinalFacts() {
        return finalFacts;
    }

    public List<FiredRule> getTrace() {
        return trace;
    }

    public List<Contradiction> getContradictions() {
        return contradictions;
    }

    public boolean hasContradictions() {
        return !contradictions.isEmpty();
    }

    /** Atomi asseriti falsi da conclusioni negate. */
    public Set<String> getRefutedAtoms() {
        return refutedAtoms;
    }

    /** Regole ignorate perché la conclusione non è un letterale o una congiunzione di letterali. */
    public List<String> getSkippedRules() {
        return skippedRules;
    }

    /** Passaggi eseguiti, compreso quello finale senza novità. */
    public int getPasses() {
        return passes;
    }

    @Override
    public String toString() {
        return String.format("ForwardChainResult[facts=%s, fired=%d, contradictions=%d, passes=%d]",
                finalFacts, trace.size(), contradictions.size(), passes);
    }
}
