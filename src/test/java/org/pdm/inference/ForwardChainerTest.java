package org.pdm.inference;

import org.junit.Test;
import org.pdm.rules.Rule;
import org.pdm.rules.RuleBase;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ForwardChainerTest {

    private final ForwardChainer chainer = new ForwardChainer();

    private static Rule rule(String id, String premise, String conclusion) {
        return Rule.parse(id, premise, conclusion, "");
    }

    @Test
    public void infersConclusionFromPremise() {
        RuleBase base = RuleBase.of(rule("R1", "A AND B", "C"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A", "B"));

        assertEquals(Set.of("A", "B", "C"), result.getFinalFacts());
        assertEquals(1, result.getTrace().size());
        FiredRule fired = result.getTrace().get(0);
        assertEquals("R1", fired.ruleId());
        assertEquals(List.of("C"), fired.addedAtoms());
        assertEquals(1, fired.step());
        assertTrue(fired.explanation().contains("R1"));
        assertFalse(result.hasContradictions());
    }

    @Test
    public void chainsUntilFixpoint() {
        RuleBase base = RuleBase.of(
                rule("R3", "C", "D"),
                rule("R1", "A", "B"),
                rule("R2", "B", "C"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(result.getFinalFacts()));
        assertEquals(3, result.getTrace().size());
        assertEquals("R1", result.getTrace().get(0).ruleId());
        assertEquals(1, result.getTrace().get(0).pass());
        assertEquals("R3", result.getTrace().get(2).ruleId());
        assertEquals(2, result.getTrace().get(2).pass());
        assertEquals(3, result.getTrace().get(2).step());
        assertEquals(3, result.getPasses());
    }

    @Test
    public void nothingFiresWithoutSupport() {
        RuleBase base = RuleBase.of(rule("R1", "A AND B", "C"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(Set.of("A"), result.getFinalFacts());
        assertTrue(result.getTrace().isEmpty());
        assertEquals(1, result.getPasses());
    }

    @Test
    public void negatedPremiseUsesClosedWorld() {
        RuleBase base = RuleBase.of(rule("R1", "Income AND NOT Debt", "Approve"));

        assertTrue(chainer.forwardChain(base, Set.of("Income")).getFinalFacts().contains("Approve"));
        assertFalse(chainer.forwardChain(base, Set.of("Income", "Debt")).getFinalFacts().contains("Approve"));
    }

    @Test
    public void contradictionIsRecordedOnce() {
        RuleBase base = RuleBase.of(rule("R1", "A", "B"), rule("R2", "A", "NOT B"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(1, result.getContradictions().size());
        Contradiction contradiction = result.getContradictions().get(0);
        assertEquals("B", contradiction.atom());
        assertEquals("R2", contradiction.viaRule());
        assertTrue(result.getFinalFacts().contains("B"));
    }

    @Test
    public void contradictionInEitherOrderIsRecorded() {
        RuleBase base = RuleBase.of(rule("R2", "A", "NOT B"), rule("R1", "A", "B"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(1, result.getContradictions().size());
        Contradiction contradiction = result.getContradictions().get(0);
        assertEquals("B", contradiction.atom());
        assertEquals("R2", contradiction.viaRule());
        assertTrue(result.getFinalFacts().contains("B"));
        assertTrue(result.getRefutedAtoms().contains("B"));
    }

    @Test
    public void eachNegatingRuleIsReportedSeparately() {
        RuleBase base = RuleBase.of(
                rule("R1", "A", "NOT B"),
                rule("R2", "A", "NOT B"),
                rule("R3", "A", "B"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(2, result.getContradictions().size());
        assertEquals("R1", result.getContradictions().get(0).viaRule());
        assertEquals("R2", result.getContradictions().get(1).viaRule());
    }

    @Test
    public void rerunFromFinalFactsIsIdempotent() {
        RuleBase base = RuleBase.of(
                rule("R1", "Fever AND Cough", "Flu"),
                rule("R2", "Flu", "Rest"),
                rule("R3", "Rest OR Injury", "SickLeave"),
                rule("R4", "Flu", "NOT FitToWork"));
        ForwardChainResult first = chainer.forwardChain(base, Set.of("Fever", "Cough"));
        ForwardChainResult second = chainer.forwardChain(base, first.getFinalFacts());

        assertEquals(first.getFinalFacts(), second.getFinalFacts());
        assertTrue(second.getTrace().isEmpty());
        assertEquals(1, second.getPasses());
    }

    @Test
    public void finalFactsStayWithinRuleBaseAtoms() {
        RuleBase base = RuleBase.of(
                rule("R1", "A", "B"),
                rule("R2", "B", "A"),
                rule("R3", "A AND B", "C"),
                rule("R4", "C XOR A", "D"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertTrue(base.atoms().containsAll(result.getFinalFacts()));
        assertTrue(result.getFinalFacts().size() <= base.atoms().size());
        assertEquals(Set.of("A", "B", "C"), result.getFinalFacts());
    }

    @Test
    public void callerFactsAreNotModified() {
        Set<String> facts = new HashSet<>(Set.of("A"));
        chainer.forwardChain(RuleBase.of(rule("R1", "A", "B")), facts);
        assertEquals(Set.of("A"), facts);
    }

    @Test
    public void literalConjunctionAssertsEveryLiteral() {
        RuleBase base = RuleBase.of(rule("R1", "A", "B AND NOT C AND D"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(Set.of("A", "B", "D"), result.getFinalFacts());
        assertEquals(List.of("B", "D"), result.getTrace().get(0).addedAtoms());
        assertEquals(Set.of("C"), result.getRefutedAtoms());
    }

    @Test
    public void compoundConclusionIsSkipped() {
        RuleBase base = RuleBase.of(rule("R1", "A", "B OR C"), rule("R2", "A", "D"));
        ForwardChainResult result = chainer.forwardChain(base, Set.of("A"));

        assertEquals(List.of("R1"), result.getSkippedRules());
        assertEquals(Set.of("A", "D"), result.getFinalFacts());
    }

    @Test
    public void emptyRuleBaseReturnsInitialFacts() {
        ForwardChainResult result = chainer.forwardChain(RuleBase.empty(), Set.of("X"));
        assertEquals(Set.of("X"), result.getFinalFacts());
        assertTrue(result.getTrace().isEmpty());
    }
}
