package org.pdm.rules;

import org.junit.Test;
import org.pdm.formula.Formula;
import org.pdm.parser.FormulaParser;
import org.pdm.parser.FormulaParseException;

import java.util.List;

import static org.junit.Assert.*;

public class RuleBaseTest {

    private static Rule rule(String id, String premise, String conclusion) {
        return Rule.parse(id, premise, conclusion, "If " + premise + " then " + conclusion);
    }

    @Test
    public void duplicateIdsAreRejected() {
        try {
            RuleBase.of(rule("R1", "A", "B"), rule("R1", "C", "D"));
            fail("Atteso DuplicateRuleIdException");
        } catch (DuplicateRuleIdException e) {
            assertEquals("R1", e.getRuleId());
        }
    }

    @Test
    public void indexesRulesByPositiveConclusion() {
        RuleBase base = RuleBase.of(
                rule("R1", "A", "Goal"),
                rule("R2", "B", "NOT Goal"),
                rule("R3", "C", "Goal"),
                rule("R4", "D", "Goal OR Other"));

        List<Rule> candidates = base.rulesConcluding("Goal");
        assertEquals(2, candidates.size());
        assertEquals("R1", candidates.get(0).getId());
        assertEquals("R3", candidates.get(1).getId());
        assertTrue(base.rulesConcluding("Other").isEmpty());
        assertTrue(base.getRule("R2").isPresent());
        assertFalse(base.getRule("R9").isPresent());
    }

    @Test
    public void atomUniverseInFirstAppearanceOrder() {
        RuleBase base = RuleBase.of(rule("R1", "Fever AND Cough", "Flu"), rule("R2", "Flu OR Rash", "Doctor"));
        assertEquals(List.of("Fever", "Cough", "Flu", "Rash", "Doctor"), List.copyOf(base.atoms()));
    }

    @Test
    public void withRuleAndConcatReturnNewBases() {
        RuleBase base = RuleBase.of(rule("R1", "A", "B"));
        RuleBase extended = base.withRule(rule("R2", "B", "C"));
        RuleBase merged = extended.concat(RuleBase.of(rule("R3", "C", "D")));

        assertEquals(1, base.size());
        assertEquals(2, extended.size());
        assertEquals(3, merged.size());
        assertEquals("R3", merged.getRules().get(2).getId());
        assertTrue(RuleBase.empty().isEmpty());
    }

    @Test(expected = DuplicateRuleIdException.class)
    public void concatDetectsCollisions() {
        RuleBase.of(rule("R1", "A", "B")).concat(RuleBase.of(rule("R1", "C", "D")));
    }

    @Test
    public void conclusionKinds() {
        assertEquals(ConclusionKind.POSITIVE_ATOM, rule("R1", "A", "B").getConclusionKind());
        assertEquals(ConclusionKind.NEGATED_ATOM, rule("R2", "A", "NOT B").getConclusionKind());
        assertEquals(ConclusionKind.LITERAL_CONJUNCTION, rule("R3", "A", "B AND NOT C AND D").getConclusionKind());
        assertEquals(ConclusionKind.COMPOUND, rule("R4", "A", "B OR C").getConclusionKind());
        assertEquals(ConclusionKind.COMPOUND, rule("R5", "A", "NOT (B AND C)").getConclusionKind());
    }

    @Test
    public void conclusionLiterals() {
        assertEquals(List.of(new Literal("B", true), new Literal("C", false), new Literal("D", true)),
                rule("R1", "A", "B AND NOT C AND D").conclusionLiterals());
        assertTrue(rule("R2", "A", "B -> C").conclusionLiterals().isEmpty());
        assertTrue(rule("R3", "A", "B").concludes("B"));
        assertFalse(rule("R4", "A", "NOT B").concludes("B"));
    }

    @Test
    public void ruleFromTreesUsesCanonicalText() {
        Rule rule = new Rule("R1", FormulaParser.parse("a&b"), Formula.atom("c"), "testo");
        assertEquals("a AND b", rule.getPremiseText());
        assertEquals("c", rule.getConclusionText());
    }

    @Test
    public void ruleFromTextKeepsSourceText() {
        Rule rule = rule("R1", "fever  &(cough|sore)", "flu");
        assertEquals("fever  &(cough|sore)", rule.getPremiseText());
        assertEquals(FormulaParser.parse("fever AND (cough OR sore)"), rule.getPremise());
    }

    @Test(expected = FormulaParseException.class)
    public void invalidPremiseIsRejected() {
        rule("R1", "A AND", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void blankIdIsRejected() {
        rule(" ", "A", "B");
    }
}
