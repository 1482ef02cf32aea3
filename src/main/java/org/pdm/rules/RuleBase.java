package org.pdm.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * BASE DI REGOLE - Sequenza ordinata e immutabile di regole
 *
 * L'ordine conta solo per il determinismo: i motori provano le regole in sequenza.
 * Gli identificatori devono essere unici all'interno della base.
 *
 * INDICI PRECALCOLATI:
 * • identificatore -> regola
 * • atomo -> regole la cui conclusione è esattamente quell'atomo (backward chaining)
 */
public final class RuleBase implements Iterable<Rule> {

    private static final RuleBase EMPTY = new RuleBase(List.of());

    private final List<Rule> rules;
    private final Map<String, Rule> rulesById;
    private final Map<String, List<Rule>> rulesByConclusion;

    /**
     * @param rules regole nell'ordine di valutazione
     * @throws DuplicateRuleIdException se due regole hanno lo stesso identificatore
     */
    public RuleBase(List<Rule> rules) {
        Objects.requireNonNull(rules, "rules");

        Map<String, Rule> byId = new LinkedHashMap<>();
        Map<String, List<Rule>> byConclusion = new LinkedHashMap<>();
        for (Rule rule : rules) {
            Objects.requireNonNull(rule, "rule");
            if (byId.putIfAbsent(rule.getId(), rule) != null) {
                throw new DuplicateRuleIdException(rule.getId());
            }
            if (rule.getConclusionKind() == ConclusionKind.POSITIVE_ATOM) {
                byConclusion.computeIfAbsent(rule.getConclusion().getName(), k -> new ArrayList<>()).add(rule);
            }
        }

        this.rules = List.copyOf(rules);
        this.rulesById = Collections.unmodifiableMap(byId);
        this.rulesByConclusion = Collections.unmodifiableMap(byConclusion);
    }

    public static RuleBase of(Rule... rules) {
        return new RuleBase(Arrays.asList(rules));
    }

    public static RuleBase empty() {
        return EMPTY;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public Optional<Rule> getRule(String id) {
        return Optional.ofNullable(rulesById.get(id));
    }

    /** Regole con conclusione esattamente {@code Atom(atom)}, in ordine di base. */
    public List<Rule> rulesConcluding(String atom) {
        List<Rule> candidates = rulesByConclusion.get(atom);
        return candidates != null ? Collections.unmodifiableList(candidates) : List.of();
    }

    /** Universo degli atomi citati da premesse e conclusioni, in ordine di prima apparizione. */
    public Set<String> atoms() {
        Set<String> atoms = new LinkedHashSet<>();
        for (Rule rule : rules) {
            atoms.addAll(rule.getPremise().atoms());
            atoms.addAll(rule.getConclusion().atoms());
        }
        return Collections.unmodifiableSet(atoms);
    }

    /** Nuova base con la regola aggiunta in coda. */
    public RuleBase withRule(Rule rule) {
        List<Rule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new RuleBase(extended);
    }

    /** Nuova base con le regole di questa seguite da quelle di {@code other}. */
    public RuleBase concat(RuleBase other) {
        List<Rule> merged = new ArrayList<>(rules);
        merged.addAll(other.rules);
        return new RuleBase(merged);
    }

    @Override
    public Iterator<Rule> iterator() {
        return rules.iterator();
    }

    @Override
    public String toString() {
        return "RuleBase" + rules;
    }
}
