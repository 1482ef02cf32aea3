package org.pdm.inference;

import org.pdm.rules.ConclusionKind;
import org.pdm.rules.Literal;
import org.pdm.rules.Rule;
import org.pdm.rules.RuleBase;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * FORWARD CHAINING - Iterazione delle regole fino al punto fisso
 *
 * ALGORITMO:
 * 1. Copia i fatti iniziali: l'insieme del chiamante non viene mai modificato
 * 2. Passaggio completo sulla base in ordine di sequenza; per ogni regola con premessa
 *    vera (mondo chiuso, atomi assenti = falsi) applica i letterali della conclusione:
 *    • Atom(x): aggiunge x se assente
 *    • Not(Atom(x)): se x è già vero registra una contraddizione, altrimenti x diventa confutato
 * 3. Ripete finché un passaggio non aggiunge fatti né registra contraddizioni nuove
 *
 * TERMINAZIONE: l'insieme dei fatti cresce in modo monotono ed è limitato dagli atomi della
 * base; le contraddizioni sono deduplicate per (atomo, regola che nega l'atomo).
 *
 * Le contraddizioni non interrompono l'inferenza: vengono accumulate e restituite tutte.
 * Le regole con conclusione {@link ConclusionKind#COMPOUND} sono ignorate con un avviso.
 */
public class ForwardChainer {

    private static final Logger LOGGER = Logger.getLogger(ForwardChainer.class.getName());

    /**
     * Esegue il forward chaining.
     *
     * @param ruleBase regole da applicare
     * @param initialFacts atomi inizialmente veri
     * @return fatti finali, traccia delle regole scattate e contraddizioni
     */
    public ForwardChainResult forwardChain(RuleBase ruleBase, Set<String> initialFacts) {
        Objects.requireNonNull(ruleBase, "ruleBase");
        Objects.requireNonNull(initialFacts, "initialFacts");

        ChainingState state = new ChainingState(initialFacts);
        List<String> skippedRules = collectSkippedRules(ruleBase);

        int pass = 0;
        boolean changed;
        do {
            pass++;
            changed = false;
            for (Rule rule : ruleBase) {
                if (rule.getConclusionKind().isChainable()) {
                    changed |= applyRule(rule, pass, state);
                }
            }
            LOGGER.finest("Passaggio " + pass + " completato, fatti: " + state.facts);
        } while (changed);

        ForwardChainResult result = new ForwardChainResult(state.facts, state.trace, state.contradictions,
                state.refutedBy.keySet(), skippedRules, pass);
        LOGGER.info(result::toString);
        return result;
    }

    private static List<String> collectSkippedRules(RuleBase ruleBase) {
        List<String> skipped = new ArrayList<>();
        for (Rule rule : ruleBase) {
            if (!rule.getConclusionKind().isChainable()) {
                LOGGER.warning("Regola " + rule.getId() + " ignorata: conclusione non letterale '"
                        + rule.getConclusionText() + "'");
                skipped.add(rule.getId());
            }
        }
        return skipped;
    }

    /**
     * Applica una regola allo stato corrente.
     *
     * @return true se sono stati aggiunti fatti o registrate contraddizioni nuove
     */
    private boolean applyRule(Rule rule, int pass, ChainingState state) {
        if (!rule.getPremise().evaluate(state.facts)) {
            return false;
        }

        boolean changed = false;
        List<String> added = new ArrayList<>();
        for (Literal literal : rule.conclusionLiterals()) {
            String atom = literal.atom();
            if (literal.positive()) {
                String refutingRule = state.refutedBy.get(atom);
                if (refutingRule != null) {
                    changed |= state.recordContradiction(atom, refutingRule,
                            String.format("%s deriva %s, già asserito falso da %s", rule.getId(), atom, refutingRule));
                }
                if (state.facts.add(atom)) {
                    added.add(atom);
                }
            } else if (state.facts.contains(atom)) {
                changed |= state.recordContradiction(atom, rule.getId(),
                        String.format("%s deriva NOT %s, ma %s è già vero", rule.getId(), atom, atom));
            } else {
                state.refutedBy.putIfAbsent(atom, rule.getId());
            }
        }

        if (!added.isEmpty()) {
            int step = state.trace.size() + 1;
            String explanation = String.format("Passo %d: %s applicata perché %s è vera -> dedotto %s",
                    step, rule.getId(), rule.getPremiseText(), String.join(", ", added));
            state.trace.add(new FiredRule(step, pass, rule.getId(), added, explanation));
            LOGGER.fine(explanation);
            changed = true;
        }
        return changed;
    }

    /**
     * Stato mutabile confinato in una singola chiamata.
     */
    private static final class ChainingState {
        final Set<String> facts;
        // atomo confutato -> prima regola che lo ha negato
        final Map<String, String> refutedBy = new LinkedHashMap<>();
        final List<FiredRule> trace = new ArrayList<>();
        final List<Contradiction> contradictions = new ArrayList<>();
        final Set<List<String>> contradictionKeys = new HashSet<>();

        ChainingState(Set<String> initialFacts) {
            this.facts = new LinkedHashSet<>(initialFacts);
        }

        /**
         * Registra un conflitto x / NOT x identificato dalla coppia (atomo, regola negante):
         * lo stesso conflitto rilevato da entrambi i lati viene registrato una sola volta.
         */
        boolean recordContradiction(String atom, String negatingRuleId, String message) {
            if (!contradictionKeys.add(List.of(atom, negatingRuleId))) {
                return false;
            }
            LOGGER.warning("Contraddizione su " + atom + ": " + message);
            contradictions.add(new Contradiction(atom, negatingRuleId, message));
            return true;
        }
    }
}
