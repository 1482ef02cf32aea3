package org.pdm.inference;

import org.pdm.rules.Rule;
import org.pdm.rules.RuleBase;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * BACKWARD CHAINING - Ricerca ricorsiva in profondità di una prova per un atomo obiettivo
 *
 * ALGORITMO per un obiettivo g:
 * 1. g è un fatto: successo immediato, nodo FACT
 * 2. g è già sullo stack di ricorsione (insieme visited): fallimento CYCLE, nessuna ricorsione
 * 3. altrimenti g entra in visited; le regole con conclusione esattamente Atom(g) sono provate
 *    in ordine di base. Per ognuna si dimostra ricorsivamente ogni atomo della premessa e si
 *    valuta la premessa con i valori ottenuti (atomi non dimostrati = falsi). La prima regola
 *    con premessa vera produce RULE_APPLICATION
 * 4. nessuna regola: NO_APPLICABLE_RULE; tutte con premessa falsa: PREMISE_FALSE
 * 5. g esce da visited al ritorno, così un obiettivo indipendente può essere ridimostrato
 *
 * L'insieme visited è un parametro passato lungo la ricorsione e creato a ogni chiamata
 * pubblica: il metodo è puro e rientrante. Non c'è memoizzazione tra sotto-obiettivi.
 * Un obiettivo non dimostrabile non solleva eccezioni: il fallimento è un risultato.
 */
public class BackwardChainer {

    private static final Logger LOGGER = Logger.getLogger(BackwardChainer.class.getName());

    /**
     * Tenta di dimostrare un atomo obiettivo.
     *
     * @param ruleBase regole disponibili
     * @param facts atomi noti come veri
     * @param goal atomo da dimostrare
     * @return verdetto e albero di prova
     */
    public BackwardChainResult backwardChain(RuleBase ruleBase, Set<String> facts, String goal) {
        Objects.requireNonNull(ruleBase, "ruleBase");
        Objects.requireNonNull(facts, "facts");
        Objects.requireNonNull(goal, "goal");

        ProofNode proof = prove(goal, ruleBase, facts, new HashSet<>());
        LOGGER.info(() -> "Obiettivo " + goal + (proof.isProved() ? " dimostrato" : " non dimostrato"));
        return new BackwardChainResult(goal, proof.isProved(), proof);
    }

    private ProofNode prove(String goal, RuleBase ruleBase, Set<String> facts, Set<String> visited) {
        if (facts.contains(goal)) {
            return ProofNode.fact(goal);
        }
        if (!visited.add(goal)) {
            LOGGER.fine(() -> "Ciclo rilevato su " + goal);
            return ProofNode.failure(goal, FailureReason.CYCLE, null, List.of());
        }

        try {
            List<Rule> candidates = ruleBase.rulesConcluding(goal);
            if (candidates.isEmpty()) {
                return ProofNode.failure(goal, FailureReason.NO_APPLICABLE_RULE, null, List.of());
            }

            Rule lastRule = null;
            List<ProofNode> lastProofs = List.of();
            for (Rule rule : candidates) {
                LOGGER.finest(() -> "Tentativo " + rule.getId() + " per " + goal + " (profondità " + visited.size() + ")");

                List<ProofNode> premiseProofs = new ArrayList<>();
                Set<String> proven = new HashSet<>();
                for (String atom : rule.getPremise().atoms()) {
                    ProofNode subProof = prove(atom, ruleBase, facts, visited);
                    premiseProofs.add(subProof);
                    if (subProof.isProved()) {
                        proven.add(atom);
                    }
                }

                if (rule.getPremise().evaluate(proven)) {
                    return ProofNode.ruleApplication(goal, rule.getId(), premiseProofs);
                }
                lastRule = rule;
                lastProofs = premiseProofs;
            }
            return ProofNode.failure(goal, FailureReason.PREMISE_FALSE, lastRule.getId(), lastProofs);
        } finally {
            visited.remove(goal);
        }
    }
}
