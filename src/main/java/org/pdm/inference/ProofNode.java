package org.pdm.inference;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * NODO DI PROVA - Registro ricorsivo di come un obiettivo è stato (o non è stato) stabilito
 *
 * TIPI:
 * • FACT: l'obiettivo è un fatto noto
 * • RULE_APPLICATION: l'obiettivo segue da una regola; i figli sono le prove degli atomi
 *   della premessa, nell'ordine di prima apparizione
 * • FAILURE: l'obiettivo non è dimostrabile; per {@link FailureReason#PREMISE_FALSE} i figli
 *   sono le prove dell'ultima regola tentata, così un ciclo annidato resta ispezionabile
 *
 * L'albero è costruito una volta per chiamata e non viene più modificato.
 */
public final class ProofNode {

    public enum Kind {
        FACT,
        RULE_APPLICATION,
        FAILURE
    }

    private final Kind kind;
    private final String goal;
    private final String ruleId;
    private final FailureReason reason;
    private final List<ProofNode> premiseProofs;

    private ProofNode(Kind kind, String goal, String ruleId, FailureReason reason, List<ProofNode> premiseProofs) {
        this.kind = kind;
        this.goal = Objects.requireNonNull(goal, "goal");
        this.ruleId = ruleId;
        this.reason = reason;
        this.premiseProofs = List.copyOf(premiseProofs);
    }

    static ProofNode fact(String goal) {
        return new ProofNode(Kind.FACT, goal, null, null, List.of());
    }

    static ProofNode ruleApplication(String goal, String ruleId, List<ProofNode> premiseProofs) {
        return new ProofNode(Kind.RULE_APPLICATION, goal, Objects.requireNonNull(ruleId, "ruleId"),
                null, premiseProofs);
    }

    static ProofNode failure(String goal, FailureReason reason, String lastRuleId, List<ProofNode> premiseProofs) {
        return new ProofNode(Kind.FAILURE, goal, lastRuleId, Objects.requireNonNull(reason, "reason"),
                premiseProofs);
    }

    public Kind getKind() {
        return kind;
    }

    public String getGoal() {
        return goal;
    }

    /**
     * Regola applicata (RULE_APPLICATION) o ultima regola tentata (FAILURE con premessa falsa).
     */
    public Optional<String> getRuleId() {
        return Optional.ofNullable(ruleId);
    }

    /** Motivo del fallimento, presente solo per FAILURE. */
    public Optional<FailureReason> getReason() {
        return Optional.ofNullable(reason);
    }

    public List<ProofNode> getPremiseProofs() {
        return premiseProofs;
    }

    public boolean isProved() {
        return kind != Kind.FAILURE;
    }

    public String getMessage() {
        return switch (kind) {
            case FACT -> "Dato come fatto.";
            case RULE_APPLICATION -> "Dimostrato " + goal + " con la regola " + ruleId + ".";
            case FAILURE -> reason.description();
        };
    }

    /** Profondità dell'albero (un nodo foglia ha profondità 1). */
    public int depth() {
        int max = 0;
        for (ProofNode child : premiseProofs) {
            max = Math.max(max, child.depth());
        }
        return max + 1;
    }

    /** Primo nodo di fallimento con il motivo indicato, in visita anticipata. */
    public Optional<ProofNode> find(FailureReason wanted) {
        if (reason == wanted) {
            return Optional.of(this);
        }
        for (ProofNode child : premiseProofs) {
            Optional<ProofNode> found = child.find(wanted);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** Rappresentazione indentata su più righe, un nodo per riga. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        render(sb, 0);
        return sb.toString();
    }

    private void render(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent))
                .append(isProved() ? "[OK] " : "[KO] ")
                .append(goal);
        if (ruleId != null) {
            sb.append(" (").append(ruleId).append(')');
        }
        sb.append(": ").append(getMessage()).append('\n');
        for (ProofNode child : premiseProofs) {
            child.render(sb, indent + 1);
        }
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FACT -> "Fact(" + goal + ")";
            case RULE_APPLICATION -> "RuleApplication(" + ruleId + ", " + goal + ", " + premiseProofs + ")";
            case FAILURE -> "Failure(" + goal + ", " + reason.code() + ")";
        };
    }
}
