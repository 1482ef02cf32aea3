package org.pdm.rules;

import org.pdm.LogicException;

/**
 * Due regole della stessa base condividono l'identificatore.
 */
public class DuplicateRuleIdException extends LogicException {

    private final String ruleId;

    public DuplicateRuleIdException(String ruleId) {
        super("Identificatore di regola duplicato: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
