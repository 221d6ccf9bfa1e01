package com.labsignal.reasoning.api.exceptions;

/**
 * Thrown when a rule id does not exist in the active catalog snapshot.
 */
public class RuleNotFoundException extends IllegalArgumentException {

    private final String ruleId;

    public RuleNotFoundException(String ruleId) {
        super("Rule not found: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
