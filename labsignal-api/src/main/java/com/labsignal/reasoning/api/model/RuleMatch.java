package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One fully satisfied rule together with the finding it produced and one
 * evidence line per threshold.
 */
public record RuleMatch(
        @JsonIgnore Rule rule,
        @JsonIgnore Finding finding,
        @JsonProperty("evidence") List<String> evidence
) {
    public RuleMatch {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(finding, "finding must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @JsonProperty("rule_id")
    public String ruleId() {
        return rule.id();
    }

    @JsonProperty("rule_name")
    public String ruleName() {
        return rule.name();
    }

    @JsonProperty("finding_id")
    public String findingId() {
        return finding.id();
    }
}
