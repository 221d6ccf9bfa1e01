package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A finding present in the signal bundle, with the evidence of every rule
 * that produced it.
 *
 * @param ruleIds      ids of the rules that produced this finding, in match order
 * @param relatedTests canonical names of the tests those rules consulted
 * @param confidence   fixed base confidence of a fully matched rule
 */
public record MatchedFinding(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("description") String description,
        @JsonProperty("patient_friendly") String patientFriendly,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("rule_ids") List<String> ruleIds,
        @JsonProperty("related_tests") List<String> relatedTests,
        @JsonProperty("confidence") double confidence
) {
    public MatchedFinding {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        ruleIds = ruleIds == null ? List.of() : List.copyOf(ruleIds);
        relatedTests = relatedTests == null ? List.of() : List.copyOf(relatedTests);
    }
}
