package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A condition reachable from at least one matched finding.
 *
 * @param relatedFindings ids of the matched findings that indicate this condition, sorted
 * @param whyLinked       short explanation, e.g. "Based on findings: F001, F006"
 * @param confidence      fixed base confidence of a graph-linked condition
 */
public record MatchedCondition(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("urgency_level") UrgencyLevel urgencyLevel,
        @JsonProperty("related_findings") List<String> relatedFindings,
        @JsonProperty("why_linked") String whyLinked,
        @JsonProperty("confidence") double confidence
) {
    public MatchedCondition {
        relatedFindings = relatedFindings == null ? List.of() : List.copyOf(relatedFindings);
    }
}
