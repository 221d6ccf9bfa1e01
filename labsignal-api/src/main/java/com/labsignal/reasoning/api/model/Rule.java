/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A deterministic clinical rule: the conjunction of its thresholds, optionally
 * gated by a demographic constraint, producing exactly one finding.
 *
 * <p>A rule matches only when every test it references has a reading and
 * every threshold is met. {@code logicType} is descriptive and does not
 * change evaluation.
 */
public record Rule(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("logic_type") LogicType logicType,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("evidence_level") EvidenceLevel evidenceLevel,
        @JsonProperty("thresholds") List<Threshold> thresholds,
        @JsonProperty("constraint") DemographicConstraint constraint,
        @JsonProperty("finding_id") String findingId
) {
    public Rule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(findingId, "findingId must not be null");
        thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
    }

    /**
     * Ids of the tests this rule needs, in threshold order, without duplicates.
     */
    @JsonProperty("required_tests")
    public List<String> requiredTestIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Threshold t : thresholds) {
            ids.add(t.testId());
        }
        return new ArrayList<>(ids);
    }

    /**
     * Canonical names of the tests this rule needs, in threshold order, without duplicates.
     */
    @JsonProperty("required_test_names")
    public List<String> requiredTestNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Threshold t : thresholds) {
            names.add(t.testName());
        }
        return new ArrayList<>(names);
    }

    public boolean hasConstraint() {
        return constraint != null;
    }
}
