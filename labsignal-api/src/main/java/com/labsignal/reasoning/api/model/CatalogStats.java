/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Size and compilation metadata of a catalog snapshot.
 *
 * @param unsatisfiableRules ids of rules whose thresholds contradict each other and can never match
 * @param metadata           compiler-specific extras (source origin, catalog version)
 */
public record CatalogStats(
        @JsonProperty("test_count") int testCount,
        @JsonProperty("rule_count") int ruleCount,
        @JsonProperty("threshold_count") int thresholdCount,
        @JsonProperty("finding_count") int findingCount,
        @JsonProperty("condition_count") int conditionCount,
        @JsonProperty("action_count") int actionCount,
        @JsonProperty("indicates_edge_count") int indicatesEdgeCount,
        @JsonProperty("urgent_action_edge_count") int urgentActionEdgeCount,
        @JsonProperty("compilation_time_nanos") long compilationTimeNanos,
        @JsonProperty("unsatisfiable_rules") List<String> unsatisfiableRules,
        @JsonProperty("metadata") Map<String, Object> metadata
) {
    public CatalogStats {
        unsatisfiableRules = unsatisfiableRules == null ? List.of() : List.copyOf(unsatisfiableRules);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public long compilationTimeMillis() {
        return compilationTimeNanos / 1_000_000;
    }
}
