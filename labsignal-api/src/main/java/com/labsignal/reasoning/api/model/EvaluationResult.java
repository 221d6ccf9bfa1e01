/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Signal bundle together with the individual rule matches behind it, for
 * auditing which rule produced which output.
 *
 * @param matches          one entry per satisfied rule, ordered by rule id
 * @param signals          the aggregated bundle
 * @param evaluationNanos  wall time spent evaluating and aggregating
 */
public record EvaluationResult(
        @JsonProperty("matches") List<RuleMatch> matches,
        @JsonProperty("signals") ClinicalSignals signals,
        @JsonProperty("evaluation_nanos") long evaluationNanos
) {
    public EvaluationResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        if (signals == null) signals = ClinicalSignals.empty();
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }

    public int matchCount() {
        return matches.size();
    }
}
