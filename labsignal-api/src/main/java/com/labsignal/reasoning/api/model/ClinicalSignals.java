/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one evaluation: deduplicated findings, the conditions they
 * indicate and the high or critical actions tied to those conditions.
 *
 * <p>An empty bundle is a valid outcome meaning "no rule matched"; it is never
 * used to signal a failed evaluation. Lists are never null.
 */
public record ClinicalSignals(
        @JsonProperty("findings") List<MatchedFinding> findings,
        @JsonProperty("conditions") List<MatchedCondition> conditions,
        @JsonProperty("actions") List<Action> actions
) {
    private static final ClinicalSignals EMPTY = new ClinicalSignals(List.of(), List.of(), List.of());

    public ClinicalSignals {
        findings = findings == null ? List.of() : List.copyOf(findings);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static ClinicalSignals empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return findings.isEmpty() && conditions.isEmpty() && actions.isEmpty();
    }
}
