/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Explanation of why a specific rule matched or didn't match a set of readings.
 *
 * <p>Answers "why did this rule (not) fire?" threshold by threshold, including
 * the demographic gate.
 *
 * <h2>Usage</h2>
 * <pre>
 * RuleExplanation explanation = evaluator.explainRule(readings, profile, "R001");
 * if (!explanation.matched()) {
 *     explanation.thresholds().stream()
 *         .filter(t -&gt; !t.met())
 *         .forEach(t -&gt; System.out.println(t.describe()));
 * }
 * </pre>
 */
public record RuleExplanation(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("matched") boolean matched,
        @JsonProperty("demographics_applicable") boolean demographicsApplicable,
        @JsonProperty("summary") String summary,
        @JsonProperty("thresholds") List<ThresholdExplanation> thresholds
) {
    public RuleExplanation {
        thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
    }

    /**
     * Outcome of a single threshold.
     *
     * @param observedValue the reading's value, or null when the test has no reading
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ThresholdExplanation(
            @JsonProperty("threshold_id") String thresholdId,
            @JsonProperty("test_name") String testName,
            @JsonProperty("expectation") String expectation,
            @JsonProperty("observed_value") Double observedValue,
            @JsonProperty("observed_flag") AbnormalFlag observedFlag,
            @JsonProperty("met") boolean met,
            @JsonProperty("reason") String reason
    ) {
        public static final String REASON_READING_MISSING = "No reading for test";
        public static final String REASON_OUT_OF_RANGE = "Value does not satisfy threshold";
        public static final String REASON_NO_FLAG = "No abnormal flag on reading";

        public String describe() {
            String observed = observedValue == null ? "no reading" : String.valueOf(observedValue);
            if (met) {
                return String.format("met: %s %s (got: %s)", testName, expectation, observed);
            }
            return String.format("not met: %s %s (got: %s) - %s", testName, expectation, observed, reason);
        }
    }

    public long metCount() {
        return thresholds.stream().filter(ThresholdExplanation::met).count();
    }

    public int totalThresholds() {
        return thresholds.size();
    }
}
