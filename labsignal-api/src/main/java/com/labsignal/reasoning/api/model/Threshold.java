/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single check a rule places on one test.
 *
 * @param id        threshold identifier (unique within the catalog)
 * @param testId    id of the referenced {@link LabTest}
 * @param testName  canonical name of that test; the key readings are matched on
 * @param unit      unit the bound is expressed in (not converted)
 * @param condition the operator and its bounds
 */
public record Threshold(
        @JsonProperty("id") String id,
        @JsonProperty("test_id") String testId,
        @JsonProperty("test_name") String testName,
        @JsonProperty("unit") String unit,
        @JsonIgnore ThresholdCondition condition
) {
    public Threshold {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(testId, "testId must not be null");
        Objects.requireNonNull(testName, "testName must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
    }

    @JsonProperty("operator")
    public ThresholdOperator operator() {
        return condition.operator();
    }

    /**
     * Human-readable expectation including the unit, e.g. {@code "< 12.0 g/dL"}.
     */
    @JsonProperty("expectation")
    public String describe() {
        String text = condition.describe();
        if (unit == null || unit.isBlank() || condition instanceof ThresholdCondition.AbnormalFlagPresent) {
            return text;
        }
        return text + " " + unit;
    }
}
