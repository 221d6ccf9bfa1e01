/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api.model;

import java.util.Locale;

/**
 * The check a threshold performs, one variant per operator family.
 *
 * <p>Each variant carries exactly the bounds its operator needs: a
 * {@link Comparison} always has one bound, a {@link Between} always has two,
 * and {@link AbnormalFlagPresent} has none. Malformed combinations cannot be
 * represented, so the evaluator has no "missing bound" failure mode.
 */
public sealed interface ThresholdCondition
        permits ThresholdCondition.Comparison, ThresholdCondition.Between, ThresholdCondition.AbnormalFlagPresent {

    ThresholdOperator operator();

    /**
     * Renders the expectation, e.g. {@code "< 12.0"} or {@code "between 4.0 and 11.0"}.
     */
    String describe();

    /**
     * Single-bound numeric comparison: {@code >}, {@code <}, {@code >=}, {@code <=}.
     */
    record Comparison(ThresholdOperator operator, double bound) implements ThresholdCondition {
        public Comparison {
            if (operator == null || !operator.isComparison()) {
                throw new IllegalArgumentException("Comparison requires a comparison operator, got: " + operator);
            }
            if (!Double.isFinite(bound)) {
                throw new IllegalArgumentException("Comparison bound must be finite, got: " + bound);
            }
        }

        @Override
        public String describe() {
            return operator.code() + " " + format(bound);
        }
    }

    /**
     * Inclusive range check: {@code min <= value <= max}.
     */
    record Between(double min, double max) implements ThresholdCondition {
        public Between {
            if (!Double.isFinite(min) || !Double.isFinite(max)) {
                throw new IllegalArgumentException("Between bounds must be finite, got: [" + min + ", " + max + "]");
            }
            if (min > max) {
                throw new IllegalArgumentException("Between range is inverted: [" + min + ", " + max + "]");
            }
        }

        @Override
        public ThresholdOperator operator() {
            return ThresholdOperator.BETWEEN;
        }

        @Override
        public String describe() {
            return "between " + format(min) + " and " + format(max);
        }
    }

    /**
     * Met when the lab printed any abnormal flag next to the result.
     */
    record AbnormalFlagPresent() implements ThresholdCondition {
        @Override
        public ThresholdOperator operator() {
            return ThresholdOperator.ABNORMAL_FLAG;
        }

        @Override
        public String describe() {
            return "abnormal flag present";
        }
    }

    /**
     * Formats a numeric value without trailing noise: 12.0 stays "12.0", 7.25 stays "7.25".
     */
    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%.1f", value);
        }
        return Double.toString(value);
    }
}
