/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.runtime.operators;

import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.Threshold;
import com.labsignal.reasoning.api.model.ThresholdCondition;

/**
 * Decides whether a single reading satisfies a single threshold.
 *
 * <p>Semantics per operator:
 * <ul>
 *   <li>{@code >} and {@code <}: strict comparison of the reading's value with the bound</li>
 *   <li>{@code >=} and {@code <=}: non-strict comparison</li>
 *   <li>{@code between}: inclusive at both ends</li>
 *   <li>{@code abnormal_flag}: true iff the lab printed H, L, HH or LL</li>
 * </ul>
 * Units are not checked or converted. A reading without a value satisfies no
 * threshold, not even {@code abnormal_flag}; a NaN value satisfies no numeric operator.
 *
 * <p>Stateless and thread-safe.
 */
public final class ThresholdEvaluator {

    private ThresholdEvaluator() {
    }

    public static boolean evaluate(Threshold threshold, Reading reading) {
        return evaluate(threshold.condition(), reading);
    }

    public static boolean evaluate(ThresholdCondition condition, Reading reading) {
        if (!reading.hasValue()) {
            return false;
        }
        double value = reading.numericValue();
        if (condition instanceof ThresholdCondition.Comparison comparison) {
            double bound = comparison.bound();
            return switch (comparison.operator()) {
                case GREATER_THAN -> value > bound;
                case LESS_THAN -> value < bound;
                case GREATER_OR_EQUAL -> value >= bound;
                case LESS_OR_EQUAL -> value <= bound;
                default -> throw new IllegalStateException("Not a comparison: " + comparison.operator());
            };
        }
        if (condition instanceof ThresholdCondition.Between between) {
            return value >= between.min() && value <= between.max();
        }
        return reading.abnormalFlag().isAbnormal();
    }

    /**
     * Renders the expectation of a threshold, e.g. {@code "< 12.0 g/dL"}.
     */
    public static String describe(Threshold threshold) {
        return threshold.describe();
    }

    /**
     * Renders one evidence line for a met threshold, e.g.
     * {@code "Hemoglobin 9.5 g/dL < 12.0 g/dL"} or {@code "Platelet Count 40.0 10^3/mcL flagged LL"}.
     */
    public static String evidence(Threshold threshold, Reading reading) {
        StringBuilder sb = new StringBuilder(threshold.testName())
                .append(' ')
                .append(ThresholdCondition.format(reading.numericValue()));
        if (reading.unit() != null && !reading.unit().isBlank()) {
            sb.append(' ').append(reading.unit());
        }
        if (threshold.condition() instanceof ThresholdCondition.AbnormalFlagPresent) {
            sb.append(" flagged ").append(reading.abnormalFlag().code());
        } else {
            sb.append(' ').append(threshold.describe());
        }
        return sb.toString();
    }
}
