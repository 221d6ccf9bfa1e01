/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.compiler.analysis;

import com.labsignal.reasoning.api.model.Rule;
import com.labsignal.reasoning.api.model.Threshold;
import com.labsignal.reasoning.api.model.ThresholdCondition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds rules that can never match because two of their thresholds on the
 * same test describe ranges that do not intersect.
 *
 * <p>Every numeric threshold narrows the admissible interval of its test:
 * <ul>
 *   <li>{@code > b} / {@code >= b} raise the lower bound (exclusive / inclusive)</li>
 *   <li>{@code < b} / {@code <= b} lower the upper bound (exclusive / inclusive)</li>
 *   <li>{@code between min and max} does both, inclusively</li>
 * </ul>
 * A rule is unsatisfiable when, for some test, the resulting interval is
 * empty, e.g. {@code Hemoglobin > 17.5 AND Hemoglobin < 12.0}.
 * Abnormal-flag thresholds never contradict anything.
 *
 * <h2>Usage</h2>
 * <pre>
 * List&lt;Contradiction&gt; found = new ThresholdConflictAnalyzer().analyze(catalog.getRules());
 * found.forEach(c -&gt; log.warning(c.describe()));
 * </pre>
 */
public class ThresholdConflictAnalyzer {

    /**
     * Analyzes each rule independently; rules are reported in the order given.
     */
    public List<Contradiction> analyze(Collection<Rule> rules) {
        List<Contradiction> contradictions = new ArrayList<>();
        for (Rule rule : rules) {
            Contradiction contradiction = checkRule(rule);
            if (contradiction != null) {
                contradictions.add(contradiction);
            }
        }
        return contradictions;
    }

    /**
     * @return the first contradiction found in the rule, or null if it can match
     */
    Contradiction checkRule(Rule rule) {
        Map<String, Interval> byTest = new LinkedHashMap<>();
        for (Threshold threshold : rule.thresholds()) {
            Interval interval = byTest.computeIfAbsent(threshold.testName(), k -> new Interval());
            narrow(interval, threshold.condition());
            if (interval.isEmpty()) {
                return new Contradiction(rule.id(), threshold.testName(), interval.describe());
            }
        }
        return null;
    }

    private static void narrow(Interval interval, ThresholdCondition condition) {
        if (condition instanceof ThresholdCondition.Comparison comparison) {
            double bound = comparison.bound();
            switch (comparison.operator()) {
                case GREATER_THAN -> interval.raiseLower(bound, false);
                case GREATER_OR_EQUAL -> interval.raiseLower(bound, true);
                case LESS_THAN -> interval.lowerUpper(bound, false);
                case LESS_OR_EQUAL -> interval.lowerUpper(bound, true);
                default -> throw new IllegalStateException("Not a comparison: " + comparison.operator());
            }
        } else if (condition instanceof ThresholdCondition.Between between) {
            interval.raiseLower(between.min(), true);
            interval.lowerUpper(between.max(), true);
        }
    }

    /**
     * Admissible values of one test within one rule.
     */
    private static final class Interval {
        private double lower = Double.NEGATIVE_INFINITY;
        private boolean lowerInclusive = false;
        private double upper = Double.POSITIVE_INFINITY;
        private boolean upperInclusive = false;

        void raiseLower(double bound, boolean inclusive) {
            if (bound > lower || (bound == lower && !inclusive)) {
                lower = bound;
                lowerInclusive = inclusive;
            }
        }

        void lowerUpper(double bound, boolean inclusive) {
            if (bound < upper || (bound == upper && !inclusive)) {
                upper = bound;
                upperInclusive = inclusive;
            }
        }

        boolean isEmpty() {
            if (lower > upper) return true;
            return lower == upper && !(lowerInclusive && upperInclusive);
        }

        String describe() {
            return (lowerInclusive ? "[" : "(") + lower + ", " + upper + (upperInclusive ? "]" : ")");
        }
    }

    /**
     * A rule whose thresholds on {@code testName} leave no admissible value.
     *
     * @param emptyRange the empty interval the thresholds reduce to
     */
    public record Contradiction(String ruleId, String testName, String emptyRange) {

        public String describe() {
            return String.format("Rule '%s' can never match: thresholds on '%s' reduce to empty range %s",
                    ruleId, testName, emptyRange);
        }
    }
}
