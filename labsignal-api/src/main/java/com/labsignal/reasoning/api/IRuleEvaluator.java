/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.api;

import com.labsignal.reasoning.api.exceptions.RuleNotFoundException;
import com.labsignal.reasoning.api.model.PatientProfile;
import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.RuleExplanation;
import com.labsignal.reasoning.api.model.RuleMatch;

import java.util.List;

/**
 * Contract for matching lab readings against the rule catalog.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Reading> readings = List.of(
 *     new Reading("Hemoglobin", 9.5, "g/dL"),
 *     new Reading("Mean Corpuscular Volume", 72, "fL"));
 *
 * for (RuleMatch match : evaluator.evaluateRules(readings, null)) {
 *     System.out.println(match.ruleId() + " -> " + match.findingId());
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations hold no per-call state and may be shared between threads.
 */
public interface IRuleEvaluator {

    /**
     * Returns one match per rule whose demographic gate passes, whose
     * required tests all have readings and whose thresholds are all met.
     *
     * @param readings lab readings (must not be null; may be empty)
     * @param profile  patient context, or null when none was collected
     * @return matches ordered by rule id; empty if nothing matched
     */
    List<RuleMatch> evaluateRules(List<Reading> readings, PatientProfile profile);

    /**
     * Explains, threshold by threshold, why a rule did or didn't match.
     *
     * @throws RuleNotFoundException if no rule has this id
     */
    default RuleExplanation explainRule(List<Reading> readings, PatientProfile profile, String ruleId) {
        throw new UnsupportedOperationException("explainRule not implemented");
    }
}
