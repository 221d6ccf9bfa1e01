/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.runtime.evaluation;

import com.labsignal.reasoning.api.IRuleEvaluator;
import com.labsignal.reasoning.api.exceptions.RuleNotFoundException;
import com.labsignal.reasoning.api.model.Finding;
import com.labsignal.reasoning.api.model.PatientProfile;
import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.Rule;
import com.labsignal.reasoning.api.model.RuleExplanation;
import com.labsignal.reasoning.api.model.RuleExplanation.ThresholdExplanation;
import com.labsignal.reasoning.api.model.RuleMatch;
import com.labsignal.reasoning.api.model.Threshold;
import com.labsignal.reasoning.api.model.ThresholdCondition;
import com.labsignal.reasoning.runtime.demographics.DemographicFilter;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import com.labsignal.reasoning.runtime.operators.ThresholdEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches lab readings against every rule of one catalog snapshot.
 *
 * <h2>Algorithm</h2>
 * <p>Readings are first indexed by canonical name; readings for tests the
 * catalog does not know, or without a value, are dropped, and when several
 * readings share a name the first one wins. Then, for each rule in id order:
 * <ol>
 *   <li>the demographic gate must pass,</li>
 *   <li>every required test must have a reading (a missing test means no
 *       match, never a partial one),</li>
 *   <li>every threshold must be met.</li>
 * </ol>
 * A satisfied rule yields one {@link RuleMatch} with one evidence line per
 * threshold. The result depends only on the readings, the profile and the
 * catalog contents.
 *
 * <h2>Thread Safety</h2>
 * <p>Holds only the immutable catalog; concurrent calls are safe.
 */
public final class RuleEvaluator implements IRuleEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

    private final ClinicalCatalog catalog;
    private final Tracer tracer;

    public RuleEvaluator(ClinicalCatalog catalog, Tracer tracer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        logger.info("RuleEvaluator initialized with {} rules", catalog.getNumRules());
    }

    /**
     * Creates a RuleEvaluator with a no-op tracer.
     */
    public RuleEvaluator(ClinicalCatalog catalog) {
        this(catalog, OpenTelemetry.noop().getTracer("labsignal-evaluator"));
    }

    @Override
    public List<RuleMatch> evaluateRules(List<Reading> readings, PatientProfile profile) {
        Objects.requireNonNull(readings, "readings must not be null");

        Span span = tracer.spanBuilder("evaluate-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("readingCount", readings.size());
            span.setAttribute("hasProfile", profile != null);

            Map<String, Reading> byName = indexReadings(readings);
            List<RuleMatch> matches = new ArrayList<>();

            for (Rule rule : catalog.getRules()) {
                if (!DemographicFilter.applies(rule.constraint(), profile)) {
                    continue;
                }
                List<String> evidence = matchThresholds(rule, byName);
                if (evidence == null) {
                    continue;
                }
                Finding finding = catalog.getFinding(rule.findingId());
                matches.add(new RuleMatch(rule, finding, evidence));
                logger.debug("Rule {} matched, finding {}", rule.id(), finding.id());
            }

            span.setAttribute("matchCount", matches.size());
            return matches;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * @return one evidence line per threshold if every threshold is met, otherwise null
     */
    private static List<String> matchThresholds(Rule rule, Map<String, Reading> byName) {
        // all-or-nothing: a rule with any missing test is skipped before looking at values
        for (String testName : rule.requiredTestNames()) {
            if (!byName.containsKey(testName)) {
                return null;
            }
        }
        List<String> evidence = new ArrayList<>(rule.thresholds().size());
        for (Threshold threshold : rule.thresholds()) {
            Reading reading = byName.get(threshold.testName());
            if (!ThresholdEvaluator.evaluate(threshold, reading)) {
                return null;
            }
            evidence.add(ThresholdEvaluator.evidence(threshold, reading));
        }
        return evidence;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Explains the rule against the same reading index {@link #evaluateRules}
     * uses, so {@code matched} agrees with whether the rule appears in its result.
     */
    @Override
    public RuleExplanation explainRule(List<Reading> readings, PatientProfile profile, String ruleId) {
        Objects.requireNonNull(readings, "readings must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");

        Rule rule = catalog.findRule(ruleId)
                .orElseThrow(() -> new RuleNotFoundException(ruleId));

        Map<String, Reading> byName = indexReadings(readings);
        String rejected = DemographicFilter.reasonRejected(rule.constraint(), profile);

        List<ThresholdExplanation> explanations = new ArrayList<>();
        for (Threshold threshold : rule.thresholds()) {
            Reading reading = byName.get(threshold.testName());
            if (reading == null) {
                explanations.add(new ThresholdExplanation(threshold.id(), threshold.testName(),
                        threshold.describe(), null, null, false, ThresholdExplanation.REASON_READING_MISSING));
                continue;
            }
            boolean met = ThresholdEvaluator.evaluate(threshold, reading);
            String reason = null;
            if (!met) {
                reason = threshold.condition() instanceof ThresholdCondition.AbnormalFlagPresent
                        ? ThresholdExplanation.REASON_NO_FLAG
                        : ThresholdExplanation.REASON_OUT_OF_RANGE;
            }
            explanations.add(new ThresholdExplanation(threshold.id(), threshold.testName(),
                    threshold.describe(), reading.numericValue(), reading.abnormalFlag(), met, reason));
        }

        boolean allMet = explanations.stream().allMatch(ThresholdExplanation::met);
        boolean matched = rejected == null && allMet;

        String summary;
        if (matched) {
            summary = String.format("Rule %s matched", ruleId);
        } else if (rejected != null) {
            summary = String.format("Rule %s does not apply to this patient (%s)", ruleId, rejected);
        } else {
            summary = String.format("Rule %s did not match (failed %d/%d thresholds)",
                    ruleId,
                    explanations.stream().filter(e -> !e.met()).count(),
                    explanations.size());
        }

        return new RuleExplanation(rule.id(), rule.name(), matched, rejected == null, summary, explanations);
    }

    /**
     * Keys readings by canonical name, keeping only valued readings of tests
     * the catalog knows and only the first one per name.
     */
    private Map<String, Reading> indexReadings(List<Reading> readings) {
        Map<String, Reading> byName = new HashMap<>();
        for (Reading reading : readings) {
            if (reading == null || reading.canonicalName() == null) {
                continue;
            }
            String name = reading.canonicalName();
            if (!catalog.isKnownTestName(name)) {
                logger.debug("Ignoring reading for unknown test '{}'", name);
                continue;
            }
            if (!reading.hasValue()) {
                logger.debug("Ignoring reading for '{}' without a value", name);
                continue;
            }
            Reading previous = byName.putIfAbsent(name, reading);
            if (previous != null) {
                logger.debug("Duplicate reading for '{}' ignored, keeping first value {}",
                        name, previous.numericValue());
            }
        }
        return byName;
    }

    /**
     * Returns the catalog snapshot this evaluator reads.
     */
    public ClinicalCatalog getCatalog() {
        return catalog;
    }
}
