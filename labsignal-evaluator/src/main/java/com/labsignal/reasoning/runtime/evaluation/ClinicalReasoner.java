/*
 * Copyright (c) 2025 Labsignal
 * Licensed under the Apache License, Version 2.0
 */
package com.labsignal.reasoning.runtime.evaluation;

import com.labsignal.reasoning.api.exceptions.RuleNotFoundException;
import com.labsignal.reasoning.api.model.ClinicalSignals;
import com.labsignal.reasoning.api.model.EvaluationRequest;
import com.labsignal.reasoning.api.model.EvaluationResult;
import com.labsignal.reasoning.api.model.PatientProfile;
import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.RuleExplanation;
import com.labsignal.reasoning.api.model.RuleMatch;
import com.labsignal.reasoning.runtime.aggregation.SignalAggregator;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the reasoning engine: readings and an optional profile in,
 * {@link ClinicalSignals} out.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ClinicalReasoner reasoner = new ClinicalReasoner(catalog, tracer);
 *
 * ClinicalSignals signals = reasoner.evaluate(List.of(
 *         new Reading("Hemoglobin", 9.5, "g/dL"),
 *         new Reading("Hematocrit", 28.0, "%")), null);
 *
 * signals.findings().forEach(f -> System.out.println(f.label()));
 * }</pre>
 *
 * <p>Bound to one immutable catalog snapshot; callers pick up a reloaded
 * catalog by creating a new reasoner. Instances are thread-safe.
 */
public final class ClinicalReasoner {

    private final ClinicalCatalog catalog;
    private final RuleEvaluator evaluator;
    private final SignalAggregator aggregator;
    private final Tracer tracer;

    public ClinicalReasoner(ClinicalCatalog catalog, Tracer tracer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.evaluator = new RuleEvaluator(catalog, tracer);
        this.aggregator = new SignalAggregator(catalog);
    }

    public ClinicalReasoner(ClinicalCatalog catalog) {
        this(catalog, OpenTelemetry.noop().getTracer("labsignal-evaluator"));
    }

    /**
     * Evaluates readings and returns the aggregated signal bundle. An empty
     * bundle means no rule matched.
     *
     * @param profile patient context, or null when none was collected
     */
    public ClinicalSignals evaluate(List<Reading> readings, PatientProfile profile) {
        return evaluateWithMatches(readings, profile).signals();
    }

    /**
     * Same as {@link #evaluate} but also returns the individual rule matches
     * and the time spent.
     */
    public EvaluationResult evaluateWithMatches(List<Reading> readings, PatientProfile profile) {
        Span span = tracer.spanBuilder("clinical-reasoning").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            List<RuleMatch> matches = evaluator.evaluateRules(readings, profile);
            ClinicalSignals signals = aggregator.aggregate(matches);
            long elapsed = System.nanoTime() - start;

            span.setAttribute("findingCount", signals.findings().size());
            span.setAttribute("conditionCount", signals.conditions().size());
            span.setAttribute("actionCount", signals.actions().size());
            return new EvaluationResult(matches, signals, elapsed);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Evaluates several independent requests against the same snapshot.
     *
     * @return one result per request, in request order
     */
    public List<EvaluationResult> evaluateBatch(List<EvaluationRequest> requests) {
        Objects.requireNonNull(requests, "requests must not be null");
        return requests.stream()
                .map(r -> evaluateWithMatches(r.readings(), r.patient()))
                .toList();
    }

    /**
     * @throws RuleNotFoundException if the catalog has no rule with this id
     */
    public RuleExplanation explainRule(List<Reading> readings, PatientProfile profile, String ruleId) {
        return evaluator.explainRule(readings, profile, ruleId);
    }

    public ClinicalCatalog getCatalog() {
        return catalog;
    }
}
