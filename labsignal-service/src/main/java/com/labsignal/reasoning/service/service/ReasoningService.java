package com.labsignal.reasoning.service.service;

import com.labsignal.reasoning.api.exceptions.RuleNotFoundException;
import com.labsignal.reasoning.api.model.ClinicalSignals;
import com.labsignal.reasoning.api.model.EvaluationRequest;
import com.labsignal.reasoning.api.model.EvaluationResult;
import com.labsignal.reasoning.api.model.Reading;
import com.labsignal.reasoning.api.model.RuleExplanation;
import com.labsignal.reasoning.infra.management.CatalogManager;
import com.labsignal.reasoning.runtime.evaluation.ClinicalReasoner;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Validates requests and runs them against the current catalog snapshot.
 * The reasoner is rebuilt lazily whenever the manager has swapped in a new catalog.
 */
@ApplicationScoped
public class ReasoningService {

    @Inject
    CatalogManager catalogManager;

    @Inject
    Tracer tracer;

    private final AtomicReference<ClinicalReasoner> reasoner = new AtomicReference<>();

    public ClinicalSignals evaluate(EvaluationRequest request) {
        validate(request);
        return currentReasoner().evaluate(request.readings(), request.patient());
    }

    public EvaluationResult evaluateWithMatches(EvaluationRequest request) {
        validate(request);
        return currentReasoner().evaluateWithMatches(request.readings(), request.patient());
    }

    /**
     * Validates every request before evaluating any of them.
     */
    public List<EvaluationResult> evaluateBatch(List<EvaluationRequest> requests) {
        if (requests == null) {
            throw new InvalidRequestException(List.of("request body is required"));
        }
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            for (String violation : violationsOf(requests.get(i))) {
                violations.add("requests[" + i + "]: " + violation);
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }
        return currentReasoner().evaluateBatch(requests);
    }

    /**
     * @throws RuleNotFoundException if the rule does not exist
     */
    public RuleExplanation explainRule(EvaluationRequest request, String ruleId) {
        validate(request);
        return currentReasoner().explainRule(request.readings(), request.patient(), ruleId);
    }

    private ClinicalReasoner currentReasoner() {
        ClinicalCatalog catalog = catalogManager.getCatalog();
        ClinicalReasoner current = reasoner.get();
        if (current == null || current.getCatalog() != catalog) {
            Span span = tracer.spanBuilder("reasoner-refresh").startSpan();
            try {
                span.addEvent("Catalog changed. Creating new reasoner.");
                current = new ClinicalReasoner(catalog, tracer);
                reasoner.set(current);
            } finally {
                span.end();
            }
        }
        return current;
    }

    private static void validate(EvaluationRequest request) {
        List<String> violations = violationsOf(request);
        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }
    }

    private static List<String> violationsOf(EvaluationRequest request) {
        if (request == null) {
            return List.of("request body is required");
        }
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < request.readings().size(); i++) {
            Reading reading = request.readings().get(i);
            if (reading == null) {
                violations.add("readings[" + i + "]: reading is required");
                continue;
            }
            if (reading.canonicalName() == null || reading.canonicalName().isBlank()) {
                violations.add("readings[" + i + "]: canonical_name is required");
            }
            if (!reading.hasValue()) {
                violations.add("readings[" + i + "]: value is required");
            }
        }
        if (request.patient() != null) {
            request.patient().violations().forEach(v -> violations.add("patient: " + v));
        }
        return violations;
    }
}
