package com.labsignal.reasoning.service.rest;

import com.labsignal.reasoning.api.exceptions.RuleNotFoundException;
import com.labsignal.reasoning.api.model.ClinicalSignals;
import com.labsignal.reasoning.api.model.EvaluationRequest;
import com.labsignal.reasoning.api.model.EvaluationResult;
import com.labsignal.reasoning.api.model.RuleExplanation;
import com.labsignal.reasoning.service.service.InvalidRequestException;
import com.labsignal.reasoning.service.service.ReasoningService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JAX-RS resource turning lab readings into clinical signals.
 */
@Path("/signals")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SignalsResource {

    @Inject
    ReasoningService reasoningService;

    @Inject
    Tracer tracer;

    /**
     * Evaluates readings and an optional patient profile.
     *
     * @return the signal bundle; 400 when the profile is invalid
     */
    @POST
    public Response evaluate(EvaluationRequest request) {
        Span span = tracer.spanBuilder("http-evaluate-signals").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ClinicalSignals signals = reasoningService.evaluate(request);
            span.setAttribute("findingCount", signals.findings().size());
            return Response.ok(signals).build();
        } catch (InvalidRequestException e) {
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError(e);
        } finally {
            span.end();
        }
    }

    /**
     * Same as {@link #evaluate} but includes the individual rule matches.
     */
    @POST
    @Path("/matches")
    public Response evaluateWithMatches(EvaluationRequest request) {
        Span span = tracer.spanBuilder("http-evaluate-matches").startSpan();
        try (Scope scope = span.makeCurrent()) {
            EvaluationResult result = reasoningService.evaluateWithMatches(request);
            span.setAttribute("matchCount", result.matchCount());
            return Response.ok(result).build();
        } catch (InvalidRequestException e) {
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError(e);
        } finally {
            span.end();
        }
    }

    @POST
    @Path("/batch")
    public Response evaluateBatch(List<EvaluationRequest> requests) {
        Span span = tracer.spanBuilder("http-evaluate-batch").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<EvaluationResult> results = reasoningService.evaluateBatch(requests);
            span.setAttribute("requestCount", results.size());
            return Response.ok(results).build();
        } catch (InvalidRequestException e) {
            return badRequest(e);
        } catch (Exception e) {
            span.recordException(e);
            return serverError(e);
        } finally {
            span.end();
        }
    }

    /**
     * Explains why one rule did or did not match.
     *
     * @return 404 when the catalog has no such rule
     */
    @POST
    @Path("/explain/{ruleId}")
    public Response explainRule(@PathParam("ruleId") String ruleId, EvaluationRequest request) {
        Span span = tracer.spanBuilder("http-explain-rule").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleId", ruleId);
            RuleExplanation explanation = reasoningService.explainRule(request, ruleId);
            return Response.ok(explanation).build();
        } catch (InvalidRequestException e) {
            return badRequest(e);
        } catch (RuleNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Rule not found", "message", e.getMessage()))
                    .build();
        } catch (Exception e) {
            span.recordException(e);
            return serverError(e);
        } finally {
            span.end();
        }
    }

    static Response badRequest(InvalidRequestException e) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("error", "Invalid request", "violations", e.getViolations()))
                .build();
    }

    static Response serverError(Exception e) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(Map.of("error", "Internal Server Error",
                        "message", Objects.toString(e.getMessage(), e.getClass().getSimpleName())))
                .build();
    }
}
