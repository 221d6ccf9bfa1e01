package com.labsignal.reasoning.service.rest;

import com.labsignal.reasoning.api.CompilationListener;
import com.labsignal.reasoning.api.model.LabTest;
import com.labsignal.reasoning.api.model.Rule;
import com.labsignal.reasoning.infra.management.CatalogManager;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only views of the active catalog, plus a forced reload.
 */
@Path("/catalog")
@Produces(MediaType.APPLICATION_JSON)
public class CatalogResource {

    @Inject
    CatalogManager catalogManager;

    @Inject
    Tracer tracer;

    @GET
    @Path("/stats")
    public Response getStats() {
        Span span = tracer.spanBuilder("http-get-catalog-stats").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return Response.ok(catalogManager.getCatalog().getStats()).build();
        } catch (Exception e) {
            span.recordException(e);
            return SignalsResource.serverError(e);
        } finally {
            span.end();
        }
    }

    @GET
    @Path("/tests")
    public Response getTests() {
        Span span = tracer.spanBuilder("http-get-catalog-tests").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<LabTest> tests = List.copyOf(catalogManager.getCatalog().getTests().values());
            return Response.ok(tests).build();
        } catch (Exception e) {
            span.recordException(e);
            return SignalsResource.serverError(e);
        } finally {
            span.end();
        }
    }

    @GET
    @Path("/rules")
    public Response getRules() {
        Span span = tracer.spanBuilder("http-get-catalog-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<Rule> rules = catalogManager.getCatalog().getRules();
            return Response.ok(rules).build();
        } catch (Exception e) {
            span.recordException(e);
            return SignalsResource.serverError(e);
        } finally {
            span.end();
        }
    }

    /**
     * Recompiles the catalog file immediately.
     *
     * @return per-stage timings and metrics; 422 with the failing stage when the
     *         catalog is invalid (the previous catalog stays active)
     */
    @POST
    @Path("/reload")
    public Response reload() {
        Span span = tracer.spanBuilder("http-reload-catalog").startSpan();
        try (Scope scope = span.makeCurrent()) {
            StageRecorder recorder = new StageRecorder();
            try {
                ClinicalCatalog catalog = catalogManager.recompile(recorder);
                return Response.ok(Map.of(
                        "status", "reloaded",
                        "ruleCount", catalog.getNumRules(),
                        "stages", recorder.stages)).build();
            } catch (RuntimeException e) {
                if (recorder.failedStage == null) {
                    throw e;
                }
                return Response.status(422)
                        .entity(Map.of(
                                "status", "failed",
                                "failedStage", recorder.failedStage,
                                "message", Objects.toString(e.getMessage(), e.getClass().getSimpleName()),
                                "stages", recorder.stages))
                        .build();
            }
        } catch (Exception e) {
            span.recordException(e);
            return SignalsResource.serverError(e);
        } finally {
            span.end();
        }
    }

    private static final class StageRecorder implements CompilationListener {
        private final List<Map<String, Object>> stages = new ArrayList<>();
        private String failedStage;

        @Override
        public void onStageStart(String stageName, int stageNumber, int totalStages) {
        }

        @Override
        public void onStageComplete(String stageName, StageResult result) {
            Map<String, Object> stage = new LinkedHashMap<>();
            stage.put("stage", stageName);
            stage.put("durationMillis", result.durationMillis());
            stage.put("metrics", result.metrics());
            stages.add(stage);
        }

        @Override
        public void onError(String stageName, Exception error) {
            failedStage = stageName;
        }
    }
}
