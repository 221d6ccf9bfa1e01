package com.labsignal.reasoning.service.config;

import com.labsignal.reasoning.api.ICatalogCompiler;
import com.labsignal.reasoning.infra.management.CatalogManager;
import com.labsignal.reasoning.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ServiceLoader;

/**
 * CDI producers for the reasoning engine components.
 */
@ApplicationScoped
public class ReasoningProducers {

    @ConfigProperty(name = "catalog.file", defaultValue = "catalog/clinical-catalog.json")
    String catalogFile;

    @ConfigProperty(name = "catalog.reload.interval-seconds", defaultValue = "10")
    long reloadIntervalSeconds;

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        return TracingService.getInstance();
    }

    @Produces
    @ApplicationScoped
    public Tracer tracer(TracingService tracingService) {
        return tracingService.getTracer();
    }

    @Produces
    @ApplicationScoped
    public ICatalogCompiler catalogCompiler() {
        return ServiceLoader.load(ICatalogCompiler.class)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No ICatalogCompiler implementation found"));
    }

    /**
     * Compiles the catalog at startup; an invalid catalog stops the service.
     */
    @Produces
    @ApplicationScoped
    public CatalogManager catalogManager(Tracer tracer, ICatalogCompiler compiler) {
        try {
            return new CatalogManager(Path.of(catalogFile), tracer, compiler, reloadIntervalSeconds);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog file: " + catalogFile, e);
        }
    }
}
