package com.labsignal.reasoning.service.lifecycle;

import com.labsignal.reasoning.infra.management.CatalogManager;
import com.labsignal.reasoning.infra.telemetry.TracingService;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Starts the catalog file monitor with the application and stops it, flushing
 * pending spans, on shutdown.
 */
@ApplicationScoped
public class ReasoningLifecycle {

    private static final Logger logger = Logger.getLogger(ReasoningLifecycle.class.getName());

    @Inject
    CatalogManager catalogManager;

    @Inject
    TracingService tracingService;

    void onStart(@Observes StartupEvent event) {
        logger.info("Starting Labsignal reasoning service with catalog " + catalogManager.getCatalogPath());
        catalogManager.start();
    }

    void onStop(@Observes ShutdownEvent event) {
        logger.info("Shutting down Labsignal reasoning service");
        catalogManager.shutdown();
        tracingService.flush();
        tracingService.shutdown();
    }
}
