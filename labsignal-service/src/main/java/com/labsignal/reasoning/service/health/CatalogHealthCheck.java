package com.labsignal.reasoning.service.health;

import com.labsignal.reasoning.infra.management.CatalogManager;
import com.labsignal.reasoning.runtime.model.ClinicalCatalog;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once a catalog with at least one rule is active.
 */
@Readiness
@ApplicationScoped
public class CatalogHealthCheck implements HealthCheck {

    @Inject
    CatalogManager catalogManager;

    @Override
    public HealthCheckResponse call() {
        ClinicalCatalog catalog = catalogManager.getCatalog();

        if (catalog != null && catalog.getNumRules() > 0) {
            return HealthCheckResponse.builder()
                    .name("clinical-catalog")
                    .up()
                    .withData("numRules", (long) catalog.getNumRules())
                    .withData("numTests", (long) catalog.getTests().size())
                    .build();
        }
        return HealthCheckResponse.builder()
                .name("clinical-catalog")
                .down()
                .withData("reason", "Catalog not loaded or no rules present")
                .build();
    }
}
