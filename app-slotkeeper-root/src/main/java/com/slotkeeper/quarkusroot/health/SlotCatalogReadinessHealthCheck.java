package com.slotkeeper.quarkusroot.health;

import com.slotkeeper.configuration.properties.constant.SlotKeeperConstants;
import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class SlotCatalogReadinessHealthCheck implements HealthCheck {

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder responseBuilder = HealthCheckResponse.named(SlotKeeperConstants.SLOT_CATALOG_READINESS_CHECK)
                .withData("role", nodeRuntimeProperties.getRole().name());

        if (nodeRuntimeProperties.isSlotsRestored()) {
            responseBuilder.up();
        } else {
            responseBuilder.down();
        }

        return responseBuilder.build();
    }
}
