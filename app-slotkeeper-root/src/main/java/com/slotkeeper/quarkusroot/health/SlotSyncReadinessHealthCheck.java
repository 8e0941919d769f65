package com.slotkeeper.quarkusroot.health;

import com.slotkeeper.configuration.properties.constant.SlotKeeperConstants;
import com.slotkeeper.configuration.properties.predefined.SlotSyncProperties;
import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.slotmanagement.service.api.SlotSyncAgent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.time.Instant;

/**
 * Unreachable primary is never a reason to take standby out of service, so this check only reports sync state.
 */
@Readiness
@ApplicationScoped
public class SlotSyncReadinessHealthCheck implements HealthCheck {

    @Inject
    SlotSyncAgent slotSyncAgent;

    @Inject
    SlotSyncProperties slotSyncProperties;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public HealthCheckResponse call() {
        Instant lastSuccessfulSync = slotSyncAgent.getLastSuccessfulSync();

        HealthCheckResponseBuilder responseBuilder = HealthCheckResponse.named(SlotKeeperConstants.SLOT_SYNC_READINESS_CHECK)
                .withData("enabled", slotSyncProperties.enabled() && nodeRuntimeProperties.isStandby())
                .withData("lastSuccessfulSync", lastSuccessfulSync == null ? "never" : lastSuccessfulSync.toString())
                .up();

        return responseBuilder.build();
    }
}
