package com.slotkeeper.quarkusroot.validator;

import com.slotkeeper.configuration.properties.predefined.NodeProperties;
import com.slotkeeper.configuration.properties.predefined.SlotSyncProperties;
import com.slotkeeper.configuration.model.NodeRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;

@Slf4j
@ApplicationScoped
public class SlotSyncConfigurationValidator implements ConfigurationValidator {

    @Inject
    SlotSyncProperties slotSyncProperties;

    @Inject
    NodeProperties nodeProperties;

    @Override
    public boolean validate() {
        if (!slotSyncProperties.enabled()) {
            if (NodeRole.STANDBY.equals(nodeProperties.role())) {
                log.warn("Slot sync is disabled on standby node. Failover replication slots will not be mirrored from primary.");
            }
            return true;
        }

        boolean flag = true;

        if (StringUtils.isBlank(slotSyncProperties.primaryHost())) {
            log.error("Invalid slot sync configuration. Primary host must be set when slot sync is enabled.");
            flag = false;
        }

        if (slotSyncProperties.primaryPort() < 1 || slotSyncProperties.primaryPort() > 65535) {
            log.error("Invalid slot sync configuration. Primary port {} is out of range.", slotSyncProperties.primaryPort());
            flag = false;
        }

        if (!isPositive(slotSyncProperties.interval())) {
            log.error("Invalid slot sync configuration. Sync interval must be positive.");
            flag = false;
        }

        if (!isPositive(slotSyncProperties.timeout())) {
            log.error("Invalid slot sync configuration. Sync timeout must be positive.");
            flag = false;
        }

        return flag;
    }

    private boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
