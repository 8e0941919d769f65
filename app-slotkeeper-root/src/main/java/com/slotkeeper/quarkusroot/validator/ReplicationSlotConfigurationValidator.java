package com.slotkeeper.quarkusroot.validator;

import com.slotkeeper.configuration.exception.InvalidSettingValueException;
import com.slotkeeper.configuration.properties.predefined.ReplicationSlotProperties;
import com.slotkeeper.configuration.properties.runtime.SlotSettingsRuntimeProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@ApplicationScoped
public class ReplicationSlotConfigurationValidator implements ConfigurationValidator {

    @Inject
    ReplicationSlotProperties replicationSlotProperties;

    @Override
    public boolean validate() {
        boolean flag = true;

        try {
            SlotSettingsRuntimeProperties.parseInactiveTimeout(replicationSlotProperties.inactiveTimeout());
        } catch (InvalidSettingValueException e) {
            log.error("Invalid replication slots configuration. {}", e.getMessage());
            flag = false;
        }

        if (replicationSlotProperties.checkpointInterval() == null
                || replicationSlotProperties.checkpointInterval().isZero()
                || replicationSlotProperties.checkpointInterval().isNegative()) {
            log.error("Invalid replication slots configuration. Checkpoint interval must be positive.");
            flag = false;
        }

        return flag;
    }
}
