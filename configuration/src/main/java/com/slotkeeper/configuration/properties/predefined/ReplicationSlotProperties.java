package com.slotkeeper.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;

@ConfigMapping(prefix = "slot-keeper.replication-slots")
public interface ReplicationSlotProperties {

    /**
     * Value of replication_slot_inactive_timeout on startup. Uses Postgres time syntax, plain number means seconds, 0 disables the check.
     */
    String inactiveTimeout();

    Duration checkpointInterval();
}
