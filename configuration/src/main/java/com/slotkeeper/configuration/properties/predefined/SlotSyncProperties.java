package com.slotkeeper.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;

@ConfigMapping(prefix = "slot-keeper.sync")
public interface SlotSyncProperties {

    boolean enabled();

    Duration interval();

    /**
     * Connect and read timeout for a single query to primary.
     */
    Duration timeout();

    String primaryHost();

    int primaryPort();
}
