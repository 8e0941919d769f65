package com.slotkeeper.configuration.properties.runtime;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.Getter;
import lombok.Setter;

/**
 * WAL positions reported by WAL storage engine. Zero means position is unknown.
 */
@Getter
@Setter
@ApplicationScoped
public class WalRuntimeProperties {
    /**
     * On primary this is current flush position, on standby it is last replayed position.
     */
    private volatile long currentLsn = 0;
    /**
     * Oldest WAL position which is still retained on this node.
     */
    private volatile long oldestRetainedLsn = 0;
}
