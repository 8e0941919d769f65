package com.slotkeeper.slotmanagement.transport.api;

import com.slotkeeper.slotmanagement.exception.SyncTransportException;
import com.slotkeeper.slotmanagement.model.RemoteSlotState;

import java.util.List;

/**
 * Source of failover replication slots of primary node.
 */
@FunctionalInterface
public interface PrimarySlotSource {

    /**
     * Fetches state of failover slots from primary. Implementations must not block longer than configured timeout.
     *
     * @return list of failover slots on primary
     * @throws SyncTransportException if primary is unreachable or returned unusable response
     */
    List<RemoteSlotState> fetchFailoverSlots() throws SyncTransportException;
}
