package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.exception.SlotSyncInProgressException;
import com.slotkeeper.slotmanagement.exception.SlotSyncNotAllowedException;
import com.slotkeeper.slotmanagement.model.SlotSyncResult;

import java.time.Instant;

/**
 * Mirrors failover slots of primary on standby.
 */
public interface SlotSyncAgent {

    SlotSyncResult syncSlots() throws SlotSyncNotAllowedException, SlotSyncInProgressException;

    /**
     * Waits for running synchronization to finish and executes action while no new one can start.
     */
    void runWithSyncPaused(Runnable action);

    /**
     * @return time of last synchronization that reached primary or null if there was none
     */
    Instant getLastSuccessfulSync();
}
