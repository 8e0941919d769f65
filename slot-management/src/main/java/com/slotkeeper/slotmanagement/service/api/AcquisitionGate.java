package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.exception.SlotActiveException;
import com.slotkeeper.slotmanagement.exception.SlotInvalidatedException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.exception.SlotSyncedUsageException;
import com.slotkeeper.slotmanagement.model.SlotHandle;

import java.util.function.Function;

/**
 * Single entry point for every operation that uses replication slot.
 */
public interface AcquisitionGate {

    SlotHandle tryAcquire(String slotName) throws SlotNotFoundException, SlotInvalidatedException, SlotSyncedUsageException, SlotActiveException;

    boolean release(SlotHandle handle);

    /**
     * Acquires slot, executes action and releases slot even if action failed.
     */
    <T> T withAcquiredSlot(String slotName, Function<SlotHandle, T> action);
}
