package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.model.SlotHandle;

import java.util.UUID;

/**
 * The only writer of active flag and inactive_since of locally authoritative slots.
 */
public interface LivenessTracker {

    void onAcquire(SlotCatalogEntry entry, SlotHandle handle);

    /**
     * Marks slot as inactive. Repeated release or release with stale handle changes nothing.
     *
     * @return true if slot was released by this call
     */
    boolean onRelease(SlotCatalogEntry entry, UUID handleId);

    /**
     * Assigns liveness to slot loaded from durable storage. Such slot is inactive since the moment it was loaded.
     */
    void onRestore(ReplicationSlot slot);
}
