package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.model.SlotHandle;
import com.slotkeeper.slotmanagement.service.api.LivenessTracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@ApplicationScoped
public class LivenessTrackerImpl implements LivenessTracker {

    @Inject
    Clock clock;

    @Override
    public void onAcquire(SlotCatalogEntry entry, SlotHandle handle) {
        entry.lock();
        try {
            ReplicationSlot slot = entry.getSlot();
            slot.setActive(true);
            slot.setActiveHandleId(handle.getHandleId());
            if (!slot.isSynced()) {
                slot.setInactiveSince(null);
            }
            log.debug("Replication slot \"{}\" acquired by handle {}", slot.getName(), handle.getHandleId());
        } finally {
            entry.unlock();
        }
    }

    @Override
    public boolean onRelease(SlotCatalogEntry entry, UUID handleId) {
        entry.lock();
        try {
            ReplicationSlot slot = entry.getSlot();

            if (!slot.isActive() || !Objects.equals(slot.getActiveHandleId(), handleId)) {
                log.debug("Ignoring release of replication slot \"{}\" by handle {} because slot is not held by it", slot.getName(), handleId);
                return false;
            }

            slot.setActive(false);
            slot.setActiveHandleId(null);
            if (!slot.isSynced()) {
                slot.setInactiveSince(clock.instant());
            }
            log.debug("Replication slot \"{}\" released by handle {}", slot.getName(), handleId);

            return true;
        } finally {
            entry.unlock();
        }
    }

    @Override
    public void onRestore(ReplicationSlot slot) {
        slot.setActive(false);
        slot.setActiveHandleId(null);
        // mirror keeps primary's value unless it was held there when persisted
        if (!slot.isSynced() || slot.getInactiveSince() == null) {
            slot.setInactiveSince(clock.instant());
        }
    }
}
