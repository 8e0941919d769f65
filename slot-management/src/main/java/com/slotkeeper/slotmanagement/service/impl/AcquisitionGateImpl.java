package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.constant.ReplicationSlotConstants;
import com.slotkeeper.slotmanagement.exception.SlotActiveException;
import com.slotkeeper.slotmanagement.exception.SlotInvalidatedException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.exception.SlotSyncedUsageException;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.model.SlotHandle;
import com.slotkeeper.slotmanagement.service.api.AcquisitionGate;
import com.slotkeeper.slotmanagement.service.api.LivenessTracker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Function;

@Slf4j
@ApplicationScoped
public class AcquisitionGateImpl implements AcquisitionGate {

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    LivenessTracker livenessTracker;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Inject
    Clock clock;

    @Override
    public SlotHandle tryAcquire(String slotName) throws SlotNotFoundException, SlotInvalidatedException, SlotSyncedUsageException, SlotActiveException {
        SlotCatalogEntry entry = slotCatalog.getEntry(slotName);

        entry.lock();
        try {
            if (entry.isRemoved()) {
                throw new SlotNotFoundException(String.format(ReplicationSlotConstants.SLOT_DOES_NOT_EXIST_MESSAGE, slotName));
            }

            ReplicationSlot slot = entry.getSlot();

            if (slot.isInvalidated()) {
                throw new SlotInvalidatedException(slotName, slot.getInvalidationReason());
            }

            if (slot.isSynced() && nodeRuntimeProperties.isStandby()) {
                throw new SlotSyncedUsageException(String.format(ReplicationSlotConstants.SLOT_SYNCED_USAGE_MESSAGE, slotName));
            }

            if (slot.isActive()) {
                throw new SlotActiveException(String.format(ReplicationSlotConstants.SLOT_ACTIVE_MESSAGE, slotName, slot.getActiveHandleId()));
            }

            SlotHandle handle = SlotHandle
                    .builder()
                    .handleId(UUID.randomUUID())
                    .slotName(slotName)
                    .acquiredAt(clock.instant())
                    .build();

            livenessTracker.onAcquire(entry, handle);

            return handle;
        } finally {
            entry.unlock();
        }
    }

    @Override
    public boolean release(SlotHandle handle) {
        if (handle == null) {
            return false;
        }

        return slotCatalog.findEntry(handle.getSlotName())
                .map(entry -> livenessTracker.onRelease(entry, handle.getHandleId()))
                .orElse(false);
    }

    @Override
    public <T> T withAcquiredSlot(String slotName, Function<SlotHandle, T> action) {
        SlotHandle handle = tryAcquire(slotName);
        try {
            return action.apply(handle);
        } finally {
            release(handle);
        }
    }
}
