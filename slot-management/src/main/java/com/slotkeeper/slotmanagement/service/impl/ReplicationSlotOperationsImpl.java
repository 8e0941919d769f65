package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.model.SlotKind;
import com.slotkeeper.configuration.properties.runtime.WalRuntimeProperties;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.constant.ReplicationSlotConstants;
import com.slotkeeper.slotmanagement.exception.InvalidSlotOperationException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.exception.StreamingSessionNotFoundException;
import com.slotkeeper.slotmanagement.mapper.ReplicationSlotMapper;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotAdvanceResult;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.model.SlotHandle;
import com.slotkeeper.slotmanagement.service.api.AcquisitionGate;
import com.slotkeeper.slotmanagement.service.api.ReplicationSlotOperations;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@ApplicationScoped
public class ReplicationSlotOperationsImpl implements ReplicationSlotOperations {

    @Inject
    AcquisitionGate acquisitionGate;

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    WalRuntimeProperties walRuntimeProperties;

    @Inject
    ReplicationSlotMapper replicationSlotMapper;

    private final Map<UUID, SlotHandle> streamingSessions = new ConcurrentHashMap<>();

    @Override
    public SlotAdvanceResult advance(String slotName, long targetLsn) throws InvalidSlotOperationException {
        if (targetLsn == LogSequenceNumberUtils.INVALID_LSN) {
            throw new InvalidSlotOperationException(ReplicationSlotConstants.INVALID_TARGET_LSN_MESSAGE);
        }

        return acquisitionGate.withAcquiredSlot(slotName, handle -> {
            SlotCatalogEntry entry = slotCatalog.getEntry(slotName);
            entry.lock();
            try {
                ReplicationSlot slot = entry.getSlot();

                if (slot.getRestartLsn() == LogSequenceNumberUtils.INVALID_LSN) {
                    throw new InvalidSlotOperationException(String.format(ReplicationSlotConstants.SLOT_CANNOT_BE_ADVANCED_MESSAGE, slotName));
                }

                long moveTo = targetLsn;
                long currentLsn = walRuntimeProperties.getCurrentLsn();
                if (currentLsn != LogSequenceNumberUtils.INVALID_LSN && LogSequenceNumberUtils.compareTwoLsn(moveTo, currentLsn) > 0) {
                    moveTo = currentLsn;
                }

                long endLsn = moveForward(slot, moveTo);

                log.debug("Replication slot \"{}\" advanced to {}", slotName, LogSequenceNumberUtils.lsnToString(endLsn));

                return SlotAdvanceResult
                        .builder()
                        .slotName(slotName)
                        .endLsn(endLsn)
                        .build();
            } finally {
                entry.unlock();
            }
        });
    }

    @Override
    public SlotHandle startStreaming(String slotName) {
        SlotHandle handle = acquisitionGate.tryAcquire(slotName);
        streamingSessions.put(handle.getHandleId(), handle);

        log.info("Started streaming from replication slot \"{}\", session {}", slotName, handle.getHandleId());

        return handle;
    }

    @Override
    public void stopStreaming(UUID handleId) throws StreamingSessionNotFoundException {
        SlotHandle handle = streamingSessions.remove(handleId);
        if (handle == null) {
            throw new StreamingSessionNotFoundException(String.format(ReplicationSlotConstants.STREAMING_SESSION_NOT_FOUND_MESSAGE, handleId));
        }

        acquisitionGate.release(handle);

        log.info("Stopped streaming from replication slot \"{}\", session {}", handle.getSlotName(), handleId);
    }

    @Override
    public ReplicationSlotInfo confirmFlush(UUID handleId, long flushedLsn) throws StreamingSessionNotFoundException, InvalidSlotOperationException {
        SlotHandle handle = streamingSessions.get(handleId);
        if (handle == null) {
            throw new StreamingSessionNotFoundException(String.format(ReplicationSlotConstants.STREAMING_SESSION_NOT_FOUND_MESSAGE, handleId));
        }

        if (flushedLsn == LogSequenceNumberUtils.INVALID_LSN) {
            throw new InvalidSlotOperationException(ReplicationSlotConstants.INVALID_TARGET_LSN_MESSAGE);
        }

        SlotCatalogEntry entry;
        try {
            entry = slotCatalog.getEntry(handle.getSlotName());
        } catch (SlotNotFoundException e) {
            streamingSessions.remove(handleId);
            throw new StreamingSessionNotFoundException(String.format(ReplicationSlotConstants.STREAMING_SESSION_NOT_FOUND_MESSAGE, handleId), e);
        }

        entry.lock();
        try {
            ReplicationSlot slot = entry.getSlot();
            if (entry.isRemoved() || !slot.isActive() || !Objects.equals(slot.getActiveHandleId(), handleId)) {
                streamingSessions.remove(handleId);
                throw new StreamingSessionNotFoundException(String.format(ReplicationSlotConstants.STREAMING_SESSION_NOT_FOUND_MESSAGE, handleId));
            }

            moveForward(slot, flushedLsn);

            return replicationSlotMapper.toInfo(slot);
        } finally {
            entry.unlock();
        }
    }

    @Override
    public List<SlotHandle> getStreamingSessions() {
        return new ArrayList<>(streamingSessions.values());
    }

    /**
     * Moves consumer position of slot, never backwards. Caller holds entry lock.
     *
     * @return position of slot after move
     */
    private long moveForward(ReplicationSlot slot, long lsn) {
        if (SlotKind.PHYSICAL.equals(slot.getKind())) {
            if (LogSequenceNumberUtils.compareTwoLsn(lsn, slot.getRestartLsn()) > 0) {
                slot.setRestartLsn(lsn);
                slot.setDirty(true);
            }
            return slot.getRestartLsn();
        }

        if (LogSequenceNumberUtils.compareTwoLsn(lsn, slot.getConfirmedFlushLsn()) > 0) {
            slot.setConfirmedFlushLsn(lsn);
            slot.setDirty(true);
        }
        return slot.getConfirmedFlushLsn();
    }
}
