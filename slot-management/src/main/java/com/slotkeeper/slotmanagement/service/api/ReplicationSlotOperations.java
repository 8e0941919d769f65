package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.exception.InvalidSlotOperationException;
import com.slotkeeper.slotmanagement.exception.StreamingSessionNotFoundException;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotAdvanceResult;
import com.slotkeeper.slotmanagement.model.SlotHandle;

import java.util.List;
import java.util.UUID;

/**
 * Operations of slot consumers. All of them acquire slot through {@link AcquisitionGate}.
 */
public interface ReplicationSlotOperations {

    SlotAdvanceResult advance(String slotName, long targetLsn) throws InvalidSlotOperationException;

    SlotHandle startStreaming(String slotName);

    void stopStreaming(UUID handleId) throws StreamingSessionNotFoundException;

    ReplicationSlotInfo confirmFlush(UUID handleId, long flushedLsn) throws StreamingSessionNotFoundException, InvalidSlotOperationException;

    List<SlotHandle> getStreamingSessions();
}
