package com.slotkeeper.rest.mapper;

import com.slotkeeper.rest.model.api.checkpoint.CheckpointResponseDto;
import com.slotkeeper.rest.model.api.slot.AdvanceSlotResponseDto;
import com.slotkeeper.rest.model.api.slot.ReplicationSlotResponseDto;
import com.slotkeeper.rest.model.api.slot.StreamingSessionDto;
import com.slotkeeper.rest.model.api.sync.SlotSyncResponseDto;
import com.slotkeeper.slotmanagement.model.CheckpointResult;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotAdvanceResult;
import com.slotkeeper.slotmanagement.model.SlotHandle;
import com.slotkeeper.slotmanagement.model.SlotSyncResult;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class ReplicationSlotDtoMapper {

    public ReplicationSlotResponseDto toDto(ReplicationSlotInfo info) {
        return ReplicationSlotResponseDto
                .builder()
                .name(info.getName())
                .kind(info.getKind())
                .plugin(info.getPlugin())
                .temporary(info.isTemporary())
                .synced(info.isSynced())
                .failover(info.isFailover())
                .active(info.isActive())
                .inactiveSince(info.getInactiveSince())
                .invalidationReason(info.getInvalidationReason())
                .invalidatedAt(info.getInvalidatedAt())
                .restartLsn(LogSequenceNumberUtils.lsnToStringOrNull(info.getRestartLsn()))
                .confirmedFlushLsn(LogSequenceNumberUtils.lsnToStringOrNull(info.getConfirmedFlushLsn()))
                .build();
    }

    public StreamingSessionDto toDto(SlotHandle handle) {
        return StreamingSessionDto
                .builder()
                .handleId(handle.getHandleId())
                .slotName(handle.getSlotName())
                .acquiredAt(handle.getAcquiredAt())
                .build();
    }

    public AdvanceSlotResponseDto toDto(SlotAdvanceResult result) {
        return AdvanceSlotResponseDto
                .builder()
                .slotName(result.getSlotName())
                .endLsn(LogSequenceNumberUtils.lsnToString(result.getEndLsn()))
                .build();
    }

    public CheckpointResponseDto toDto(CheckpointResult result) {
        return CheckpointResponseDto
                .builder()
                .checkedSlotsCount(result.getInvalidationPassResult().getCheckedSlotsCount())
                .invalidatedSlotNames(result.getInvalidationPassResult().getInvalidatedSlotNames())
                .flushedSlotsCount(result.getFlushedSlotsCount())
                .completedAt(result.getInvalidationPassResult().getCompletedAt())
                .build();
    }

    public SlotSyncResponseDto toDto(SlotSyncResult result) {
        return SlotSyncResponseDto
                .builder()
                .primaryReachable(result.isPrimaryReachable())
                .createdSlotNames(result.getCreatedSlotNames())
                .updatedSlotNames(result.getUpdatedSlotNames())
                .droppedSlotNames(result.getDroppedSlotNames())
                .skippedSlotNames(result.getSkippedSlotNames())
                .completedAt(result.getCompletedAt())
                .build();
    }
}
