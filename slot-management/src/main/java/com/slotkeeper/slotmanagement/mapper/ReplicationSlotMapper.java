package com.slotkeeper.slotmanagement.mapper;

import com.slotkeeper.slotmanagement.model.PersistedReplicationSlot;
import com.slotkeeper.slotmanagement.model.RemoteSlotState;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.restclient.model.RemoteReplicationSlotDto;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class ReplicationSlotMapper {

    public ReplicationSlotInfo toInfo(ReplicationSlot slot) {
        return ReplicationSlotInfo.builder()
                .name(slot.getName())
                .kind(slot.getKind())
                .plugin(slot.getPlugin())
                .temporary(slot.isTemporary())
                .synced(slot.isSynced())
                .failover(slot.isFailover())
                .active(slot.isActive())
                .inactiveSince(slot.getInactiveSince())
                .invalidationReason(slot.getInvalidationReason())
                .invalidatedAt(slot.getInvalidatedAt())
                .restartLsn(slot.getRestartLsn())
                .confirmedFlushLsn(slot.getConfirmedFlushLsn())
                .build();
    }

    public PersistedReplicationSlot toPersisted(ReplicationSlot slot) {
        return PersistedReplicationSlot.builder()
                .name(slot.getName())
                .kind(slot.getKind())
                .plugin(slot.getPlugin())
                .synced(slot.isSynced())
                .failover(slot.isFailover())
                .invalidationReason(slot.getInvalidationReason())
                .invalidatedAt(slot.getInvalidatedAt())
                .inactiveSince(slot.getInactiveSince())
                .restartLsn(slot.getRestartLsn())
                .confirmedFlushLsn(slot.getConfirmedFlushLsn())
                .build();
    }

    /**
     * Restored slot is never active and never dirty. Liveness is assigned separately on restore.
     */
    public ReplicationSlot fromPersisted(PersistedReplicationSlot persisted) {
        return ReplicationSlot.builder()
                .name(persisted.getName())
                .kind(persisted.getKind())
                .plugin(persisted.getPlugin())
                .temporary(false)
                .synced(persisted.isSynced())
                .failover(persisted.isFailover())
                .active(false)
                .inactiveSince(persisted.getInactiveSince())
                .invalidationReason(persisted.getInvalidationReason())
                .invalidatedAt(persisted.getInvalidatedAt())
                .restartLsn(persisted.getRestartLsn())
                .confirmedFlushLsn(persisted.getConfirmedFlushLsn())
                .dirty(false)
                .build();
    }

    /**
     * Mirror keeps activity of primary slot. It is never acquirable on standby, so activity is informational only.
     */
    public ReplicationSlot toMirror(RemoteSlotState remote) {
        return ReplicationSlot.builder()
                .name(remote.getName())
                .kind(remote.getKind())
                .plugin(remote.getPlugin())
                .temporary(true)
                .synced(true)
                .failover(true)
                .active(remote.isActive())
                .inactiveSince(remote.getInactiveSince())
                .invalidationReason(remote.getInvalidationReason())
                .invalidatedAt(remote.getInvalidatedAt())
                .restartLsn(remote.getRestartLsn())
                .confirmedFlushLsn(remote.getConfirmedFlushLsn())
                .dirty(true)
                .build();
    }

    public RemoteSlotState toRemoteState(RemoteReplicationSlotDto dto) {
        return RemoteSlotState.builder()
                .name(dto.getName())
                .kind(dto.getKind())
                .plugin(dto.getPlugin())
                .temporary(dto.isTemporary())
                .failover(dto.isFailover())
                .active(dto.isActive())
                .inactiveSince(dto.getInactiveSince())
                .invalidationReason(dto.getInvalidationReason())
                .invalidatedAt(dto.getInvalidatedAt())
                .restartLsn(LogSequenceNumberUtils.stringToLsnOrInvalid(dto.getRestartLsn()))
                .confirmedFlushLsn(LogSequenceNumberUtils.stringToLsnOrInvalid(dto.getConfirmedFlushLsn()))
                .build();
    }
}
