package com.slotkeeper.slotmanagement.model;

import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.SlotKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time copy of slot state. Safe to use without locking.
 */
@Value
@Builder
public class ReplicationSlotInfo {
    String name;
    SlotKind kind;
    String plugin;
    boolean temporary;
    boolean synced;
    boolean failover;
    boolean active;
    Instant inactiveSince;
    InvalidationReason invalidationReason;
    Instant invalidatedAt;
    long restartLsn;
    long confirmedFlushLsn;
}
