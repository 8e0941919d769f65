package com.slotkeeper.slotmanagement.model;

import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.SlotKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutable state of one replication slot. Must only be read or modified while holding the lock of owning {@link SlotCatalogEntry}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationSlot {
    private String name;
    private SlotKind kind;
    /**
     * Output plugin. Null for physical slots.
     */
    private String plugin;
    private boolean temporary;
    /**
     * True if slot is a mirror of a primary failover slot.
     */
    private boolean synced;
    private boolean failover;
    private boolean active;
    private UUID activeHandleId;
    private Instant inactiveSince;
    private InvalidationReason invalidationReason;
    private Instant invalidatedAt;
    private long restartLsn;
    private long confirmedFlushLsn;
    /**
     * In-memory state differs from stored one.
     */
    private boolean dirty;

    public boolean isInvalidated() {
        return invalidationReason != null;
    }
}
