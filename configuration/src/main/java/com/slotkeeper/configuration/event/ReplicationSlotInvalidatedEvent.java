package com.slotkeeper.configuration.event;

import com.slotkeeper.configuration.model.InvalidationReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Event which is fired when replication slot is invalidated on this node by local decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationSlotInvalidatedEvent {
    private String slotName;
    private InvalidationReason reason;
    private Instant invalidatedAt;
    /**
     * Moment slot became inactive. Null if reason is not related to inactivity.
     */
    private Instant inactiveSince;
    /**
     * Timeout which was in effect when decision was made. Zero if reason is not related to inactivity.
     */
    private Duration inactiveTimeout;
}
