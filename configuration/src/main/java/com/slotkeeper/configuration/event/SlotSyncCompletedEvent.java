package com.slotkeeper.configuration.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event which is fired after every sync pass on standby, including passes skipped because primary was unreachable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotSyncCompletedEvent {
    private boolean primaryReachable;
    private int createdCount;
    private int updatedCount;
    private int droppedCount;
    private Instant completedAt;
}
