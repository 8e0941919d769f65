package com.slotkeeper.slotmanagement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotSyncResult {
    private boolean primaryReachable;
    private List<String> createdSlotNames;
    private List<String> updatedSlotNames;
    private List<String> droppedSlotNames;
    private List<String> skippedSlotNames;
    private Instant completedAt;
}
