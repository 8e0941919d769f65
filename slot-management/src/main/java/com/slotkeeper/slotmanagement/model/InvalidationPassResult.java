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
public class InvalidationPassResult {
    private int checkedSlotsCount;
    private List<String> invalidatedSlotNames;
    private Instant completedAt;
}
