package com.slotkeeper.slotmanagement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointResult {
    private InvalidationPassResult invalidationPassResult;
    private int flushedSlotsCount;
}
