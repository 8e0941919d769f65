package com.slotkeeper.rest.model.api.checkpoint;

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
public class CheckpointResponseDto {
    private int checkedSlotsCount;
    private List<String> invalidatedSlotNames;
    private int flushedSlotsCount;
    private Instant completedAt;
}
