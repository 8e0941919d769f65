package com.slotkeeper.rest.model.api.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncStatsDto {
    private long completedPollsCount;
    private long failedPollsCount;
    private Instant lastPollAt;
    private boolean lastPollPrimaryReachable;
    private int lastCreatedCount;
    private int lastUpdatedCount;
    private int lastDroppedCount;
}
