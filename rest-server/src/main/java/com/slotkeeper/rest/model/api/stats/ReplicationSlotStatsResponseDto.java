package com.slotkeeper.rest.model.api.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplicationSlotStatsResponseDto {
    private int slotsCount;
    private int activeSlotsCount;
    private int invalidatedSlotsCount;
    private Map<String, Long> invalidationsByReason;
    private List<InvalidationRecordDto> recentInvalidations;
    private SyncStatsDto sync;
    private long settingsChangesCount;
    private Instant promotedAt;
}
