package com.slotkeeper.rest.service.api;

import com.slotkeeper.rest.model.api.stats.ReplicationSlotStatsResponseDto;

public interface ReplicationSlotStatsService {

    ReplicationSlotStatsResponseDto getStats();
}
