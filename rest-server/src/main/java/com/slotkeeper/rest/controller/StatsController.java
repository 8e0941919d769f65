package com.slotkeeper.rest.controller;

import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.model.api.stats.ReplicationSlotStatsResponseDto;
import com.slotkeeper.rest.service.api.ReplicationSlotStatsService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path(ApiConstants.API_V1_PREFIX + "/stats")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StatsController {

    @Inject
    ReplicationSlotStatsService replicationSlotStatsService;

    @GET
    @Path("/replication-slots")
    public ReplicationSlotStatsResponseDto getReplicationSlotStats() {
        return replicationSlotStatsService.getStats();
    }
}
