package com.slotkeeper.rest.controller;

import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.filter.namebinding.SlotsRestored;
import com.slotkeeper.rest.mapper.ReplicationSlotDtoMapper;
import com.slotkeeper.rest.model.api.checkpoint.CheckpointResponseDto;
import com.slotkeeper.slotmanagement.service.api.CheckpointService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@SlotsRestored
@Path(ApiConstants.API_V1_PREFIX + "/checkpoint")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CheckpointController {

    @Inject
    CheckpointService checkpointService;

    @Inject
    ReplicationSlotDtoMapper replicationSlotDtoMapper;

    @POST
    public CheckpointResponseDto checkpoint() {
        log.info("Received HTTP request to run checkpoint.");
        return replicationSlotDtoMapper.toDto(checkpointService.checkpoint());
    }
}
