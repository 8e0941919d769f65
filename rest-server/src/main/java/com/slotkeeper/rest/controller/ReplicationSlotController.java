package com.slotkeeper.rest.controller;

import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.exception.InvalidRequestException;
import com.slotkeeper.rest.filter.namebinding.SlotsRestored;
import com.slotkeeper.rest.filter.namebinding.StandbyOnly;
import com.slotkeeper.rest.mapper.ReplicationSlotDtoMapper;
import com.slotkeeper.rest.model.api.slot.AdvanceSlotRequestDto;
import com.slotkeeper.rest.model.api.slot.AdvanceSlotResponseDto;
import com.slotkeeper.rest.model.api.slot.ReplicationSlotResponseDto;
import com.slotkeeper.rest.model.api.slot.StreamingSessionDto;
import com.slotkeeper.rest.model.api.sync.SlotSyncResponseDto;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.service.api.ReplicationSlotOperations;
import com.slotkeeper.slotmanagement.service.api.SlotSyncAgent;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.stream.Collectors;

@SlotsRestored
@Path(ApiConstants.API_V1_PREFIX + "/replication-slots")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ReplicationSlotController {

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    ReplicationSlotOperations replicationSlotOperations;

    @Inject
    SlotSyncAgent slotSyncAgent;

    @Inject
    ReplicationSlotDtoMapper replicationSlotDtoMapper;

    /**
     * Catalog read surface. Standby nodes poll it on primary with failover=true.
     */
    @GET
    public List<ReplicationSlotResponseDto> getReplicationSlots(@QueryParam("failover") Boolean failover) {
        return slotCatalog.listSlots()
                .stream()
                .filter(slot -> !Boolean.TRUE.equals(failover) || slot.isFailover())
                .map(replicationSlotDtoMapper::toDto)
                .collect(Collectors.toList());
    }

    @GET
    @Path("/{name}")
    public ReplicationSlotResponseDto getReplicationSlot(@PathParam("name") String name) {
        return replicationSlotDtoMapper.toDto(slotCatalog.getSlotInfo(name));
    }

    @POST
    @Path("/{name}/advance")
    public AdvanceSlotResponseDto advanceReplicationSlot(@PathParam("name") String name, AdvanceSlotRequestDto requestDto) {
        if (requestDto == null || requestDto.getTargetLsn() == null) {
            throw new InvalidRequestException("targetLsn is required");
        }

        long targetLsn;
        try {
            targetLsn = LogSequenceNumberUtils.stringToLsn(requestDto.getTargetLsn());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }

        return replicationSlotDtoMapper.toDto(replicationSlotOperations.advance(name, targetLsn));
    }

    @POST
    @Path("/{name}/streaming-sessions")
    public StreamingSessionDto startStreaming(@PathParam("name") String name) {
        return replicationSlotDtoMapper.toDto(replicationSlotOperations.startStreaming(name));
    }

    @POST
    @StandbyOnly
    @Path("/sync")
    public SlotSyncResponseDto syncReplicationSlots() {
        return replicationSlotDtoMapper.toDto(slotSyncAgent.syncSlots());
    }
}
