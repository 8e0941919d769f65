package com.slotkeeper.rest.controller;

import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.exception.InvalidRequestException;
import com.slotkeeper.rest.filter.namebinding.SlotsRestored;
import com.slotkeeper.rest.mapper.ReplicationSlotDtoMapper;
import com.slotkeeper.rest.model.api.slot.ConfirmFlushRequestDto;
import com.slotkeeper.rest.model.api.slot.ReplicationSlotResponseDto;
import com.slotkeeper.rest.model.api.slot.StreamingSessionDto;
import com.slotkeeper.slotmanagement.service.api.ReplicationSlotOperations;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@SlotsRestored
@Path(ApiConstants.API_V1_PREFIX + "/streaming-sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StreamingSessionController {

    @Inject
    ReplicationSlotOperations replicationSlotOperations;

    @Inject
    ReplicationSlotDtoMapper replicationSlotDtoMapper;

    @GET
    public List<StreamingSessionDto> getStreamingSessions() {
        return replicationSlotOperations.getStreamingSessions()
                .stream()
                .map(replicationSlotDtoMapper::toDto)
                .collect(Collectors.toList());
    }

    @DELETE
    @Path("/{handleId}")
    public void stopStreaming(@PathParam("handleId") UUID handleId) {
        replicationSlotOperations.stopStreaming(handleId);
    }

    @POST
    @Path("/{handleId}/flush")
    public ReplicationSlotResponseDto confirmFlush(@PathParam("handleId") UUID handleId, ConfirmFlushRequestDto requestDto) {
        if (requestDto == null || requestDto.getFlushedLsn() == null) {
            throw new InvalidRequestException("flushedLsn is required");
        }

        long flushedLsn;
        try {
            flushedLsn = LogSequenceNumberUtils.stringToLsn(requestDto.getFlushedLsn());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }

        return replicationSlotDtoMapper.toDto(replicationSlotOperations.confirmFlush(handleId, flushedLsn));
    }
}
