package com.slotkeeper.rest.controller;

import com.slotkeeper.configuration.properties.runtime.WalRuntimeProperties;
import com.slotkeeper.rest.constant.ApiConstants;
import com.slotkeeper.rest.exception.InvalidRequestException;
import com.slotkeeper.rest.model.api.wal.WalPositionsDto;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Used by WAL storage engine to report its positions. Absent value leaves position unchanged.
 */
@Path(ApiConstants.API_V1_PREFIX + "/wal/positions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WalController {

    @Inject
    WalRuntimeProperties walRuntimeProperties;

    @GET
    public WalPositionsDto getWalPositions() {
        return WalPositionsDto
                .builder()
                .currentLsn(LogSequenceNumberUtils.lsnToStringOrNull(walRuntimeProperties.getCurrentLsn()))
                .oldestRetainedLsn(LogSequenceNumberUtils.lsnToStringOrNull(walRuntimeProperties.getOldestRetainedLsn()))
                .build();
    }

    @PUT
    public WalPositionsDto updateWalPositions(WalPositionsDto requestDto) {
        if (requestDto == null) {
            throw new InvalidRequestException("Request body is required");
        }

        Long currentLsn = parseLsn("currentLsn", requestDto.getCurrentLsn());
        Long oldestRetainedLsn = parseLsn("oldestRetainedLsn", requestDto.getOldestRetainedLsn());

        if (currentLsn != null) {
            walRuntimeProperties.setCurrentLsn(currentLsn);
        }
        if (oldestRetainedLsn != null) {
            walRuntimeProperties.setOldestRetainedLsn(oldestRetainedLsn);
        }

        return getWalPositions();
    }

    private Long parseLsn(String fieldName, String value) {
        if (value == null) {
            return null;
        }
        try {
            return LogSequenceNumberUtils.stringToLsn(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid " + fieldName + ": " + e.getMessage(), e);
        }
    }
}
