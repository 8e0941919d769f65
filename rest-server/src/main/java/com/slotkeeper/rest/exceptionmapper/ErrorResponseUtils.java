package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.rest.model.api.error.ErrorDto;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.time.Instant;

public class ErrorResponseUtils {

    private ErrorResponseUtils() {
    }

    public static ErrorDto createErrorDto(Response.Status status, String message, String detail) {
        return ErrorDto
                .builder()
                .status(status.getStatusCode())
                .timestamp(Instant.now())
                .message(message)
                .detail(detail)
                .build();
    }

    public static Response createErrorResponse(Response.Status status, String message, String detail) {
        return Response
                .status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(createErrorDto(status, message, detail))
                .build();
    }
}
