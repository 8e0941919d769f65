package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.slotmanagement.exception.StreamingSessionNotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class StreamingSessionNotFoundExceptionMapper implements ExceptionMapper<StreamingSessionNotFoundException> {
    @Override
    public Response toResponse(StreamingSessionNotFoundException exception) {
        log.debug("Not found: {}", exception.getMessage());
        return ErrorResponseUtils.createErrorResponse(Response.Status.NOT_FOUND, exception.getMessage(), null);
    }
}
