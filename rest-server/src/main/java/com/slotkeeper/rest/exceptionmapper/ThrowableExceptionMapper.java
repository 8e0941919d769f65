package com.slotkeeper.rest.exceptionmapper;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class ThrowableExceptionMapper implements ExceptionMapper<Throwable> {
    @Override
    public Response toResponse(Throwable exception) {
        log.error("Error processing REST request. ", exception);
        return ErrorResponseUtils.createErrorResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Unexpected error. Cause: " + exception.getMessage(),
                null
        );
    }
}
