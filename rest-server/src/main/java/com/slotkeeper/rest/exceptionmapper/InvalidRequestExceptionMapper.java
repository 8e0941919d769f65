package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.rest.exception.InvalidRequestException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class InvalidRequestExceptionMapper implements ExceptionMapper<InvalidRequestException> {
    @Override
    public Response toResponse(InvalidRequestException exception) {
        log.debug("Invalid request: {}", exception.getMessage());
        return ErrorResponseUtils.createErrorResponse(Response.Status.BAD_REQUEST, exception.getMessage(), null);
    }
}
