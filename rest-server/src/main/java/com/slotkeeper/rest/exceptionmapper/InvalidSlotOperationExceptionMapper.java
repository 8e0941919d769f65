package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.slotmanagement.exception.InvalidSlotOperationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class InvalidSlotOperationExceptionMapper implements ExceptionMapper<InvalidSlotOperationException> {
    @Override
    public Response toResponse(InvalidSlotOperationException exception) {
        log.info("Rejected replication slot operation: {}", exception.getMessage());
        return ErrorResponseUtils.createErrorResponse(Response.Status.BAD_REQUEST, exception.getMessage(), null);
    }
}
