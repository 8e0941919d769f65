package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.slotmanagement.exception.SlotOperationConflictException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class SlotOperationConflictExceptionMapper implements ExceptionMapper<SlotOperationConflictException> {
    @Override
    public Response toResponse(SlotOperationConflictException exception) {
        log.info("Rejected replication slot operation: {}", exception.getMessage());
        return ErrorResponseUtils.createErrorResponse(Response.Status.CONFLICT, exception.getMessage(), null);
    }
}
