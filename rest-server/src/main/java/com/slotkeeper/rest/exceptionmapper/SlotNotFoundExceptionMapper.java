package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class SlotNotFoundExceptionMapper implements ExceptionMapper<SlotNotFoundException> {
    @Override
    public Response toResponse(SlotNotFoundException exception) {
        log.debug("Not found: {}", exception.getMessage());
        return ErrorResponseUtils.createErrorResponse(Response.Status.NOT_FOUND, exception.getMessage(), null);
    }
}
