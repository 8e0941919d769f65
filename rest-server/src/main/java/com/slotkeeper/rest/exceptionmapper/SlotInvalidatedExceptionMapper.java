package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.slotmanagement.exception.SlotInvalidatedException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class SlotInvalidatedExceptionMapper implements ExceptionMapper<SlotInvalidatedException> {
    @Override
    public Response toResponse(SlotInvalidatedException exception) {
        log.info("Replication slot \"{}\" can not be used because it was invalidated with reason \"{}\"", exception.getSlotName(), exception.getReason() == null ? null : exception.getReason().getToken());
        return ErrorResponseUtils.createErrorResponse(Response.Status.CONFLICT, exception.getMessage(), exception.getDetail());
    }
}
