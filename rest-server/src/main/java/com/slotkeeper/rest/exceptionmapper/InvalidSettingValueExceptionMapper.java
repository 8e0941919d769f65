package com.slotkeeper.rest.exceptionmapper;

import com.slotkeeper.configuration.exception.InvalidSettingValueException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Provider
public class InvalidSettingValueExceptionMapper implements ExceptionMapper<InvalidSettingValueException> {
    @Override
    public Response toResponse(InvalidSettingValueException exception) {
        log.info("Rejected settings change: {}", exception.getMessage());
        return ErrorResponseUtils.createErrorResponse(Response.Status.BAD_REQUEST, exception.getMessage(), null);
    }
}
