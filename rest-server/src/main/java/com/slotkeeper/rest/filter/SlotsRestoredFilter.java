package com.slotkeeper.rest.filter;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.rest.exceptionmapper.ErrorResponseUtils;
import com.slotkeeper.rest.filter.namebinding.SlotsRestored;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import java.io.IOException;

@Provider
@SlotsRestored
public class SlotsRestoredFilter implements ContainerRequestFilter {

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        if (!nodeRuntimeProperties.isSlotsRestored()) {
            requestContext.abortWith(
                    ErrorResponseUtils.createErrorResponse(
                            Response.Status.SERVICE_UNAVAILABLE,
                            "Replication slots are not restored yet. Try again later.",
                            null
                    )
            );
        }
    }
}
