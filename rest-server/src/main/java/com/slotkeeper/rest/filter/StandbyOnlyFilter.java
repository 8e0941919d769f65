package com.slotkeeper.rest.filter;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.rest.exceptionmapper.ErrorResponseUtils;
import com.slotkeeper.rest.filter.namebinding.StandbyOnly;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import java.io.IOException;

@Provider
@StandbyOnly
public class StandbyOnlyFilter implements ContainerRequestFilter {

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        if (!nodeRuntimeProperties.isStandby()) {
            requestContext.abortWith(
                    ErrorResponseUtils.createErrorResponse(
                            Response.Status.CONFLICT,
                            "This operation is only allowed on standby node",
                            "Current node role is " + nodeRuntimeProperties.getRole().getMdcValue()
                    )
            );
        }
    }
}
