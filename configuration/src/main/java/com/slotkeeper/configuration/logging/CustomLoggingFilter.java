package com.slotkeeper.configuration.logging;

import com.slotkeeper.configuration.model.NodeRole;
import com.slotkeeper.configuration.properties.constant.MDCConstants;
import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import io.quarkus.logging.LoggingFilter;
import jakarta.inject.Inject;
import org.slf4j.MDC;

import java.util.logging.Filter;
import java.util.logging.LogRecord;

@LoggingFilter(name = "node-role-filter")
public class CustomLoggingFilter implements Filter {
    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public boolean isLoggable(LogRecord record) {
        // filter may be invoked before CDI container is started
        if (nodeRuntimeProperties == null) {
            return true;
        }

        NodeRole role = nodeRuntimeProperties.getRole();
        if (role != null) {
            MDC.put(MDCConstants.NODE_ROLE, role.getMdcValue());
        }
        return true;
    }
}
