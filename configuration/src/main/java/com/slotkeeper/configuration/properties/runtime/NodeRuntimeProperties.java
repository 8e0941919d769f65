package com.slotkeeper.configuration.properties.runtime;

import com.slotkeeper.configuration.model.NodeRole;
import com.slotkeeper.configuration.properties.predefined.NodeProperties;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ApplicationScoped
public class NodeRuntimeProperties {

    @Inject
    NodeProperties nodeProperties;

    private volatile NodeRole role = NodeRole.PRIMARY;
    private volatile boolean slotsRestored = false;

    @PostConstruct
    public void init() {
        role = nodeProperties.role();
    }

    public boolean isStandby() {
        return NodeRole.STANDBY.equals(role);
    }
}
