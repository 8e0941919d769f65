package com.slotkeeper.configuration.properties.predefined;

import com.slotkeeper.configuration.model.NodeRole;
import io.smallrye.config.ConfigMapping;

@ConfigMapping(prefix = "slot-keeper.node")
public interface NodeProperties {

    /**
     * Role this node starts with. Standby nodes mirror failover slots of the primary and never make their own invalidation decisions for them.
     */
    NodeRole role();
}
