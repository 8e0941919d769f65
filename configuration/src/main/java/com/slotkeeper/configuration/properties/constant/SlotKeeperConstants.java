package com.slotkeeper.configuration.properties.constant;

public class SlotKeeperConstants {

    public static final String SLOT_CATALOG_READINESS_CHECK = "Replication slot catalog readiness check";

    public static final String SLOT_SYNC_READINESS_CHECK = "Replication slot sync check";

    public static final String JSON_EXTENSION = ".json";

    private SlotKeeperConstants() {
    }
}
