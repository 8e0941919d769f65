package com.slotkeeper.configuration.properties.constant;

public class SlotSettingsConstants {

    public static final String REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME = "replication_slot_inactive_timeout";

    public static final String REPLICATION_SLOT_INACTIVE_TIMEOUT_DESCRIPTION = "Sets the amount of time a replication slot can remain inactive before it will be invalidated.";

    // applied on reload, same as Postgres 'sighup' settings
    public static final String RELOADABLE_SETTING_CONTEXT = "sighup";

    public static final String SECONDS_UNIT = "s";

    // upper bound of integer GUC expressed in seconds
    public static final long MAX_INACTIVE_TIMEOUT_SECONDS = Integer.MAX_VALUE;

    private SlotSettingsConstants() {
    }
}
