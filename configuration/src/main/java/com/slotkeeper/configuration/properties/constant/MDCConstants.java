package com.slotkeeper.configuration.properties.constant;

public class MDCConstants {
    public static final String NODE_ROLE = "nodeRole";

    private MDCConstants() {
    }
}
