package com.slotkeeper.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

@ConfigMapping(prefix = "slot-keeper.storage")
public interface StorageProperties {

    String directoryPath();

    String slotsFilename();
}
