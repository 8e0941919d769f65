package com.slotkeeper.configuration.producers;

import com.slotkeeper.configuration.exception.ConfigurationInitializationException;
import com.slotkeeper.configuration.properties.constant.SlotKeeperConstants;
import com.slotkeeper.configuration.properties.predefined.StorageProperties;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

@Slf4j
@ApplicationScoped
public class FilesPathsProducer {
    @Inject
    StorageProperties storageProperties;

    @PostConstruct
    public void createDirs() {
        try {
            Files.createDirectories(Paths.get(storageProperties.directoryPath()));
        } catch (IOException e) {
            throw new ConfigurationInitializationException("Error while creating directory for SlotKeeper local files", e);
        }
    }

    public String getSlotsFilePath() {
        return FilenameUtils.concat(
                storageProperties.directoryPath(),
                storageProperties.slotsFilename() + SlotKeeperConstants.JSON_EXTENSION
        );
    }
}
