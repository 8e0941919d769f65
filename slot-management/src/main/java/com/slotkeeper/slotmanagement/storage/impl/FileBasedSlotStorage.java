package com.slotkeeper.slotmanagement.storage.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.slotkeeper.configuration.exception.ConfigurationInitializationException;
import com.slotkeeper.configuration.producers.FilesPathsProducer;
import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.model.PersistedReplicationSlot;
import com.slotkeeper.slotmanagement.storage.api.SlotStorage;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@ApplicationScoped
public class FileBasedSlotStorage implements SlotStorage {

    @Inject
    FilesPathsProducer filesPathsProducer;

    private ObjectMapper objectMapper;

    private File slotsFile;
    private final ReentrantLock slotsFileModificationLock = new ReentrantLock();

    private static final String TMP_SUFFIX = ".tmp";

    // @formatter:off
    private static final TypeReference<TreeMap<String, PersistedReplicationSlot>> SLOTS_TYPE_REF = new TypeReference<>() {};
    // @formatter:on

    @PostConstruct
    public void init() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        slotsFile = createSlotsFileIfNeeded(filesPathsProducer.getSlotsFilePath());
    }

    @Override
    public List<PersistedReplicationSlot> loadSlots() throws SlotStorageException {
        try {
            slotsFileModificationLock.lock();
            if (slotsFile.length() > 0) {
                return new ArrayList<>(readSlots().values());
            } else {
                return Collections.emptyList();
            }
        } catch (Exception e) {
            throw new SlotStorageException("Error while reading replication slots from file " + slotsFile.getAbsolutePath(), e);
        } finally {
            slotsFileModificationLock.unlock();
        }
    }

    @Override
    public void saveSlot(PersistedReplicationSlot slot) throws SlotStorageException {
        try {
            slotsFileModificationLock.lock();
            Map<String, PersistedReplicationSlot> savedMap = readSlots();
            savedMap.put(slot.getName(), slot);
            writeSlots(savedMap);
        } catch (Exception e) {
            throw new SlotStorageException("Error while saving replication slot " + slot.getName() + " to file", e);
        } finally {
            slotsFileModificationLock.unlock();
        }
    }

    @Override
    public boolean deleteSlot(String slotName) throws SlotStorageException {
        try {
            slotsFileModificationLock.lock();
            Map<String, PersistedReplicationSlot> savedMap = readSlots();

            PersistedReplicationSlot removed = savedMap.remove(slotName);
            if (removed != null) {
                writeSlots(savedMap);
            }

            return removed != null;
        } catch (Exception e) {
            throw new SlotStorageException("Error while deleting replication slot " + slotName + " from file", e);
        } finally {
            slotsFileModificationLock.unlock();
        }
    }

    private TreeMap<String, PersistedReplicationSlot> readSlots() throws Exception {
        if (slotsFile.length() > 0) {
            return objectMapper.readValue(slotsFile, SLOTS_TYPE_REF);
        }
        return new TreeMap<>();
    }

    /**
     * Writes to temporary file first and then replaces main file, so a crash never leaves half-written state.
     */
    private void writeSlots(Map<String, PersistedReplicationSlot> slots) throws Exception {
        Path target = slotsFile.toPath();
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), slots);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private File createSlotsFileIfNeeded(String path) throws ConfigurationInitializationException {
        try {
            File file = new File(path);

            if (!file.exists()) {
                Files.createDirectories(file.getAbsoluteFile().getParentFile().toPath());
                file.createNewFile();
                log.info("Created replication slots file {}", file.getAbsolutePath());
            }

            if (!file.canRead() || !file.canWrite()) {
                throw new ConfigurationInitializationException("File " + file.getAbsolutePath() + " must have RW permissions for user which runs SlotKeeper");
            }

            return file;
        } catch (ConfigurationInitializationException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationInitializationException("Can not initialize replication slots file storage", e);
        }
    }
}
