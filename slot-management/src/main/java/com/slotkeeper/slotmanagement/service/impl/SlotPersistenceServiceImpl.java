package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.mapper.ReplicationSlotMapper;
import com.slotkeeper.slotmanagement.model.PersistedReplicationSlot;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.service.api.LivenessTracker;
import com.slotkeeper.slotmanagement.service.api.SlotPersistenceService;
import com.slotkeeper.slotmanagement.storage.api.SlotStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@ApplicationScoped
public class SlotPersistenceServiceImpl implements SlotPersistenceService {

    @Inject
    SlotStorage slotStorage;

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    LivenessTracker livenessTracker;

    @Inject
    ReplicationSlotMapper replicationSlotMapper;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public int restoreSlots() throws SlotStorageException {
        List<PersistedReplicationSlot> persistedSlots = slotStorage.loadSlots();

        int restored = 0;
        for (PersistedReplicationSlot persisted : persistedSlots) {
            ReplicationSlot slot = replicationSlotMapper.fromPersisted(persisted);
            livenessTracker.onRestore(slot);
            slotCatalog.addSlot(slot);
            restored++;

            if (slot.isInvalidated()) {
                log.info("Restored replication slot \"{}\" which was invalidated with reason \"{}\"", slot.getName(), slot.getInvalidationReason().getToken());
            }
        }

        nodeRuntimeProperties.setSlotsRestored(true);
        log.info("Restored {} replication slots from storage", restored);

        return restored;
    }

    @Override
    public void persistSlot(SlotCatalogEntry entry) throws SlotStorageException {
        entry.lock();
        try {
            ReplicationSlot slot = entry.getSlot();
            if (slot.isTemporary() || entry.isRemoved()) {
                return;
            }

            slotStorage.saveSlot(replicationSlotMapper.toPersisted(slot));
            slot.setDirty(false);
        } finally {
            entry.unlock();
        }
    }

    @Override
    public int flushDirtySlots() {
        int flushed = 0;

        for (SlotCatalogEntry entry : slotCatalog.getAllEntries()) {
            entry.lock();
            try {
                ReplicationSlot slot = entry.getSlot();
                if (!slot.isDirty() || slot.isTemporary() || entry.isRemoved()) {
                    continue;
                }

                persistSlot(entry);
                flushed++;
            } catch (SlotStorageException e) {
                log.error("Failed to flush replication slot \"{}\". Will retry on next checkpoint.", entry.getSlotName(), e);
            } finally {
                entry.unlock();
            }
        }

        return flushed;
    }

    @Override
    public void forgetSlot(String slotName) throws SlotStorageException {
        if (slotStorage.deleteSlot(slotName)) {
            log.debug("Deleted replication slot \"{}\" from storage", slotName);
        }
    }

    @Override
    public int dropTemporarySlots() {
        int dropped = 0;

        for (SlotCatalogEntry entry : slotCatalog.getAllEntries()) {
            entry.lock();
            try {
                if (entry.getSlot().isTemporary() && slotCatalog.removeSlot(entry.getSlotName()).isPresent()) {
                    dropped++;
                    log.info("Dropped temporary replication slot \"{}\"", entry.getSlotName());
                }
            } finally {
                entry.unlock();
            }
        }

        return dropped;
    }
}
