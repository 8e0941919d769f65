package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.event.NodePromotedEvent;
import com.slotkeeper.configuration.model.NodeRole;
import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.constant.ReplicationSlotConstants;
import com.slotkeeper.slotmanagement.exception.NodePromotionException;
import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.service.api.NodePromotionService;
import com.slotkeeper.slotmanagement.service.api.SlotPersistenceService;
import com.slotkeeper.slotmanagement.service.api.SlotSyncAgent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@ApplicationScoped
public class NodePromotionServiceImpl implements NodePromotionService {

    @Inject
    SlotSyncAgent slotSyncAgent;

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    SlotPersistenceService slotPersistenceService;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Inject
    Event<NodePromotedEvent> nodePromotedEvent;

    @Inject
    Clock clock;

    @Override
    public void promote() throws NodePromotionException {
        if (!nodeRuntimeProperties.isStandby()) {
            throw new NodePromotionException(ReplicationSlotConstants.PROMOTE_NOT_ALLOWED_MESSAGE);
        }

        AtomicInteger converted = new AtomicInteger();
        AtomicInteger dropped = new AtomicInteger();

        slotSyncAgent.runWithSyncPaused(() -> {
            if (!nodeRuntimeProperties.isStandby()) {
                throw new NodePromotionException(ReplicationSlotConstants.PROMOTE_NOT_ALLOWED_MESSAGE);
            }

            nodeRuntimeProperties.setRole(NodeRole.PRIMARY);
            Instant now = clock.instant();

            for (SlotCatalogEntry entry : slotCatalog.getAllEntries()) {
                entry.lock();
                try {
                    ReplicationSlot slot = entry.getSlot();
                    if (entry.isRemoved() || !slot.isSynced()) {
                        continue;
                    }

                    if (slot.isTemporary()) {
                        slotCatalog.removeSlot(slot.getName());
                        dropped.incrementAndGet();
                        log.info("Dropped synchronized replication slot \"{}\" which was not ready at promotion", slot.getName());
                        continue;
                    }

                    slot.setSynced(false);
                    // activity copied from old primary has no holder on this node
                    slot.setActive(false);
                    slot.setActiveHandleId(null);
                    if (slot.getInactiveSince() == null) {
                        slot.setInactiveSince(now);
                    }
                    slot.setDirty(true);
                    converted.incrementAndGet();

                    try {
                        slotPersistenceService.persistSlot(entry);
                    } catch (SlotStorageException e) {
                        log.error("Failed to persist promoted replication slot \"{}\". Will retry on next checkpoint.", slot.getName(), e);
                    }
                } finally {
                    entry.unlock();
                }
            }
        });

        log.info("Node promoted to primary. {} synchronized slots are now managed locally, {} not ready slots dropped", converted.get(), dropped.get());

        nodePromotedEvent.fire(new NodePromotedEvent(clock.instant()));
    }
}
