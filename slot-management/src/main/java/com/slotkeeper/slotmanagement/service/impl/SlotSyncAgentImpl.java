package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.event.SlotSyncCompletedEvent;
import com.slotkeeper.configuration.properties.predefined.SlotSyncProperties;
import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.configuration.properties.runtime.WalRuntimeProperties;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.constant.ReplicationSlotConstants;
import com.slotkeeper.slotmanagement.exception.SlotAlreadyExistsException;
import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.exception.SlotSyncInProgressException;
import com.slotkeeper.slotmanagement.exception.SlotSyncNotAllowedException;
import com.slotkeeper.slotmanagement.exception.SyncTransportException;
import com.slotkeeper.slotmanagement.mapper.ReplicationSlotMapper;
import com.slotkeeper.slotmanagement.model.RemoteSlotState;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.model.SlotSyncResult;
import com.slotkeeper.slotmanagement.service.api.SlotPersistenceService;
import com.slotkeeper.slotmanagement.service.api.SlotSyncAgent;
import com.slotkeeper.slotmanagement.transport.api.PrimarySlotSource;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@ApplicationScoped
public class SlotSyncAgentImpl implements SlotSyncAgent {

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    PrimarySlotSource primarySlotSource;

    @Inject
    SlotPersistenceService slotPersistenceService;

    @Inject
    ReplicationSlotMapper replicationSlotMapper;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Inject
    WalRuntimeProperties walRuntimeProperties;

    @Inject
    SlotSyncProperties slotSyncProperties;

    @Inject
    Event<SlotSyncCompletedEvent> slotSyncCompletedEvent;

    @Inject
    Clock clock;

    private final ReentrantLock syncLock = new ReentrantLock();
    private volatile Instant lastSuccessfulSync = null;

    private enum SyncOutcome {
        CREATED,
        UPDATED,
        UNCHANGED,
        SKIPPED
    }

    @Blocking
    @Scheduled(every = "${slot-keeper.sync.interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void pollPrimary() {
        if (!slotSyncProperties.enabled() || !nodeRuntimeProperties.isStandby() || !nodeRuntimeProperties.isSlotsRestored()) {
            return;
        }

        if (!syncLock.tryLock()) {
            log.debug("Replication slot synchronization is already in progress. Skipping poll.");
            return;
        }

        try {
            if (nodeRuntimeProperties.isStandby()) {
                synchronize();
            }
        } catch (Exception e) {
            log.error("Unexpected error during replication slot synchronization. Will retry on next poll.", e);
        } finally {
            syncLock.unlock();
        }
    }

    @Override
    public SlotSyncResult syncSlots() throws SlotSyncNotAllowedException, SlotSyncInProgressException {
        if (!nodeRuntimeProperties.isStandby()) {
            throw new SlotSyncNotAllowedException(ReplicationSlotConstants.SYNC_NOT_ALLOWED_MESSAGE);
        }

        if (!syncLock.tryLock()) {
            throw new SlotSyncInProgressException(ReplicationSlotConstants.SYNC_IN_PROGRESS_MESSAGE);
        }

        try {
            // node could be promoted while lock was not held
            if (!nodeRuntimeProperties.isStandby()) {
                throw new SlotSyncNotAllowedException(ReplicationSlotConstants.SYNC_NOT_ALLOWED_MESSAGE);
            }
            return synchronize();
        } finally {
            syncLock.unlock();
        }
    }

    @Override
    public void runWithSyncPaused(Runnable action) {
        syncLock.lock();
        try {
            action.run();
        } finally {
            syncLock.unlock();
        }
    }

    @Override
    public Instant getLastSuccessfulSync() {
        return lastSuccessfulSync;
    }

    private SlotSyncResult synchronize() {
        List<RemoteSlotState> remoteSlots;
        try {
            remoteSlots = primarySlotSource.fetchFailoverSlots();
        } catch (SyncTransportException e) {
            log.warn("Could not fetch failover replication slots from primary. Synchronization skipped until next poll. Cause: {}", e.getMessage());
            log.debug("Synchronization transport failure", e);
            return finish(false, List.of(), List.of(), List.of(), List.of());
        }

        List<String> created = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Set<String> remoteNames = new HashSet<>();

        for (RemoteSlotState remote : remoteSlots) {
            if (!remote.isFailover() || remote.isTemporary()) {
                continue;
            }
            remoteNames.add(remote.getName());

            SyncOutcome outcome = synchronizeSlot(remote);
            switch (outcome) {
                case CREATED -> created.add(remote.getName());
                case UPDATED -> updated.add(remote.getName());
                case SKIPPED -> skipped.add(remote.getName());
                default -> {
                }
            }
        }

        List<String> dropped = dropObsoleteMirrors(remoteNames);

        lastSuccessfulSync = clock.instant();

        return finish(true, created, updated, dropped, skipped);
    }

    private SlotSyncResult finish(boolean primaryReachable, List<String> created, List<String> updated, List<String> dropped, List<String> skipped) {
        Instant now = clock.instant();

        slotSyncCompletedEvent.fire(
                SlotSyncCompletedEvent
                        .builder()
                        .primaryReachable(primaryReachable)
                        .createdCount(created.size())
                        .updatedCount(updated.size())
                        .droppedCount(dropped.size())
                        .completedAt(now)
                        .build()
        );

        return SlotSyncResult
                .builder()
                .primaryReachable(primaryReachable)
                .createdSlotNames(created)
                .updatedSlotNames(updated)
                .droppedSlotNames(dropped)
                .skippedSlotNames(skipped)
                .completedAt(now)
                .build();
    }

    private SyncOutcome synchronizeSlot(RemoteSlotState remote) {
        Optional<SlotCatalogEntry> existing = slotCatalog.findEntry(remote.getName());

        if (existing.isEmpty()) {
            return createMirror(remote);
        }

        SlotCatalogEntry entry = existing.get();
        entry.lock();
        try {
            if (!entry.isRemoved()) {
                ReplicationSlot local = entry.getSlot();

                if (!local.isSynced()) {
                    log.warn("Skipping synchronization of replication slot \"{}\" because a slot with the same name which is not synchronized exists on this node", remote.getName());
                    return SyncOutcome.SKIPPED;
                }

                if (!local.isInvalidated() || remote.getInvalidationReason() != null) {
                    return updateMirror(entry, remote) ? SyncOutcome.UPDATED : SyncOutcome.UNCHANGED;
                }

                // valid remote slot with same name as invalidated mirror was recreated on primary
                log.info("Replication slot \"{}\" was recreated on primary. Replacing invalidated local copy.", remote.getName());
                slotCatalog.removeSlot(remote.getName());
                forgetQuietly(remote.getName());
            }
        } finally {
            entry.unlock();
        }

        return createMirror(remote);
    }

    private SyncOutcome createMirror(RemoteSlotState remote) {
        ReplicationSlot mirror = replicationSlotMapper.toMirror(remote);

        if (mirror.isInvalidated() || isReachedLocally(mirror.getRestartLsn())) {
            mirror.setTemporary(false);
        } else {
            log.info("Could not make synchronized replication slot \"{}\" durable yet. The remote slot has LSN {}, but the standby has only replayed up to {}.",
                    remote.getName(),
                    LogSequenceNumberUtils.lsnToString(remote.getRestartLsn()),
                    LogSequenceNumberUtils.lsnToString(walRuntimeProperties.getCurrentLsn())
            );
        }

        SlotCatalogEntry entry;
        try {
            entry = slotCatalog.addSlot(mirror);
        } catch (SlotAlreadyExistsException e) {
            log.warn("Skipping synchronization of replication slot \"{}\" because it was created on this node concurrently", remote.getName());
            return SyncOutcome.SKIPPED;
        }

        persistQuietly(entry);

        log.info("Synchronized replication slot \"{}\" from primary{}", remote.getName(), mirror.isInvalidated() ? " as invalidated with reason \"" + mirror.getInvalidationReason().getToken() + "\"" : "");

        return SyncOutcome.CREATED;
    }

    /**
     * Copies state of primary to mirror. Caller holds entry lock.
     */
    private boolean updateMirror(SlotCatalogEntry entry, RemoteSlotState remote) {
        ReplicationSlot local = entry.getSlot();
        boolean changed = false;

        if (!local.isInvalidated() && remote.getInvalidationReason() != null) {
            local.setInvalidationReason(remote.getInvalidationReason());
            local.setInvalidatedAt(remote.getInvalidatedAt() != null ? remote.getInvalidatedAt() : clock.instant());
            changed = true;
            log.info("Replication slot \"{}\" was invalidated on primary with reason \"{}\". Local copy is invalidated too.", local.getName(), remote.getInvalidationReason().getToken());
        }

        if (local.isActive() != remote.isActive()) {
            local.setActive(remote.isActive());
            changed = true;
        }

        if (!Objects.equals(local.getInactiveSince(), remote.getInactiveSince())) {
            local.setInactiveSince(remote.getInactiveSince());
            changed = true;
        }

        if (!local.isInvalidated()) {
            if (LogSequenceNumberUtils.compareTwoLsn(remote.getRestartLsn(), local.getRestartLsn()) > 0) {
                local.setRestartLsn(remote.getRestartLsn());
                changed = true;
            } else if (LogSequenceNumberUtils.compareTwoLsn(remote.getRestartLsn(), local.getRestartLsn()) < 0) {
                log.debug("Remote restart_lsn {} of replication slot \"{}\" precedes local one {}. Keeping local position.",
                        LogSequenceNumberUtils.lsnToString(remote.getRestartLsn()),
                        local.getName(),
                        LogSequenceNumberUtils.lsnToString(local.getRestartLsn())
                );
            }

            if (LogSequenceNumberUtils.compareTwoLsn(remote.getConfirmedFlushLsn(), local.getConfirmedFlushLsn()) > 0) {
                local.setConfirmedFlushLsn(remote.getConfirmedFlushLsn());
                changed = true;
            }
        }

        if (local.isTemporary() && (local.isInvalidated() || isReachedLocally(local.getRestartLsn()))) {
            local.setTemporary(false);
            changed = true;
            log.info("Synchronized replication slot \"{}\" is sync-ready now", local.getName());
        }

        if (changed) {
            local.setDirty(true);
            persistQuietly(entry);
        }

        return changed;
    }

    private List<String> dropObsoleteMirrors(Set<String> remoteNames) {
        List<String> dropped = new ArrayList<>();

        for (SlotCatalogEntry entry : slotCatalog.getAllEntries()) {
            entry.lock();
            try {
                ReplicationSlot slot = entry.getSlot();
                if (entry.isRemoved() || !slot.isSynced() || remoteNames.contains(slot.getName())) {
                    continue;
                }

                slotCatalog.removeSlot(slot.getName());
                forgetQuietly(slot.getName());
                dropped.add(slot.getName());
                log.info("Dropped synchronized replication slot \"{}\" because it does not exist on primary or is no longer a failover slot", slot.getName());
            } finally {
                entry.unlock();
            }
        }

        return dropped;
    }

    private boolean isReachedLocally(long remoteRestartLsn) {
        long currentLsn = walRuntimeProperties.getCurrentLsn();
        return currentLsn != LogSequenceNumberUtils.INVALID_LSN
                && LogSequenceNumberUtils.compareTwoLsn(currentLsn, remoteRestartLsn) >= 0;
    }

    private void persistQuietly(SlotCatalogEntry entry) {
        try {
            slotPersistenceService.persistSlot(entry);
        } catch (SlotStorageException e) {
            log.error("Failed to persist synchronized replication slot \"{}\". Will retry on next checkpoint.", entry.getSlotName(), e);
        }
    }

    private void forgetQuietly(String slotName) {
        try {
            slotPersistenceService.forgetSlot(slotName);
        } catch (SlotStorageException e) {
            log.error("Failed to delete replication slot \"{}\" from storage", slotName, e);
        }
    }
}
