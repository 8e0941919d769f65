package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.event.ReplicationSlotInvalidatedEvent;
import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.properties.constant.SlotSettingsConstants;
import com.slotkeeper.configuration.properties.runtime.SlotSettingsRuntimeProperties;
import com.slotkeeper.configuration.properties.runtime.WalRuntimeProperties;
import com.slotkeeper.configuration.utils.PostgresSettingsUtils;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.model.InvalidationPassResult;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.service.api.InvalidationEvaluator;
import com.slotkeeper.slotmanagement.service.api.SlotPersistenceService;
import com.slotkeeper.slotmanagement.util.LogSequenceNumberUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@ApplicationScoped
public class InvalidationEvaluatorImpl implements InvalidationEvaluator {

    @Inject
    SlotCatalog slotCatalog;

    @Inject
    SlotSettingsRuntimeProperties slotSettingsRuntimeProperties;

    @Inject
    WalRuntimeProperties walRuntimeProperties;

    @Inject
    SlotPersistenceService slotPersistenceService;

    @Inject
    Event<ReplicationSlotInvalidatedEvent> replicationSlotInvalidatedEvent;

    @Inject
    Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();

    @Override
    public InvalidationPassResult runInvalidationPass() {
        passLock.lock();
        try {
            Duration inactiveTimeout = slotSettingsRuntimeProperties.getInactiveTimeout();
            long oldestRetainedLsn = walRuntimeProperties.getOldestRetainedLsn();

            int checked = 0;
            List<String> invalidated = new ArrayList<>();

            for (SlotCatalogEntry entry : slotCatalog.getAllEntries()) {
                entry.lock();
                try {
                    ReplicationSlot slot = entry.getSlot();
                    if (entry.isRemoved() || !isSubjectToLocalInvalidation(slot)) {
                        continue;
                    }

                    checked++;
                    Instant now = clock.instant();
                    InvalidationReason reason = determineInvalidationReason(slot, inactiveTimeout, oldestRetainedLsn, now);

                    if (reason != null) {
                        invalidate(entry, reason, inactiveTimeout, oldestRetainedLsn, now);
                        invalidated.add(slot.getName());
                    }
                } finally {
                    entry.unlock();
                }
            }

            if (!invalidated.isEmpty()) {
                log.info("Invalidation pass finished. Checked {} slots, invalidated {}", checked, invalidated);
            } else {
                log.debug("Invalidation pass finished. Checked {} slots, nothing invalidated", checked);
            }

            return InvalidationPassResult
                    .builder()
                    .checkedSlotsCount(checked)
                    .invalidatedSlotNames(invalidated)
                    .completedAt(clock.instant())
                    .build();
        } finally {
            passLock.unlock();
        }
    }

    /**
     * Synced slots are governed by primary, temporary slots never outlive their session.
     */
    private boolean isSubjectToLocalInvalidation(ReplicationSlot slot) {
        return !slot.isSynced()
                && !slot.isTemporary()
                && !slot.isInvalidated()
                && !slot.isActive();
    }

    private InvalidationReason determineInvalidationReason(ReplicationSlot slot, Duration inactiveTimeout, long oldestRetainedLsn, Instant now) {
        if (oldestRetainedLsn != LogSequenceNumberUtils.INVALID_LSN
                && slot.getRestartLsn() != LogSequenceNumberUtils.INVALID_LSN
                && LogSequenceNumberUtils.compareTwoLsn(slot.getRestartLsn(), oldestRetainedLsn) < 0) {
            return InvalidationReason.WAL_REMOVED;
        }

        if (inactiveTimeout.isZero() || slot.getInactiveSince() == null) {
            return null;
        }

        Duration idle = Duration.between(slot.getInactiveSince(), now);
        if (idle.compareTo(inactiveTimeout) >= 0) {
            return InvalidationReason.INACTIVE_TIMEOUT;
        }

        return null;
    }

    private void invalidate(SlotCatalogEntry entry, InvalidationReason reason, Duration inactiveTimeout, long oldestRetainedLsn, Instant now) {
        ReplicationSlot slot = entry.getSlot();

        slot.setInvalidationReason(reason);
        slot.setInvalidatedAt(now);
        slot.setDirty(true);

        log.info("invalidating obsolete replication slot \"{}\". {}", slot.getName(), createDetail(slot, reason, inactiveTimeout, oldestRetainedLsn, now));

        try {
            slotPersistenceService.persistSlot(entry);
        } catch (SlotStorageException e) {
            log.error("Failed to persist invalidation of replication slot \"{}\". Will retry on next checkpoint.", slot.getName(), e);
        }

        replicationSlotInvalidatedEvent.fire(
                ReplicationSlotInvalidatedEvent
                        .builder()
                        .slotName(slot.getName())
                        .reason(reason)
                        .invalidatedAt(now)
                        .inactiveSince(InvalidationReason.INACTIVE_TIMEOUT.equals(reason) ? slot.getInactiveSince() : null)
                        .inactiveTimeout(InvalidationReason.INACTIVE_TIMEOUT.equals(reason) ? inactiveTimeout : Duration.ZERO)
                        .build()
        );
    }

    private String createDetail(ReplicationSlot slot, InvalidationReason reason, Duration inactiveTimeout, long oldestRetainedLsn, Instant now) {
        if (InvalidationReason.WAL_REMOVED.equals(reason)) {
            return String.format(
                    "The slot's restart_lsn %s is behind the oldest retained WAL position %s.",
                    LogSequenceNumberUtils.lsnToString(slot.getRestartLsn()),
                    LogSequenceNumberUtils.lsnToString(oldestRetainedLsn)
            );
        }

        Duration idle = Duration.between(slot.getInactiveSince(), now).truncatedTo(ChronoUnit.MILLIS);
        return String.format(
                "The slot's idle time of %s exceeds the configured \"%s\" duration of %s.",
                PostgresSettingsUtils.convertDurationToPgTimeValue(idle),
                SlotSettingsConstants.REPLICATION_SLOT_INACTIVE_TIMEOUT_SETTING_NAME,
                PostgresSettingsUtils.convertDurationToPgTimeValue(inactiveTimeout)
        );
    }
}
