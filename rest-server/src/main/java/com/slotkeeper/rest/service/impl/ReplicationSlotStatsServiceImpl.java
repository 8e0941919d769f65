package com.slotkeeper.rest.service.impl;

import com.slotkeeper.configuration.event.NodePromotedEvent;
import com.slotkeeper.configuration.event.ReplicationSlotInvalidatedEvent;
import com.slotkeeper.configuration.event.SlotSettingsUpdatedEvent;
import com.slotkeeper.configuration.event.SlotSyncCompletedEvent;
import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.utils.PostgresSettingsUtils;
import com.slotkeeper.rest.model.api.stats.InvalidationRecordDto;
import com.slotkeeper.rest.model.api.stats.ReplicationSlotStatsResponseDto;
import com.slotkeeper.rest.model.api.stats.SyncStatsDto;
import com.slotkeeper.rest.service.api.ReplicationSlotStatsService;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.apache.commons.collections4.queue.CircularFifoQueue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps counters of invalidations and sync polls of this node since start.
 */
@ApplicationScoped
public class ReplicationSlotStatsServiceImpl implements ReplicationSlotStatsService {

    private static final int RECENT_INVALIDATIONS_LIMIT = 100;

    @Inject
    SlotCatalog slotCatalog;

    private final Object statsLock = new Object();
    private final CircularFifoQueue<InvalidationRecordDto> recentInvalidations = new CircularFifoQueue<>(RECENT_INVALIDATIONS_LIMIT);
    private final Map<InvalidationReason, Long> invalidationsByReason = new EnumMap<>(InvalidationReason.class);
    private SyncStatsDto syncStats = null;
    private long settingsChangesCount = 0;
    private Instant promotedAt = null;

    public void onSlotInvalidated(@Observes ReplicationSlotInvalidatedEvent event) {
        InvalidationRecordDto invalidationRecord = InvalidationRecordDto
                .builder()
                .slotName(event.getSlotName())
                .reason(event.getReason())
                .invalidatedAt(event.getInvalidatedAt())
                .inactiveSince(event.getInactiveSince())
                .inactiveTimeout(event.getInactiveTimeout() == null ? null : PostgresSettingsUtils.convertDurationToPgTimeValue(event.getInactiveTimeout()))
                .build();

        synchronized (statsLock) {
            recentInvalidations.add(invalidationRecord);
            invalidationsByReason.merge(event.getReason(), 1L, Long::sum);
        }
    }

    public void onSyncCompleted(@Observes SlotSyncCompletedEvent event) {
        synchronized (statsLock) {
            long completed = syncStats == null ? 0 : syncStats.getCompletedPollsCount();
            long failed = syncStats == null ? 0 : syncStats.getFailedPollsCount();

            syncStats = SyncStatsDto
                    .builder()
                    .completedPollsCount(event.isPrimaryReachable() ? completed + 1 : completed)
                    .failedPollsCount(event.isPrimaryReachable() ? failed : failed + 1)
                    .lastPollAt(event.getCompletedAt())
                    .lastPollPrimaryReachable(event.isPrimaryReachable())
                    .lastCreatedCount(event.getCreatedCount())
                    .lastUpdatedCount(event.getUpdatedCount())
                    .lastDroppedCount(event.getDroppedCount())
                    .build();
        }
    }

    public void onSettingsUpdated(@Observes SlotSettingsUpdatedEvent event) {
        synchronized (statsLock) {
            settingsChangesCount++;
        }
    }

    public void onNodePromoted(@Observes NodePromotedEvent event) {
        synchronized (statsLock) {
            promotedAt = event.getPromotedAt();
        }
    }

    @Override
    public ReplicationSlotStatsResponseDto getStats() {
        List<ReplicationSlotInfo> slots = slotCatalog.listSlots();

        ReplicationSlotStatsResponseDto.ReplicationSlotStatsResponseDtoBuilder builder = ReplicationSlotStatsResponseDto
                .builder()
                .slotsCount(slots.size())
                .activeSlotsCount((int) slots.stream().filter(ReplicationSlotInfo::isActive).count())
                .invalidatedSlotsCount((int) slots.stream().filter(slot -> slot.getInvalidationReason() != null).count());

        synchronized (statsLock) {
            Map<String, Long> byReason = new LinkedHashMap<>();
            invalidationsByReason.forEach((reason, count) -> byReason.put(reason.getToken(), count));

            return builder
                    .invalidationsByReason(byReason)
                    .recentInvalidations(new ArrayList<>(recentInvalidations))
                    .sync(syncStats)
                    .settingsChangesCount(settingsChangesCount)
                    .promotedAt(promotedAt)
                    .build();
        }
    }
}
