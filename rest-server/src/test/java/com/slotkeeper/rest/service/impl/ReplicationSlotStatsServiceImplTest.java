package com.slotkeeper.rest.service.impl;

import com.slotkeeper.configuration.event.NodePromotedEvent;
import com.slotkeeper.configuration.event.ReplicationSlotInvalidatedEvent;
import com.slotkeeper.configuration.event.SlotSyncCompletedEvent;
import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.SlotKind;
import com.slotkeeper.rest.model.api.stats.InvalidationRecordDto;
import com.slotkeeper.rest.model.api.stats.ReplicationSlotStatsResponseDto;
import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReplicationSlotStatsServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:02Z");

    @Mock
    SlotCatalog slotCatalog;

    private ReplicationSlotStatsServiceImpl statsService;

    @BeforeEach
    void setUp() {
        statsService = new ReplicationSlotStatsServiceImpl();
        statsService.slotCatalog = slotCatalog;
    }

    @Test
    void slotCountsAreTakenFromCatalog() {
        when(slotCatalog.listSlots()).thenReturn(List.of(
                ReplicationSlotInfo.builder().name("a").kind(SlotKind.PHYSICAL).active(true).build(),
                ReplicationSlotInfo.builder().name("b").kind(SlotKind.PHYSICAL).inactiveSince(NOW).build(),
                ReplicationSlotInfo.builder().name("c").kind(SlotKind.LOGICAL).inactiveSince(NOW).invalidationReason(InvalidationReason.INACTIVE_TIMEOUT).build()
        ));

        ReplicationSlotStatsResponseDto stats = statsService.getStats();

        assertThat(stats.getSlotsCount()).isEqualTo(3);
        assertThat(stats.getActiveSlotsCount()).isEqualTo(1);
        assertThat(stats.getInvalidatedSlotsCount()).isEqualTo(1);
        assertThat(stats.getSync()).isNull();
        assertThat(stats.getRecentInvalidations()).isEmpty();
    }

    @Test
    void invalidationEventsAreCountedByReasonToken() {
        when(slotCatalog.listSlots()).thenReturn(List.of());

        statsService.onSlotInvalidated(invalidatedEvent("first", InvalidationReason.INACTIVE_TIMEOUT));
        statsService.onSlotInvalidated(invalidatedEvent("second", InvalidationReason.INACTIVE_TIMEOUT));
        statsService.onSlotInvalidated(invalidatedEvent("third", InvalidationReason.WAL_REMOVED));

        ReplicationSlotStatsResponseDto stats = statsService.getStats();

        assertThat(stats.getInvalidationsByReason())
                .containsEntry("inactive_timeout", 2L)
                .containsEntry("wal_removed", 1L);
        assertThat(stats.getRecentInvalidations())
                .extracting(InvalidationRecordDto::getSlotName)
                .containsExactly("first", "second", "third");
        assertThat(stats.getRecentInvalidations().get(0).getInactiveTimeout()).isEqualTo("1s");
    }

    @Test
    void onlyLatestInvalidationsAreKept() {
        when(slotCatalog.listSlots()).thenReturn(List.of());

        for (int i = 0; i < 150; i++) {
            statsService.onSlotInvalidated(invalidatedEvent("slot_" + i, InvalidationReason.INACTIVE_TIMEOUT));
        }

        ReplicationSlotStatsResponseDto stats = statsService.getStats();

        assertThat(stats.getRecentInvalidations()).hasSize(100);
        assertThat(stats.getRecentInvalidations().get(0).getSlotName()).isEqualTo("slot_50");
        assertThat(stats.getInvalidationsByReason()).containsEntry("inactive_timeout", 150L);
    }

    @Test
    void failedPollsAreCountedSeparately() {
        when(slotCatalog.listSlots()).thenReturn(List.of());

        statsService.onSyncCompleted(SlotSyncCompletedEvent.builder().primaryReachable(true).createdCount(2).completedAt(NOW).build());
        statsService.onSyncCompleted(SlotSyncCompletedEvent.builder().primaryReachable(false).completedAt(NOW.plusSeconds(1)).build());

        ReplicationSlotStatsResponseDto stats = statsService.getStats();

        assertThat(stats.getSync().getCompletedPollsCount()).isEqualTo(1);
        assertThat(stats.getSync().getFailedPollsCount()).isEqualTo(1);
        assertThat(stats.getSync().isLastPollPrimaryReachable()).isFalse();
        assertThat(stats.getSync().getLastCreatedCount()).isZero();
        assertThat(stats.getSync().getLastPollAt()).isEqualTo(NOW.plusSeconds(1));
    }

    @Test
    void promotionTimeIsReported() {
        when(slotCatalog.listSlots()).thenReturn(List.of());

        assertThat(statsService.getStats().getPromotedAt()).isNull();

        statsService.onNodePromoted(new NodePromotedEvent(NOW));

        assertThat(statsService.getStats().getPromotedAt()).isEqualTo(NOW);
    }

    private ReplicationSlotInvalidatedEvent invalidatedEvent(String slotName, InvalidationReason reason) {
        return ReplicationSlotInvalidatedEvent
                .builder()
                .slotName(slotName)
                .reason(reason)
                .invalidatedAt(NOW)
                .inactiveSince(NOW.minusSeconds(2))
                .inactiveTimeout(Duration.ofSeconds(1))
                .build();
    }
}
