package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.event.SlotSyncCompletedEvent;
import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.NodeRole;
import com.slotkeeper.slotmanagement.exception.SlotSyncInProgressException;
import com.slotkeeper.slotmanagement.exception.SlotSyncedUsageException;
import com.slotkeeper.slotmanagement.exception.SlotSyncNotAllowedException;
import com.slotkeeper.slotmanagement.exception.SyncTransportException;
import com.slotkeeper.slotmanagement.model.RemoteSlotState;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotSyncResult;
import com.slotkeeper.slotmanagement.testutil.MutableClock;
import com.slotkeeper.slotmanagement.testutil.ReplicationSlotTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SlotSyncAgentImplTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final long REMOTE_RESTART_LSN = 0x3000028L;

    private final List<RemoteSlotState> remoteSlots = new CopyOnWriteArrayList<>();
    private volatile boolean primaryDown = false;

    private MutableClock clock;
    private SlotKeeperTestNode standby;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        standby = new SlotKeeperTestNode(NodeRole.STANDBY, clock, () -> {
            if (primaryDown) {
                throw new SyncTransportException("Connection refused");
            }
            return List.copyOf(remoteSlots);
        });
        standby.walRuntimeProperties.setCurrentLsn(0x5000000L);
    }

    @Test
    void newRemoteSlotIsMirrored() {
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0.minusSeconds(5), REMOTE_RESTART_LSN));

        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        assertThat(result.isPrimaryReachable()).isTrue();
        assertThat(result.getCreatedSlotNames()).containsExactly("lsub1_slot");

        ReplicationSlotInfo mirror = standby.slot("lsub1_slot");
        assertThat(mirror.isSynced()).isTrue();
        assertThat(mirror.isTemporary()).isFalse();
        assertThat(mirror.isFailover()).isTrue();
        assertThat(mirror.isActive()).isFalse();
        assertThat(mirror.getInactiveSince()).isEqualTo(T0.minusSeconds(5));
        assertThat(standby.storage.contains("lsub1_slot")).isTrue();
        assertThat(standby.syncCompletedEvents).hasSize(1);
    }

    @Test
    void mirrorOfHeldPrimarySlotKeepsActivityConsistent() {
        RemoteSlotState remote = ReplicationSlotTestData.remoteFailoverSlot("held_slot", null, REMOTE_RESTART_LSN);
        remoteSlots.add(remote);

        standby.slotSyncAgent.syncSlots();

        ReplicationSlotInfo mirror = standby.slot("held_slot");
        assertThat(mirror.isActive()).isTrue();
        assertThat(mirror.getInactiveSince() != null).isEqualTo(!mirror.isActive());

        remote.setActive(false);
        remote.setInactiveSince(T0.plusSeconds(1));
        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        mirror = standby.slot("held_slot");
        assertThat(result.getUpdatedSlotNames()).containsExactly("held_slot");
        assertThat(mirror.isActive()).isFalse();
        assertThat(mirror.getInactiveSince()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    void heldMirrorCanNotBeAcquiredOnStandby() {
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("held_slot", null, REMOTE_RESTART_LSN));
        standby.slotSyncAgent.syncSlots();

        assertThatThrownBy(() -> standby.acquisitionGate.tryAcquire("held_slot"))
                .isInstanceOf(SlotSyncedUsageException.class);
    }

    @Test
    void mirrorStaysTemporaryUntilStandbyCatchesUp() {
        standby.walRuntimeProperties.setCurrentLsn(0x1000000L);
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN));

        standby.slotSyncAgent.syncSlots();

        assertThat(standby.slot("lsub1_slot").isTemporary()).isTrue();
        assertThat(standby.storage.contains("lsub1_slot")).isFalse();

        standby.walRuntimeProperties.setCurrentLsn(REMOTE_RESTART_LSN);
        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        assertThat(result.getUpdatedSlotNames()).containsExactly("lsub1_slot");
        assertThat(standby.slot("lsub1_slot").isTemporary()).isFalse();
        assertThat(standby.storage.contains("lsub1_slot")).isTrue();
    }

    @Test
    void invalidationOfPrimarySlotReachesMirrorInOnePoll() {
        RemoteSlotState remote = ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN);
        remoteSlots.add(remote);
        standby.slotSyncAgent.syncSlots();

        remote.setInvalidationReason(InvalidationReason.INACTIVE_TIMEOUT);
        remote.setInvalidatedAt(T0.plusSeconds(2));
        standby.slotSyncAgent.syncSlots();

        ReplicationSlotInfo mirror = standby.slot("lsub1_slot");
        assertThat(mirror.getInvalidationReason()).isEqualTo(InvalidationReason.INACTIVE_TIMEOUT);
        assertThat(mirror.getInvalidatedAt()).isEqualTo(T0.plusSeconds(2));
        assertThat(standby.storage.get("lsub1_slot").getInvalidationReason()).isEqualTo(InvalidationReason.INACTIVE_TIMEOUT);
    }

    @Test
    void alreadyInvalidatedPrimarySlotCreatesInvalidatedMirror() {
        standby.walRuntimeProperties.setCurrentLsn(0x1000000L);
        RemoteSlotState remote = ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN);
        remote.setInvalidationReason(InvalidationReason.INACTIVE_TIMEOUT);
        remoteSlots.add(remote);

        standby.slotSyncAgent.syncSlots();

        ReplicationSlotInfo mirror = standby.slot("lsub1_slot");
        assertThat(mirror.getInvalidationReason()).isEqualTo(InvalidationReason.INACTIVE_TIMEOUT);
        assertThat(mirror.isTemporary()).isFalse();
        assertThat(mirror.isSynced()).isTrue();
    }

    @Test
    void mirrorIsNeverInvalidatedByStandbyTimeout() {
        standby.settings.setInactiveTimeout(Duration.ofSeconds(1));
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN));
        standby.slotSyncAgent.syncSlots();

        clock.advance(Duration.ofHours(1));
        standby.checkpointService.checkpoint();

        assertThat(standby.slot("lsub1_slot").getInvalidationReason()).isNull();
        assertThat(standby.invalidatedEvents).isEmpty();
    }

    @Test
    void positionsOnlyMoveForward() {
        RemoteSlotState remote = ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN);
        remoteSlots.add(remote);
        standby.slotSyncAgent.syncSlots();

        remote.setRestartLsn(0x4000000L);
        standby.slotSyncAgent.syncSlots();
        assertThat(standby.slot("lsub1_slot").getRestartLsn()).isEqualTo(0x4000000L);

        remote.setRestartLsn(0x2000000L);
        standby.slotSyncAgent.syncSlots();
        assertThat(standby.slot("lsub1_slot").getRestartLsn()).isEqualTo(0x4000000L);
    }

    @Test
    void localSlotWithSameNameIsNotOverwritten() {
        standby.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("lsub1_slot", T0));
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0.minusSeconds(100), REMOTE_RESTART_LSN));

        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        assertThat(result.getSkippedSlotNames()).containsExactly("lsub1_slot");
        assertThat(standby.slot("lsub1_slot").isSynced()).isFalse();
        assertThat(standby.slot("lsub1_slot").getInactiveSince()).isEqualTo(T0);
    }

    @Test
    void mirrorOfDroppedPrimarySlotIsRemoved() {
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN));
        standby.slotSyncAgent.syncSlots();

        remoteSlots.clear();
        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        assertThat(result.getDroppedSlotNames()).containsExactly("lsub1_slot");
        assertThat(standby.catalog.findEntry("lsub1_slot")).isEmpty();
        assertThat(standby.storage.contains("lsub1_slot")).isFalse();
    }

    @Test
    void recreatedPrimarySlotReplacesInvalidatedMirror() {
        RemoteSlotState remote = ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN);
        remote.setInvalidationReason(InvalidationReason.INACTIVE_TIMEOUT);
        remoteSlots.add(remote);
        standby.slotSyncAgent.syncSlots();

        remoteSlots.clear();
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0.plusSeconds(60), 0x4000000L));
        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        assertThat(result.getCreatedSlotNames()).containsExactly("lsub1_slot");
        assertThat(standby.slot("lsub1_slot").getInvalidationReason()).isNull();
        assertThat(standby.slot("lsub1_slot").getRestartLsn()).isEqualTo(0x4000000L);
    }

    @Test
    void unreachablePrimarySkipsPollWithoutFailing() {
        remoteSlots.add(ReplicationSlotTestData.remoteFailoverSlot("lsub1_slot", T0, REMOTE_RESTART_LSN));
        standby.slotSyncAgent.syncSlots();
        primaryDown = true;

        SlotSyncResult result = standby.slotSyncAgent.syncSlots();

        assertThat(result.isPrimaryReachable()).isFalse();
        assertThat(standby.catalog.findEntry("lsub1_slot")).isPresent();
        assertThat(standby.syncCompletedEvents).extracting(SlotSyncCompletedEvent::isPrimaryReachable).containsExactly(true, false);
        assertThat(standby.slotSyncAgent.getLastSuccessfulSync()).isEqualTo(T0);
    }

    @Test
    void scheduledPollSwallowsTransportFailure() {
        primaryDown = true;

        standby.slotSyncAgent.pollPrimary();

        assertThat(standby.syncCompletedEvents).hasSize(1);
        assertThat(standby.syncCompletedEvents.get(0).isPrimaryReachable()).isFalse();
    }

    @Test
    void scheduledPollDoesNothingOnPrimary() {
        standby.nodeRuntimeProperties.setRole(NodeRole.PRIMARY);

        standby.slotSyncAgent.pollPrimary();

        assertThat(standby.syncCompletedEvents).isEmpty();
    }

    @Test
    void manualSyncOnPrimaryIsRejected() {
        standby.nodeRuntimeProperties.setRole(NodeRole.PRIMARY);

        assertThatThrownBy(() -> standby.slotSyncAgent.syncSlots())
                .isInstanceOf(SlotSyncNotAllowedException.class)
                .hasMessage("replication slots can only be synchronized to a standby server");
    }

    @Test
    void concurrentManualSyncIsRejected() {
        CountDownLatch resume = new CountDownLatch(1);
        AtomicBoolean paused = new AtomicBoolean(false);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            executor.submit(() -> standby.slotSyncAgent.runWithSyncPaused(() -> {
                paused.set(true);
                try {
                    resume.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            await().atMost(Duration.ofSeconds(5)).untilTrue(paused);

            assertThatThrownBy(() -> standby.slotSyncAgent.syncSlots())
                    .isInstanceOf(SlotSyncInProgressException.class);

            resume.countDown();

            await()
                    .atMost(Duration.ofSeconds(5))
                    .ignoreException(SlotSyncInProgressException.class)
                    .untilAsserted(() -> assertThat(standby.slotSyncAgent.syncSlots().isPrimaryReachable()).isTrue());
        } finally {
            resume.countDown();
            executor.shutdown();
        }
    }
}
