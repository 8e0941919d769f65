package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.NodeRole;
import com.slotkeeper.slotmanagement.exception.SlotActiveException;
import com.slotkeeper.slotmanagement.exception.SlotInvalidatedException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.exception.SlotSyncedUsageException;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotHandle;
import com.slotkeeper.slotmanagement.testutil.MutableClock;
import com.slotkeeper.slotmanagement.testutil.ReplicationSlotTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcquisitionGateImplTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private SlotKeeperTestNode node;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        node = new SlotKeeperTestNode(NodeRole.PRIMARY, clock);
    }

    @Test
    void missingSlotIsNotFound() {
        assertThatThrownBy(() -> node.acquisitionGate.tryAcquire("nope"))
                .isInstanceOf(SlotNotFoundException.class)
                .hasMessage("replication slot \"nope\" does not exist");
    }

    @Test
    void invalidatedSlotIsRefusedAndStaysInactive() {
        ReplicationSlot slot = ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0);
        slot.setInvalidationReason(InvalidationReason.INACTIVE_TIMEOUT);
        node.addSlot(slot);

        assertThatThrownBy(() -> node.acquisitionGate.tryAcquire("sb1_slot"))
                .isInstanceOfSatisfying(SlotInvalidatedException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("can no longer get changes from replication slot \"sb1_slot\"");
                    assertThat(e.getSlotName()).isEqualTo("sb1_slot");
                    assertThat(e.getReason()).isEqualTo(InvalidationReason.INACTIVE_TIMEOUT);
                    assertThat(e.getDetail()).contains("replication_slot_inactive_timeout");
                });

        assertThat(node.slot("sb1_slot").isActive()).isFalse();
        assertThat(node.slot("sb1_slot").getInactiveSince()).isEqualTo(T0);
    }

    @Test
    void invalidationIsCheckedBeforeActivity() {
        ReplicationSlot slot = ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0);
        slot.setInvalidationReason(InvalidationReason.WAL_REMOVED);
        slot.setActive(true);
        node.addSlot(slot);

        assertThatThrownBy(() -> node.acquisitionGate.tryAcquire("sb1_slot"))
                .isInstanceOf(SlotInvalidatedException.class);
    }

    @Test
    void syncedSlotCanNotBeUsedOnStandby() {
        node.nodeRuntimeProperties.setRole(NodeRole.STANDBY);
        ReplicationSlot slot = ReplicationSlotTestData.inactiveLogicalFailoverSlot("lsub1_slot", T0);
        slot.setSynced(true);
        node.addSlot(slot);

        assertThatThrownBy(() -> node.acquisitionGate.tryAcquire("lsub1_slot"))
                .isInstanceOf(SlotSyncedUsageException.class)
                .hasMessageContaining("being synchronized from the primary server");
    }

    @Test
    void activeSlotCanNotBeAcquiredTwice() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));
        node.acquisitionGate.tryAcquire("sb1_slot");

        assertThatThrownBy(() -> node.acquisitionGate.tryAcquire("sb1_slot"))
                .isInstanceOf(SlotActiveException.class);
    }

    @Test
    void acquireAndReleaseMaintainLiveness() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));

        SlotHandle handle = node.acquisitionGate.tryAcquire("sb1_slot");
        assertThat(node.slot("sb1_slot").isActive()).isTrue();
        assertThat(node.slot("sb1_slot").getInactiveSince()).isNull();

        clock.advance(Duration.ofSeconds(5));
        assertThat(node.acquisitionGate.release(handle)).isTrue();
        assertThat(node.acquisitionGate.release(handle)).isFalse();

        assertThat(node.slot("sb1_slot").isActive()).isFalse();
        assertThat(node.slot("sb1_slot").getInactiveSince()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void withAcquiredSlotReleasesOnFailure() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));

        assertThatThrownBy(() -> node.acquisitionGate.withAcquiredSlot("sb1_slot", handle -> {
            throw new IllegalStateException("consumer failed");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(node.slot("sb1_slot").isActive()).isFalse();
    }

    @Test
    void concurrentAcquireAndInvalidationNeverLeaveActiveInvalidatedSlot() throws Exception {
        node.settings.setInactiveTimeout(Duration.ofSeconds(1));
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            for (int i = 0; i < 200; i++) {
                String name = "race_slot_" + i;
                node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot(name, T0.minusSeconds(10)));

                CountDownLatch start = new CountDownLatch(1);
                Future<SlotHandle> acquire = executor.submit(() -> {
                    start.await();
                    try {
                        return node.acquisitionGate.tryAcquire(name);
                    } catch (SlotInvalidatedException e) {
                        return null;
                    }
                });
                Future<?> pass = executor.submit(() -> {
                    start.await();
                    return node.invalidationEvaluator.runInvalidationPass();
                });

                start.countDown();
                SlotHandle handle = acquire.get(5, TimeUnit.SECONDS);
                pass.get(5, TimeUnit.SECONDS);

                ReplicationSlot slot = node.catalog.getEntry(name).getSlot();
                if (handle != null) {
                    assertThat(slot.isActive()).isTrue();
                    assertThat(slot.isInvalidated()).isFalse();
                } else {
                    assertThat(slot.isActive()).isFalse();
                    assertThat(slot.getInvalidationReason()).isEqualTo(InvalidationReason.INACTIVE_TIMEOUT);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        List<String> invalidatedActive = new ArrayList<>();
        node.catalog.listSlots().forEach(info -> {
            if (info.isActive() && info.getInvalidationReason() != null) {
                invalidatedActive.add(info.getName());
            }
        });
        assertThat(invalidatedActive).isEmpty();
    }
}
