package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.NodeRole;
import com.slotkeeper.slotmanagement.exception.InvalidSlotOperationException;
import com.slotkeeper.slotmanagement.exception.SlotActiveException;
import com.slotkeeper.slotmanagement.exception.SlotInvalidatedException;
import com.slotkeeper.slotmanagement.exception.StreamingSessionNotFoundException;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.SlotAdvanceResult;
import com.slotkeeper.slotmanagement.model.SlotHandle;
import com.slotkeeper.slotmanagement.testutil.MutableClock;
import com.slotkeeper.slotmanagement.testutil.ReplicationSlotTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReplicationSlotOperationsImplTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private SlotKeeperTestNode node;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        node = new SlotKeeperTestNode(NodeRole.PRIMARY, clock);
        node.walRuntimeProperties.setCurrentLsn(0x5000000L);
    }

    @Test
    void advanceMovesPhysicalSlotAndReleasesIt() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));
        clock.advance(Duration.ofSeconds(3));

        SlotAdvanceResult result = node.operations.advance("sb1_slot", 0x4000000L);

        assertThat(result.getEndLsn()).isEqualTo(0x4000000L);
        assertThat(node.slot("sb1_slot").getRestartLsn()).isEqualTo(0x4000000L);
        assertThat(node.slot("sb1_slot").isActive()).isFalse();
        assertThat(node.slot("sb1_slot").getInactiveSince()).isEqualTo(T0.plusSeconds(3));
    }

    @Test
    void advanceIsCappedByCurrentPosition() {
        node.addSlot(ReplicationSlotTestData.inactiveLogicalFailoverSlot("lsub1_slot", T0));

        SlotAdvanceResult result = node.operations.advance("lsub1_slot", 0x9000000L);

        assertThat(result.getEndLsn()).isEqualTo(0x5000000L);
        assertThat(node.slot("lsub1_slot").getConfirmedFlushLsn()).isEqualTo(0x5000000L);
    }

    @Test
    void advanceNeverMovesBackwards() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));

        SlotAdvanceResult result = node.operations.advance("sb1_slot", 1L);

        assertThat(result.getEndLsn()).isEqualTo(0x3000028L);
    }

    @Test
    void advanceOfInvalidatedSlotFails() {
        ReplicationSlot slot = ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0);
        slot.setInvalidationReason(InvalidationReason.INACTIVE_TIMEOUT);
        node.addSlot(slot);

        assertThatThrownBy(() -> node.operations.advance("sb1_slot", 1L))
                .isInstanceOf(SlotInvalidatedException.class)
                .hasMessage("can no longer get changes from replication slot \"sb1_slot\"");
        assertThat(node.slot("sb1_slot").isActive()).isFalse();
    }

    @Test
    void invalidTargetIsRejected() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));

        assertThatThrownBy(() -> node.operations.advance("sb1_slot", 0L))
                .isInstanceOf(InvalidSlotOperationException.class)
                .hasMessage("invalid target WAL LSN");
    }

    @Test
    void slotWithoutReservedWalCanNotBeAdvanced() {
        ReplicationSlot slot = ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0);
        slot.setRestartLsn(0);
        node.addSlot(slot);

        assertThatThrownBy(() -> node.operations.advance("sb1_slot", 1L))
                .isInstanceOf(InvalidSlotOperationException.class)
                .hasMessageContaining("cannot be advanced");
        assertThat(node.slot("sb1_slot").isActive()).isFalse();
    }

    @Test
    void streamingSessionHoldsSlotUntilStopped() {
        node.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("sb1_slot", T0));

        SlotHandle handle = node.operations.startStreaming("sb1_slot");

        assertThat(node.slot("sb1_slot").isActive()).isTrue();
        assertThat(node.operations.getStreamingSessions()).containsExactly(handle);
        assertThatThrownBy(() -> node.operations.advance("sb1_slot", 0x4000000L))
                .isInstanceOf(SlotActiveException.class);

        node.operations.confirmFlush(handle.getHandleId(), 0x4500000L);
        assertThat(node.slot("sb1_slot").getRestartLsn()).isEqualTo(0x4500000L);

        clock.advance(Duration.ofSeconds(7));
        node.operations.stopStreaming(handle.getHandleId());

        assertThat(node.slot("sb1_slot").isActive()).isFalse();
        assertThat(node.slot("sb1_slot").getInactiveSince()).isEqualTo(T0.plusSeconds(7));
        assertThat(node.operations.getStreamingSessions()).isEmpty();
    }

    @Test
    void unknownSessionIsReported() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> node.operations.stopStreaming(unknown))
                .isInstanceOf(StreamingSessionNotFoundException.class);
        assertThatThrownBy(() -> node.operations.confirmFlush(unknown, 1L))
                .isInstanceOf(StreamingSessionNotFoundException.class);
    }
}
