package com.slotkeeper.slotmanagement.catalog.impl;

import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.exception.SlotAlreadyExistsException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import com.slotkeeper.slotmanagement.testutil.ReplicationSlotTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySlotCatalogTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private SlotCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = SlotCatalogTestFactory.createCatalog();
    }

    @Test
    void addedSlotCanBeFound() {
        catalog.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("standby_1", T0));

        assertThat(catalog.findEntry("standby_1")).isPresent();
        assertThat(catalog.getSlotInfo("standby_1").getInactiveSince()).isEqualTo(T0);
    }

    @Test
    void duplicateNameIsRejected() {
        catalog.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("standby_1", T0));

        assertThatThrownBy(() -> catalog.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("standby_1", T0)))
                .isInstanceOf(SlotAlreadyExistsException.class)
                .hasMessage("replication slot \"standby_1\" already exists");
    }

    @Test
    void unknownSlotIsReported() {
        assertThatThrownBy(() -> catalog.getEntry("missing"))
                .isInstanceOf(SlotNotFoundException.class)
                .hasMessage("replication slot \"missing\" does not exist");
        assertThat(catalog.findEntry(null)).isEmpty();
    }

    @Test
    void removedEntryIsMarked() {
        SlotCatalogEntry entry = catalog.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("standby_1", T0));

        assertThat(catalog.removeSlot("standby_1")).contains(entry);

        assertThat(entry.isRemoved()).isTrue();
        assertThat(catalog.findEntry("standby_1")).isEmpty();
        assertThat(catalog.removeSlot("standby_1")).isEmpty();
    }

    @Test
    void callerReferenceDoesNotChangeCatalogState() {
        ReplicationSlot slot = ReplicationSlotTestData.inactivePhysicalSlot("standby_1", T0);
        SlotCatalogEntry entry = catalog.addSlot(slot);

        slot.setActive(true);
        slot.setInactiveSince(null);

        assertThat(entry.getSlot()).isNotSameAs(slot);
        assertThat(catalog.getSlotInfo("standby_1").isActive()).isFalse();
        assertThat(catalog.getSlotInfo("standby_1").getInactiveSince()).isEqualTo(T0);
    }

    @Test
    void listingIsSortedSnapshot() {
        catalog.addSlot(ReplicationSlotTestData.inactivePhysicalSlot("b_slot", T0));
        catalog.addSlot(ReplicationSlotTestData.inactiveLogicalFailoverSlot("a_slot", T0));

        List<ReplicationSlotInfo> slots = catalog.listSlots();

        assertThat(slots).extracting(ReplicationSlotInfo::getName).containsExactly("a_slot", "b_slot");

        catalog.getEntry("a_slot").getSlot().setActive(true);
        assertThat(slots.get(0).isActive()).isFalse();
    }
}
