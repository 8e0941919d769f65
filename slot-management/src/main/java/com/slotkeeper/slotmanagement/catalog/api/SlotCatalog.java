package com.slotkeeper.slotmanagement.catalog.api;

import com.slotkeeper.slotmanagement.exception.SlotAlreadyExistsException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Registry of replication slots known to this node. Each slot is wrapped in an entry that owns the slot lock.
 */
public interface SlotCatalog {

    /**
     * Registers new slot. Catalog takes ownership of passed object.
     *
     * @param slot slot to register
     * @return created entry
     * @throws SlotAlreadyExistsException if slot with same name is already registered
     */
    SlotCatalogEntry addSlot(ReplicationSlot slot) throws SlotAlreadyExistsException;

    Optional<SlotCatalogEntry> findEntry(String slotName);

    SlotCatalogEntry getEntry(String slotName) throws SlotNotFoundException;

    /**
     * Removes slot from catalog. Entry is marked as removed while holding its lock.
     *
     * @param slotName name of slot to remove
     * @return removed entry or empty optional if there was no such slot
     */
    Optional<SlotCatalogEntry> removeSlot(String slotName);

    List<SlotCatalogEntry> getAllEntries();

    List<ReplicationSlotInfo> listSlots();

    ReplicationSlotInfo getSlotInfo(String slotName) throws SlotNotFoundException;
}
