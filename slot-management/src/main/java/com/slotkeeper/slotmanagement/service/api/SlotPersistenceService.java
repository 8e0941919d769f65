package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;

public interface SlotPersistenceService {

    /**
     * Loads stored slots into catalog. Must be called once on startup before slots are used.
     */
    int restoreSlots() throws SlotStorageException;

    /**
     * Immediately writes slot to storage. Temporary slots are ignored. Caller may hold entry lock.
     */
    void persistSlot(SlotCatalogEntry entry) throws SlotStorageException;

    /**
     * Writes every dirty durable slot. Slots which failed to be written stay dirty.
     *
     * @return number of written slots
     */
    int flushDirtySlots();

    void forgetSlot(String slotName) throws SlotStorageException;

    /**
     * Removes all temporary slots from catalog.
     *
     * @return number of removed slots
     */
    int dropTemporarySlots();
}
