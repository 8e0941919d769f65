package com.slotkeeper.slotmanagement.storage.api;

import com.slotkeeper.slotmanagement.exception.SlotStorageException;
import com.slotkeeper.slotmanagement.model.PersistedReplicationSlot;

import java.util.List;

/**
 * Durable storage of non-temporary replication slots. Survives restarts of node.
 */
public interface SlotStorage {

    List<PersistedReplicationSlot> loadSlots() throws SlotStorageException;

    /**
     * Creates or replaces stored state of slot. Data must be durable when method returns.
     */
    void saveSlot(PersistedReplicationSlot slot) throws SlotStorageException;

    /**
     * @return true if slot was stored and was deleted
     */
    boolean deleteSlot(String slotName) throws SlotStorageException;
}
