package com.slotkeeper.slotmanagement.model;

import lombok.Getter;

import java.util.concurrent.locks.ReentrantLock;

@Getter
public class SlotCatalogEntry {
    private final String slotName;
    private final ReplicationSlot slot;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean removed = false;

    public SlotCatalogEntry(ReplicationSlot slot) {
        this.slotName = slot.getName();
        this.slot = slot;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * Called by catalog while holding entry lock. Threads that looked up entry before removal must re-check this flag after locking.
     */
    public void markRemoved() {
        removed = true;
    }
}
