package com.slotkeeper.slotmanagement.catalog.impl;

import com.slotkeeper.slotmanagement.catalog.api.SlotCatalog;
import com.slotkeeper.slotmanagement.constant.ReplicationSlotConstants;
import com.slotkeeper.slotmanagement.exception.SlotAlreadyExistsException;
import com.slotkeeper.slotmanagement.exception.SlotNotFoundException;
import com.slotkeeper.slotmanagement.mapper.ReplicationSlotMapper;
import com.slotkeeper.slotmanagement.model.ReplicationSlot;
import com.slotkeeper.slotmanagement.model.ReplicationSlotInfo;
import com.slotkeeper.slotmanagement.model.SlotCatalogEntry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@ApplicationScoped
public class InMemorySlotCatalog implements SlotCatalog {

    @Inject
    ReplicationSlotMapper replicationSlotMapper;

    private final Map<String, SlotCatalogEntry> entries = new ConcurrentHashMap<>();

    @Override
    public SlotCatalogEntry addSlot(ReplicationSlot slot) throws SlotAlreadyExistsException {
        if (slot == null || StringUtils.isBlank(slot.getName())) {
            throw new IllegalArgumentException("Replication slot name must not be empty");
        }

        // caller keeps its reference, catalog state is changed only under entry lock
        SlotCatalogEntry newEntry = new SlotCatalogEntry(slot.toBuilder().build());
        SlotCatalogEntry existing = entries.putIfAbsent(slot.getName(), newEntry);

        if (existing != null) {
            throw new SlotAlreadyExistsException(String.format(ReplicationSlotConstants.SLOT_ALREADY_EXISTS_MESSAGE, slot.getName()));
        }

        return newEntry;
    }

    @Override
    public Optional<SlotCatalogEntry> findEntry(String slotName) {
        if (slotName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(slotName));
    }

    @Override
    public SlotCatalogEntry getEntry(String slotName) throws SlotNotFoundException {
        return findEntry(slotName)
                .orElseThrow(() -> new SlotNotFoundException(String.format(ReplicationSlotConstants.SLOT_DOES_NOT_EXIST_MESSAGE, slotName)));
    }

    @Override
    public Optional<SlotCatalogEntry> removeSlot(String slotName) {
        SlotCatalogEntry entry = entries.get(slotName);
        if (entry == null) {
            return Optional.empty();
        }

        entry.lock();
        try {
            if (entries.remove(slotName, entry)) {
                entry.markRemoved();
                return Optional.of(entry);
            }
            return Optional.empty();
        } finally {
            entry.unlock();
        }
    }

    @Override
    public List<SlotCatalogEntry> getAllEntries() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public List<ReplicationSlotInfo> listSlots() {
        List<ReplicationSlotInfo> ret = new ArrayList<>();

        for (SlotCatalogEntry entry : getAllEntries()) {
            snapshot(entry).ifPresent(ret::add);
        }

        return ret.stream()
                .sorted(Comparator.comparing(ReplicationSlotInfo::getName))
                .collect(Collectors.toList());
    }

    @Override
    public ReplicationSlotInfo getSlotInfo(String slotName) throws SlotNotFoundException {
        return snapshot(getEntry(slotName))
                .orElseThrow(() -> new SlotNotFoundException(String.format(ReplicationSlotConstants.SLOT_DOES_NOT_EXIST_MESSAGE, slotName)));
    }

    private Optional<ReplicationSlotInfo> snapshot(SlotCatalogEntry entry) {
        entry.lock();
        try {
            if (entry.isRemoved()) {
                return Optional.empty();
            }
            return Optional.of(replicationSlotMapper.toInfo(entry.getSlot()));
        } finally {
            entry.unlock();
        }
    }
}
