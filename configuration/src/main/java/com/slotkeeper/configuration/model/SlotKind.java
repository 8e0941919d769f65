package com.slotkeeper.configuration.model;

public enum SlotKind {
    PHYSICAL,
    LOGICAL
}
