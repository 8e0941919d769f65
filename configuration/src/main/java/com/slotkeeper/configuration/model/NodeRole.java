package com.slotkeeper.configuration.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum NodeRole {
    PRIMARY("Primary"),
    STANDBY("Standby");

    @Getter
    private final String mdcValue;
}
