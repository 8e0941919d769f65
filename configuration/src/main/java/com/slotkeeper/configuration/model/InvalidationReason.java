package com.slotkeeper.configuration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Cause of replication slot invalidation. Once slot got a reason it keeps it until slot is dropped.
 */
@RequiredArgsConstructor
public enum InvalidationReason {
    /**
     * Required WAL has been removed.
     */
    WAL_REMOVED("wal_removed", "This slot has been invalidated because the required WAL has been removed."),
    /**
     * wal_level on primary is not sufficient for the slot.
     */
    WAL_LEVEL_INSUFFICIENT("wal_level_insufficient", "This slot has been invalidated because wal_level is insufficient for the slot."),
    ROTATION("rotation", "This slot has been invalidated because it was rotated out."),
    /**
     * Slot was inactive for longer than replication_slot_inactive_timeout.
     */
    INACTIVE_TIMEOUT("inactive_timeout", "This slot has been invalidated because it was inactive for longer than the amount of time specified by \"replication_slot_inactive_timeout\".");

    @Getter
    @JsonValue
    private final String token;

    @Getter
    private final String description;

    @JsonCreator
    public static InvalidationReason fromToken(String token) {
        if (token == null) {
            return null;
        }

        return Arrays.stream(values())
                .filter(v -> v.token.equals(token))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown invalidation reason '" + token + "'"));
    }
}
