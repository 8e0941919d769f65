package com.slotkeeper.slotmanagement.restclient.model;

import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.configuration.model.SlotKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteReplicationSlotDto {
    private String name;
    private SlotKind kind;
    private String plugin;
    private boolean temporary;
    private boolean synced;
    private boolean failover;
    private boolean active;
    private Instant inactiveSince;
    private InvalidationReason invalidationReason;
    private Instant invalidatedAt;
    private String restartLsn;
    private String confirmedFlushLsn;
}
