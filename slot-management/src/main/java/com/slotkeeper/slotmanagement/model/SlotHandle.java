package com.slotkeeper.slotmanagement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotHandle {
    private UUID handleId;
    private String slotName;
    private Instant acquiredAt;
}
