package com.slotkeeper.configuration.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event which is fired when standby was promoted and became primary.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodePromotedEvent {
    private Instant promotedAt;
}
