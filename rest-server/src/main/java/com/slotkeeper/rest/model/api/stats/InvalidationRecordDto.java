package com.slotkeeper.rest.model.api.stats;

import com.slotkeeper.configuration.model.InvalidationReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationRecordDto {
    private String slotName;
    private InvalidationReason reason;
    private Instant invalidatedAt;
    private Instant inactiveSince;
    private String inactiveTimeout;
}
