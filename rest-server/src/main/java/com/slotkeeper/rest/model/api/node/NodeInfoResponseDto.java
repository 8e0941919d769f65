package com.slotkeeper.rest.model.api.node;

import com.slotkeeper.configuration.model.NodeRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeInfoResponseDto {
    private NodeRole role;
    private boolean slotsRestored;
    private Instant lastSuccessfulSync;
}
