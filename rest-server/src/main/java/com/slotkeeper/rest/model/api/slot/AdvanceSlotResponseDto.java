package com.slotkeeper.rest.model.api.slot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceSlotResponseDto {
    private String slotName;
    private String endLsn;
}
