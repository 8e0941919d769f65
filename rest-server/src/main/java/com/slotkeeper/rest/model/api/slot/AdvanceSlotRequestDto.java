package com.slotkeeper.rest.model.api.slot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target position in textual form, for example 0/3000060.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceSlotRequestDto {
    private String targetLsn;
}
