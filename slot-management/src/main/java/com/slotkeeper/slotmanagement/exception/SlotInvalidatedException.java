package com.slotkeeper.slotmanagement.exception;

import com.slotkeeper.configuration.model.InvalidationReason;
import com.slotkeeper.slotmanagement.constant.ReplicationSlotConstants;
import lombok.Getter;

/**
 * Slot was invalidated and can never be used again. The only remedy is to drop and recreate it.
 */
@Getter
public class SlotInvalidatedException extends RuntimeException {
    private final String slotName;
    private final InvalidationReason reason;

    public SlotInvalidatedException(String slotName, InvalidationReason reason) {
        super(String.format(ReplicationSlotConstants.SLOT_INVALIDATED_MESSAGE, slotName));
        this.slotName = slotName;
        this.reason = reason;
    }

    public String getDetail() {
        return reason == null ? null : reason.getDescription();
    }
}
