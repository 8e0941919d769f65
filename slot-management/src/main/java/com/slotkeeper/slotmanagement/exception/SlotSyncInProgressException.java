package com.slotkeeper.slotmanagement.exception;

public class SlotSyncInProgressException extends SlotOperationConflictException {
    public SlotSyncInProgressException() {
    }

    public SlotSyncInProgressException(String message) {
        super(message);
    }

    public SlotSyncInProgressException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotSyncInProgressException(Throwable cause) {
        super(cause);
    }

    public SlotSyncInProgressException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
