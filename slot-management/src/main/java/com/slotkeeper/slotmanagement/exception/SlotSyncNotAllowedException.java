package com.slotkeeper.slotmanagement.exception;

public class SlotSyncNotAllowedException extends SlotOperationConflictException {
    public SlotSyncNotAllowedException() {
    }

    public SlotSyncNotAllowedException(String message) {
        super(message);
    }

    public SlotSyncNotAllowedException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotSyncNotAllowedException(Throwable cause) {
        super(cause);
    }

    public SlotSyncNotAllowedException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
