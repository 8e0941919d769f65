package com.slotkeeper.slotmanagement.exception;

public class SlotSyncedUsageException extends SlotOperationConflictException {
    public SlotSyncedUsageException() {
    }

    public SlotSyncedUsageException(String message) {
        super(message);
    }

    public SlotSyncedUsageException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotSyncedUsageException(Throwable cause) {
        super(cause);
    }

    public SlotSyncedUsageException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
