package com.slotkeeper.slotmanagement.exception;

public class SlotStorageException extends RuntimeException {
    public SlotStorageException() {
    }

    public SlotStorageException(String message) {
        super(message);
    }

    public SlotStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotStorageException(Throwable cause) {
        super(cause);
    }

    public SlotStorageException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
