package com.slotkeeper.slotmanagement.exception;

public class SlotActiveException extends SlotOperationConflictException {
    public SlotActiveException() {
    }

    public SlotActiveException(String message) {
        super(message);
    }

    public SlotActiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotActiveException(Throwable cause) {
        super(cause);
    }

    public SlotActiveException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
