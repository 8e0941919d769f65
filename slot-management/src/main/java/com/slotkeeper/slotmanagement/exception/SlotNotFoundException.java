package com.slotkeeper.slotmanagement.exception;

public class SlotNotFoundException extends RuntimeException {
    public SlotNotFoundException() {
    }

    public SlotNotFoundException(String message) {
        super(message);
    }

    public SlotNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotNotFoundException(Throwable cause) {
        super(cause);
    }

    public SlotNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
