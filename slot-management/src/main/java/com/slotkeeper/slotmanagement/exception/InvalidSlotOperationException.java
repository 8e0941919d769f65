package com.slotkeeper.slotmanagement.exception;

public class InvalidSlotOperationException extends RuntimeException {
    public InvalidSlotOperationException() {
    }

    public InvalidSlotOperationException(String message) {
        super(message);
    }

    public InvalidSlotOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidSlotOperationException(Throwable cause) {
        super(cause);
    }

    public InvalidSlotOperationException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
