package com.slotkeeper.slotmanagement.exception;

public class SlotAlreadyExistsException extends SlotOperationConflictException {
    public SlotAlreadyExistsException() {
    }

    public SlotAlreadyExistsException(String message) {
        super(message);
    }

    public SlotAlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotAlreadyExistsException(Throwable cause) {
        super(cause);
    }

    public SlotAlreadyExistsException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
