package com.slotkeeper.slotmanagement.exception;

/**
 * Operation can not be executed in current state of slot or node. Retrying the same operation later may succeed.
 */
public abstract class SlotOperationConflictException extends RuntimeException {
    public SlotOperationConflictException() {
    }

    public SlotOperationConflictException(String message) {
        super(message);
    }

    public SlotOperationConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotOperationConflictException(Throwable cause) {
        super(cause);
    }

    public SlotOperationConflictException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
