package com.slotkeeper.slotmanagement.exception;

public class NodePromotionException extends SlotOperationConflictException {
    public NodePromotionException() {
    }

    public NodePromotionException(String message) {
        super(message);
    }

    public NodePromotionException(String message, Throwable cause) {
        super(message, cause);
    }

    public NodePromotionException(Throwable cause) {
        super(cause);
    }

    public NodePromotionException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
