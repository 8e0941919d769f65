package com.slotkeeper.slotmanagement.exception;

public class StreamingSessionNotFoundException extends RuntimeException {
    public StreamingSessionNotFoundException() {
    }

    public StreamingSessionNotFoundException(String message) {
        super(message);
    }

    public StreamingSessionNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamingSessionNotFoundException(Throwable cause) {
        super(cause);
    }

    public StreamingSessionNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
