package com.slotkeeper.slotmanagement.exception;

public class SyncTransportException extends Exception {
    public SyncTransportException() {
    }

    public SyncTransportException(String message) {
        super(message);
    }

    public SyncTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public SyncTransportException(Throwable cause) {
        super(cause);
    }

    public SyncTransportException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
