package com.slotkeeper.configuration.exception;

public class UnknownSettingException extends RuntimeException {
    public UnknownSettingException() {
    }

    public UnknownSettingException(String message) {
        super(message);
    }

    public UnknownSettingException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnknownSettingException(Throwable cause) {
        super(cause);
    }

    public UnknownSettingException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
