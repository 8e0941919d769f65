package com.slotkeeper.configuration.exception;

public class InvalidSettingValueException extends RuntimeException {
    public InvalidSettingValueException() {
    }

    public InvalidSettingValueException(String message) {
        super(message);
    }

    public InvalidSettingValueException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidSettingValueException(Throwable cause) {
        super(cause);
    }

    public InvalidSettingValueException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
