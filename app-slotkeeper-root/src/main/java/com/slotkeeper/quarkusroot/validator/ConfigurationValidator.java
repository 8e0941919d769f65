package com.slotkeeper.quarkusroot.validator;

public interface ConfigurationValidator {
    /**
     * Validates part of configuration. Every problem found must be logged.
     *
     * @return true if configuration is valid
     */
    boolean validate();
}
