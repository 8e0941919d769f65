package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.model.InvalidationPassResult;

public interface InvalidationEvaluator {

    /**
     * Checks every locally authoritative inactive slot and invalidates the ones that exceeded limits.
     * Concurrent calls are executed one after another.
     */
    InvalidationPassResult runInvalidationPass();
}
