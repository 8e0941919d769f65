package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.exception.NodePromotionException;

public interface NodePromotionService {

    /**
     * Turns standby into primary. Synchronized slots become locally managed.
     */
    void promote() throws NodePromotionException;
}
