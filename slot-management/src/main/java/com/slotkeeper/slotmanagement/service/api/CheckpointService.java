package com.slotkeeper.slotmanagement.service.api;

import com.slotkeeper.slotmanagement.model.CheckpointResult;

public interface CheckpointService {

    CheckpointResult checkpoint();
}
