package com.slotkeeper.slotmanagement.service.impl;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.slotmanagement.model.CheckpointResult;
import com.slotkeeper.slotmanagement.model.InvalidationPassResult;
import com.slotkeeper.slotmanagement.service.api.CheckpointService;
import com.slotkeeper.slotmanagement.service.api.InvalidationEvaluator;
import com.slotkeeper.slotmanagement.service.api.SlotPersistenceService;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.common.annotation.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@ApplicationScoped
public class CheckpointServiceImpl implements CheckpointService {

    @Inject
    InvalidationEvaluator invalidationEvaluator;

    @Inject
    SlotPersistenceService slotPersistenceService;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    @Override
    public CheckpointResult checkpoint() {
        InvalidationPassResult passResult = invalidationEvaluator.runInvalidationPass();
        int flushed = slotPersistenceService.flushDirtySlots();

        log.debug("Checkpoint complete: {} slots checked, {} invalidated, {} flushed",
                passResult.getCheckedSlotsCount(),
                passResult.getInvalidatedSlotNames().size(),
                flushed
        );

        return CheckpointResult
                .builder()
                .invalidationPassResult(passResult)
                .flushedSlotsCount(flushed)
                .build();
    }

    @Blocking
    @Scheduled(every = "${slot-keeper.replication-slots.checkpoint-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void scheduledCheckpoint() {
        if (!nodeRuntimeProperties.isSlotsRestored()) {
            return;
        }

        try {
            checkpoint();
        } catch (Exception e) {
            log.error("Scheduled checkpoint failed!", e);
        }
    }
}
