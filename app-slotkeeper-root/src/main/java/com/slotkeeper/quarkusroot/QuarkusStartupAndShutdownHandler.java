package com.slotkeeper.quarkusroot;

import com.slotkeeper.configuration.properties.runtime.NodeRuntimeProperties;
import com.slotkeeper.quarkusroot.validator.ConfigurationValidator;
import com.slotkeeper.slotmanagement.service.api.SlotPersistenceService;
import io.quarkus.arc.All;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.interceptor.Interceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@ApplicationScoped
public class QuarkusStartupAndShutdownHandler {

    @Inject
    @All
    List<ConfigurationValidator> configurationValidators;

    @Inject
    SlotPersistenceService slotPersistenceService;

    @Inject
    NodeRuntimeProperties nodeRuntimeProperties;

    private boolean shutdownImmediately = false;

    public void startup(@Observes @Priority(Interceptor.Priority.PLATFORM_BEFORE) StartupEvent startupEvent) {
        try {
            log.info("Checking provided configuration values...");
            AtomicBoolean configurationValid = new AtomicBoolean(true);
            configurationValidators.forEach(configurationValidator -> {
                if (!configurationValidator.validate()) {
                    configurationValid.set(false);
                }
            });

            if (!configurationValid.get()) {
                log.error("CONFIGURATION INVALID. SLOTKEEPER FAILED TO START!");
                shutdownImmediately();
                return;
            }
            log.info("Provided configuration is valid!");

            log.info("SlotKeeper initialization started! Node role is {}", nodeRuntimeProperties.getRole());

            slotPersistenceService.restoreSlots();

            log.info("SlotKeeper initialization completed!");
        } catch (Throwable t) {
            log.error("Error while starting SlotKeeper up!", t);
            shutdownImmediately();
        }
    }

    public void shutdownImmediately() {
        log.error("Exceptional situation occurred and it is impossible to recover! Immediately shutting down SlotKeeper!");
        shutdownImmediately = true;
        Quarkus.asyncExit(123);
    }

    public void shutdown(@Observes @Priority(Interceptor.Priority.PLATFORM_AFTER) ShutdownEvent shutdownEvent) {
        log.info("SlotKeeper is shutting down...");

        // catalog is empty or partial if restore did not complete
        if (shutdownImmediately || !nodeRuntimeProperties.isSlotsRestored()) {
            log.info("SlotKeeper was shut down without flushing replication slots.");
            return;
        }

        int dropped = slotPersistenceService.dropTemporarySlots();
        int flushed = slotPersistenceService.flushDirtySlots();

        log.info("SlotKeeper was shut down. Dropped {} temporary and flushed {} dirty replication slots.", dropped, flushed);
    }
}
