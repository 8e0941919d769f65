package com.slotkeeper.configuration.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
