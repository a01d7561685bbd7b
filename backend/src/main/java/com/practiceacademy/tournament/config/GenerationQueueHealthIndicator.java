package com.practiceacademy.tournament.config;

import com.practiceacademy.tournament.service.GenerationJobQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class GenerationQueueHealthIndicator implements HealthIndicator {

    private final GenerationJobQueue generationJobQueue;

    public GenerationQueueHealthIndicator(GenerationJobQueue generationJobQueue) {
        this.generationJobQueue = generationJobQueue;
    }

    @Override
    public Health health() {
        boolean degraded = generationJobQueue.degraded();
        Health.Builder builder = degraded ? Health.status("DEGRADED") : Health.up();
        return builder
                .withDetail("queueMode", generationJobQueue.mode())
                .withDetail("fallbackActive", degraded)
                .build();
    }
}
