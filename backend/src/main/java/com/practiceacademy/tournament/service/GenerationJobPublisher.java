package com.practiceacademy.tournament.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;

/**
 * Publishes generation jobs once the surrounding transaction commits, so a worker never sees a job for state that
 * rolled back.
 */
@Service
@RequiredArgsConstructor
public class GenerationJobPublisher {

    private static final Logger log = LoggerFactory.getLogger(GenerationJobPublisher.class);

    private final GenerationJobQueue generationJobQueue;

    public void publish(GenerationJobMessage message) {
        GenerationJobMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishImmediately(requiredMessage);
                }
            });
            return;
        }
        publishImmediately(requiredMessage);
    }

    private void publishImmediately(GenerationJobMessage message) {
        if (!generationJobQueue.enqueue(message)) {
            log.info("{} generation for tournament {} is already queued", message.stage(), message.tournamentId());
            return;
        }
        log.info(
                "Queued {} generation for tournament {} (attempt {})",
                message.stage(),
                message.tournamentId(),
                message.attempt()
        );
    }
}
