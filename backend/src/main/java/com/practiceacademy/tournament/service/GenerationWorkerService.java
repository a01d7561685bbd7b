package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.config.TournamentEngineProperties;
import com.practiceacademy.tournament.web.TournamentEngineException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Background executor for queued generation jobs. Every attempt, retries included, goes back through
 * {@link SessionGenerationGuard}.
 */
@Service
@RequiredArgsConstructor
public class GenerationWorkerService {

    private static final Logger log = LoggerFactory.getLogger(GenerationWorkerService.class);

    private final GenerationJobQueue generationJobQueue;
    private final SessionGenerationGuard sessionGenerationGuard;
    private final TournamentEngineProperties properties;
    private final ThreadPoolTaskExecutor generationWorkerExecutor;

    @PostConstruct
    void registerQueueConsumer() {
        generationJobQueue.setConsumer(this::dispatch);
    }

    void dispatch(GenerationJobMessage message) {
        generationWorkerExecutor.execute(() -> process(message));
    }

    void process(GenerationJobMessage message) {
        try {
            GenerationResult result = sessionGenerationGuard.ensureGeneratedOnce(message.tournamentId());
            if (result.outcome() == GenerationResult.Outcome.ALREADY_GENERATED) {
                log.info(
                        "Generation job for tournament {} stage {} found sessions already generated (attempt {})",
                        message.tournamentId(),
                        message.stage(),
                        message.attempt()
                );
            }
        } catch (TransientDataAccessException ex) {
            retryOrGiveUp(message, ex);
        } catch (TournamentEngineException ex) {
            log.warn(
                    "Generation job for tournament {} stage {} rejected on attempt {}: {}",
                    message.tournamentId(),
                    message.stage(),
                    message.attempt(),
                    ex.getMessage()
            );
        } catch (RuntimeException ex) {
            log.error(
                    "Generation job for tournament {} stage {} failed on attempt {}",
                    message.tournamentId(),
                    message.stage(),
                    message.attempt(),
                    ex
            );
        }
    }

    private void retryOrGiveUp(GenerationJobMessage message, TransientDataAccessException failure) {
        int maxRetries = Math.max(0, properties.getGeneration().getMaxRetries());
        int retriesUsed = message.attempt() - 1;
        if (retriesUsed >= maxRetries) {
            log.error(
                    "Generation retries exhausted for tournament {} stage {} after {} attempts",
                    message.tournamentId(),
                    message.stage(),
                    message.attempt(),
                    failure
            );
            return;
        }

        long backoffMs = Math.max(0L, properties.getGeneration().getRetryBackoffMs()) * message.attempt();
        log.warn(
                "Transient storage failure generating tournament {} stage {} on attempt {}; retrying in {} ms: {}",
                message.tournamentId(),
                message.stage(),
                message.attempt(),
                backoffMs,
                failure.getMessage()
        );
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Generation retry for tournament {} interrupted; re-queueing without backoff", message.tournamentId());
        }
        if (!generationJobQueue.enqueue(message.nextAttempt())) {
            log.info("Retry for tournament {} stage {} folded into a job that is already queued",
                    message.tournamentId(), message.stage());
        }
    }
}
