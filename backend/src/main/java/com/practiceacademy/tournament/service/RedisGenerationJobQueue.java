package com.practiceacademy.tournament.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.practiceacademy.tournament.config.TournamentEngineProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Generation queue on a Redis list, shared by every engine instance.
 * <p>
 * Next to the list, a {@code SET NX} marker per tournament stage keeps a second job for the same stage from being
 * pushed while one is waiting. The poller deletes the marker as it pops the job. While Redis is unreachable, jobs go
 * to the in-memory queue and Redis is tried again after a backoff.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "tournament.worker",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisGenerationJobQueue implements GenerationJobQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisGenerationJobQueue.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().findAndAddModules().build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);
    private static final long BACKOFF_IDLE_MILLIS = 200L;

    private final StringRedisTemplate stringRedisTemplate;
    private final TournamentEngineProperties properties;
    private final InMemoryGenerationJobQueue fallbackQueue;
    private final CountDownLatch consumerRegistered = new CountDownLatch(1);
    private final ExecutorService poller;

    private volatile GenerationJobQueueConsumer consumer;
    private volatile boolean accepting = true;
    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    public RedisGenerationJobQueue(
            StringRedisTemplate stringRedisTemplate,
            TournamentEngineProperties properties,
            InMemoryGenerationJobQueue fallbackQueue
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.properties = properties;
        this.fallbackQueue = fallbackQueue;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tournament-generation-redis-");
        threadFactory.setDaemon(true);
        this.poller = Executors.newSingleThreadExecutor(threadFactory);
    }

    @PostConstruct
    void start() {
        poller.execute(this::pollLoop);
    }

    @PreDestroy
    void stop() {
        accepting = false;
        poller.shutdownNow();
    }

    @Override
    public boolean enqueue(GenerationJobMessage message) {
        Objects.requireNonNull(message, "message is required");
        if (!accepting) {
            throw new IllegalStateException("Generation queue is shut down");
        }
        String queueKey = queueKey();
        if (backingOff()) {
            return fallbackQueue.enqueue(message);
        }
        String payload = serialize(message);
        String marker = markerKey(queueKey, message);
        try {
            Boolean claimed = stringRedisTemplate.opsForValue()
                    .setIfAbsent(marker, Integer.toString(message.attempt()), markerTtl());
            if (!Boolean.TRUE.equals(claimed)) {
                markRedisHealthy();
                log.debug("Generation job for {} already waiting in Redis; attempt {} folded into it",
                        message.pendingKey(), message.attempt());
                return false;
            }
            if (stringRedisTemplate.opsForList().rightPush(queueKey, payload) != null) {
                markRedisHealthy();
                return true;
            }
            log.warn("Redis push returned no list length for {}, routing job to in-memory queue", message.pendingKey());
            markRedisFailure(null);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
        releaseMarker(marker);
        return fallbackQueue.enqueue(message);
    }

    @Override
    public void setConsumer(GenerationJobQueueConsumer consumer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer is required");
        fallbackQueue.setConsumer(consumer);
        consumerRegistered.countDown();
    }

    @Override
    public String mode() {
        return "redis";
    }

    @Override
    public boolean degraded() {
        return fallbackMode;
    }

    /**
     * Pops and delivers at most one job. Returns true when a payload was taken off the list.
     */
    boolean pollOnce() throws InterruptedException {
        if (backingOff()) {
            TimeUnit.MILLISECONDS.sleep(BACKOFF_IDLE_MILLIS);
            return false;
        }
        String queueKey = queueKey();
        String payload = stringRedisTemplate.opsForList().leftPop(queueKey, popTimeoutSeconds(), TimeUnit.SECONDS);
        markRedisHealthy();
        if (payload == null) {
            return false;
        }
        GenerationJobMessage job = deserialize(payload);
        if (job == null) {
            return true;
        }
        stringRedisTemplate.delete(markerKey(queueKey, job));
        deliver(job);
        return true;
    }

    private void pollLoop() {
        try {
            consumerRegistered.await();
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    pollOnce();
                } catch (InterruptedException ex) {
                    throw ex;
                } catch (RuntimeException ex) {
                    markRedisFailure(ex);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("Redis generation poller stopped");
        }
    }

    private void deliver(GenerationJobMessage job) {
        try {
            consumer.accept(job);
        } catch (RuntimeException ex) {
            log.error("Dispatching generation job for tournament {} stage {} failed", job.tournamentId(), job.stage(), ex);
        }
    }

    private void releaseMarker(String marker) {
        try {
            stringRedisTemplate.delete(marker);
        } catch (RuntimeException ex) {
            // the marker expires on its own
            log.debug("Could not release generation marker {}: {}", marker, safeMessage(ex));
        }
    }

    static String markerKey(String queueKey, GenerationJobMessage message) {
        return queueKey + ":pending:" + message.pendingKey();
    }

    private String queueKey() {
        String queueKey = properties.getWorker().getRedisQueueKey();
        if (queueKey == null || queueKey.isBlank()) {
            throw new IllegalStateException("tournament.worker.redis-queue-key must not be blank");
        }
        return queueKey.trim();
    }

    private long popTimeoutSeconds() {
        long timeoutSeconds = properties.getWorker().getRedisPopTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("tournament.worker.redis-pop-timeout-seconds must be greater than zero");
        }
        return timeoutSeconds;
    }

    private Duration markerTtl() {
        long ttlSeconds = properties.getWorker().getPendingMarkerTtlSeconds();
        if (ttlSeconds <= 0) {
            throw new IllegalStateException("tournament.worker.pending-marker-ttl-seconds must be greater than zero");
        }
        return Duration.ofSeconds(ttlSeconds);
    }

    private static String serialize(GenerationJobMessage message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize generation job payload", ex);
        }
    }

    private static GenerationJobMessage deserialize(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, GenerationJobMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.error("Dropping unreadable generation job payload {}", payload, ex);
            return null;
        }
    }

    private boolean backingOff() {
        return fallbackMode && System.nanoTime() - redisRetryNotBeforeNanos < 0;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            log.warn("Redis generation queue is unavailable ({}); routing jobs to the in-memory queue",
                    ex == null ? "no reply" : safeMessage(ex));
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis generation queue restored");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private static String safeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
