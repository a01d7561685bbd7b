package com.practiceacademy.tournament.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Process-local generation queue. Also serves as the fallback when the Redis queue is unreachable.
 * <p>
 * A tournament stage has at most one waiting job; its key is released when the job is taken, so a request made while
 * the job runs is queued again and settled by the generation guard.
 */
@Service
public class InMemoryGenerationJobQueue implements GenerationJobQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGenerationJobQueue.class);

    private final BlockingQueue<GenerationJobMessage> jobs = new LinkedBlockingQueue<>();
    private final Set<String> pendingKeys = ConcurrentHashMap.newKeySet();
    private final CountDownLatch consumerRegistered = new CountDownLatch(1);
    private final ExecutorService dispatcher;

    private volatile GenerationJobQueueConsumer consumer;
    private volatile boolean accepting = true;

    public InMemoryGenerationJobQueue() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tournament-generation-local-");
        threadFactory.setDaemon(true);
        this.dispatcher = Executors.newSingleThreadExecutor(threadFactory);
    }

    @PostConstruct
    void start() {
        dispatcher.execute(this::drain);
    }

    @PreDestroy
    void stop() {
        accepting = false;
        dispatcher.shutdownNow();
    }

    @Override
    public boolean enqueue(GenerationJobMessage message) {
        Objects.requireNonNull(message, "message is required");
        if (!accepting) {
            throw new IllegalStateException("Generation queue is shut down");
        }
        if (!pendingKeys.add(message.pendingKey())) {
            log.debug("Generation job for {} already waiting; attempt {} folded into it", message.pendingKey(), message.attempt());
            return false;
        }
        jobs.add(message);
        return true;
    }

    @Override
    public void setConsumer(GenerationJobQueueConsumer consumer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer is required");
        consumerRegistered.countDown();
    }

    @Override
    public String mode() {
        return "in_memory";
    }

    int pendingCount() {
        return jobs.size();
    }

    boolean isPending(GenerationJobMessage message) {
        return pendingKeys.contains(message.pendingKey());
    }

    private void drain() {
        try {
            consumerRegistered.await();
            while (!Thread.currentThread().isInterrupted()) {
                GenerationJobMessage job = jobs.take();
                pendingKeys.remove(job.pendingKey());
                deliver(job);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("In-memory generation dispatcher stopped with {} jobs waiting", jobs.size());
        }
    }

    private void deliver(GenerationJobMessage job) {
        try {
            consumer.accept(job);
        } catch (RuntimeException ex) {
            log.error("Dispatching generation job for tournament {} stage {} failed", job.tournamentId(), job.stage(), ex);
        }
    }
}
