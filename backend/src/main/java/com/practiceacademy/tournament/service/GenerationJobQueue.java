package com.practiceacademy.tournament.service;

/**
 * Hand-off between whoever asks for match generation and the background worker. At most one job per
 * {@link GenerationJobMessage#pendingKey()} waits in a queue at a time.
 */
public interface GenerationJobQueue {

    /**
     * @return false when an equivalent job was already waiting and this one was folded into it
     */
    boolean enqueue(GenerationJobMessage message);

    void setConsumer(GenerationJobQueueConsumer consumer);

    String mode();

    /**
     * True while the queue is running on a fallback path instead of its primary backend.
     */
    default boolean degraded() {
        return false;
    }
}
