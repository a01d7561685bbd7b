package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.MatchStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryGenerationJobQueueTest {

    private InMemoryGenerationJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryGenerationJobQueue();
        queue.start();
    }

    @AfterEach
    void tearDown() {
        queue.stop();
    }

    @Test
    void jobsEnqueuedBeforeAConsumerExistsAreDeliveredOnceItRegisters() throws Exception {
        GenerationJobMessage first = new GenerationJobMessage(UUID.randomUUID(), MatchStage.SINGLE, 1);
        GenerationJobMessage second = new GenerationJobMessage(UUID.randomUUID(), MatchStage.GROUP, 1);
        assertTrue(queue.enqueue(first));
        assertTrue(queue.enqueue(second));

        BlockingQueue<GenerationJobMessage> received = new ArrayBlockingQueue<>(2);
        queue.setConsumer(received::add);

        assertEquals(first, received.poll(5, TimeUnit.SECONDS));
        assertEquals(second, received.poll(5, TimeUnit.SECONDS));
        assertEquals(0, queue.pendingCount());
    }

    @Test
    void secondJobForTheSameTournamentStageIsFoldedIntoTheWaitingOne() throws Exception {
        UUID tournamentId = UUID.randomUUID();
        GenerationJobMessage waiting = new GenerationJobMessage(tournamentId, MatchStage.KNOCKOUT, 1);
        GenerationJobMessage duplicate = new GenerationJobMessage(tournamentId, MatchStage.KNOCKOUT, 2);
        GenerationJobMessage otherStage = new GenerationJobMessage(tournamentId, MatchStage.GROUP, 1);

        assertTrue(queue.enqueue(waiting));
        assertFalse(queue.enqueue(duplicate));
        assertTrue(queue.enqueue(otherStage));
        assertEquals(2, queue.pendingCount());

        BlockingQueue<GenerationJobMessage> received = new ArrayBlockingQueue<>(3);
        queue.setConsumer(received::add);

        assertEquals(waiting, received.poll(5, TimeUnit.SECONDS));
        assertEquals(otherStage, received.poll(5, TimeUnit.SECONDS));
        assertNull(received.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void takenJobReleasesItsKeySoTheStageCanBeQueuedAgain() throws Exception {
        GenerationJobMessage job = new GenerationJobMessage(UUID.randomUUID(), MatchStage.SINGLE, 1);
        BlockingQueue<GenerationJobMessage> received = new ArrayBlockingQueue<>(2);
        queue.setConsumer(received::add);

        assertTrue(queue.enqueue(job));
        assertEquals(job, received.poll(5, TimeUnit.SECONDS));
        assertFalse(queue.isPending(job));

        assertTrue(queue.enqueue(job.nextAttempt()));
        assertEquals(job.nextAttempt(), received.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void failingConsumerDoesNotStopTheDispatcher() throws Exception {
        GenerationJobMessage poison = new GenerationJobMessage(UUID.randomUUID(), MatchStage.SINGLE, 1);
        GenerationJobMessage healthy = new GenerationJobMessage(UUID.randomUUID(), MatchStage.SINGLE, 1);
        BlockingQueue<GenerationJobMessage> received = new ArrayBlockingQueue<>(2);
        queue.setConsumer(message -> {
            if (message.equals(poison)) {
                throw new IllegalStateException("boom");
            }
            received.add(message);
        });

        queue.enqueue(poison);
        queue.enqueue(healthy);

        assertEquals(healthy, received.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void stoppedQueueRejectsNewJobs() {
        queue.stop();

        assertThrows(
                IllegalStateException.class,
                () -> queue.enqueue(new GenerationJobMessage(UUID.randomUUID(), MatchStage.SINGLE, 1))
        );
    }
}
