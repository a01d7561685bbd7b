package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.config.TournamentEngineProperties;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.web.TournamentEngineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationWorkerServiceTest {

    private static final UUID TOURNAMENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000d001");

    @Mock
    private GenerationJobQueue generationJobQueue;

    @Mock
    private SessionGenerationGuard sessionGenerationGuard;

    @Mock
    private ThreadPoolTaskExecutor generationWorkerExecutor;

    private TournamentEngineProperties properties;
    private GenerationWorkerService workerService;

    @BeforeEach
    void setUp() {
        properties = new TournamentEngineProperties();
        properties.getGeneration().setMaxRetries(2);
        properties.getGeneration().setRetryBackoffMs(0);
        workerService = new GenerationWorkerService(
                generationJobQueue,
                sessionGenerationGuard,
                properties,
                generationWorkerExecutor
        );
    }

    @Test
    void registersItselfAsQueueConsumerAndDispatchesOnTheExecutor() {
        when(sessionGenerationGuard.ensureGeneratedOnce(TOURNAMENT_ID))
                .thenReturn(GenerationResult.generated(TOURNAMENT_ID, List.of()));
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(generationWorkerExecutor).execute(any(Runnable.class));
        ArgumentCaptor<GenerationJobQueueConsumer> consumer = ArgumentCaptor.forClass(GenerationJobQueueConsumer.class);

        workerService.registerQueueConsumer();
        verify(generationJobQueue).setConsumer(consumer.capture());
        consumer.getValue().accept(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.SINGLE, 1));

        verify(sessionGenerationGuard).ensureGeneratedOnce(TOURNAMENT_ID);
    }

    @Test
    void transientFailureIsRequeuedWithTheNextAttempt() {
        when(sessionGenerationGuard.ensureGeneratedOnce(TOURNAMENT_ID))
                .thenThrow(new QueryTimeoutException("lock wait timeout"));

        workerService.process(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.KNOCKOUT, 1));

        ArgumentCaptor<GenerationJobMessage> requeued = ArgumentCaptor.forClass(GenerationJobMessage.class);
        verify(generationJobQueue).enqueue(requeued.capture());
        assertEquals(2, requeued.getValue().attempt());
        assertEquals(MatchStage.KNOCKOUT, requeued.getValue().stage());
    }

    @Test
    void retriesStopOnceTheBudgetIsSpent() {
        when(sessionGenerationGuard.ensureGeneratedOnce(TOURNAMENT_ID))
                .thenThrow(new QueryTimeoutException("lock wait timeout"));

        workerService.process(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.SINGLE, 3));

        verify(generationJobQueue, never()).enqueue(any());
    }

    @Test
    void zeroRetriesMeansASingleAttempt() {
        properties.getGeneration().setMaxRetries(0);
        when(sessionGenerationGuard.ensureGeneratedOnce(TOURNAMENT_ID))
                .thenThrow(new QueryTimeoutException("lock wait timeout"));

        workerService.process(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.SINGLE, 1));

        verify(generationJobQueue, never()).enqueue(any());
    }

    @Test
    void rejectedJobsAreNotRetried() {
        when(sessionGenerationGuard.ensureGeneratedOnce(TOURNAMENT_ID))
                .thenThrow(TournamentEngineException.invalidState("cancelled"))
                .thenThrow(new IllegalStateException("bracket link broken"));

        workerService.process(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.SINGLE, 1));
        workerService.process(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.SINGLE, 1));

        verify(sessionGenerationGuard, times(2)).ensureGeneratedOnce(TOURNAMENT_ID);
        verify(generationJobQueue, never()).enqueue(any());
    }

    @Test
    void retryFoldsIntoAJobAlreadyWaitingForTheSameStage() {
        InMemoryGenerationJobQueue localQueue = new InMemoryGenerationJobQueue();
        GenerationWorkerService localWorker = new GenerationWorkerService(
                localQueue,
                sessionGenerationGuard,
                properties,
                generationWorkerExecutor
        );
        GenerationJobMessage waiting = new GenerationJobMessage(TOURNAMENT_ID, MatchStage.KNOCKOUT, 1);
        when(sessionGenerationGuard.ensureGeneratedOnce(TOURNAMENT_ID))
                .thenThrow(new QueryTimeoutException("lock wait timeout"));
        try {
            assertTrue(localQueue.enqueue(waiting));

            localWorker.process(new GenerationJobMessage(TOURNAMENT_ID, MatchStage.KNOCKOUT, 1));

            assertEquals(1, localQueue.pendingCount());
            assertTrue(localQueue.isPending(waiting));
        } finally {
            localQueue.stop();
        }
    }
}
