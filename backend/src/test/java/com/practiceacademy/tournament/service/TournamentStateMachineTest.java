package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.HeadToHeadType;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.web.TournamentEngineException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.EnumSet;

import static com.practiceacademy.tournament.service.TournamentFixtures.headToHead;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TournamentStateMachineTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-04-11T18:30:00Z");

    private final TournamentStateMachine stateMachine = new TournamentStateMachine();

    @Test
    void walksTheFullLifecycleAndStampsTimestamps() {
        Tournament tournament = headToHead(HeadToHeadType.LEAGUE);

        stateMachine.transition(tournament, TournamentStatus.ACTIVE, NOW);
        assertEquals(NOW, tournament.getStartedAt());
        stateMachine.transition(tournament, TournamentStatus.RESULTS_COMPLETE, NOW);
        stateMachine.transition(tournament, TournamentStatus.COMPLETED, NOW.plusMinutes(1));
        assertEquals(NOW.plusMinutes(1), tournament.getCompletedAt());
        stateMachine.transition(tournament, TournamentStatus.REWARDS_DISTRIBUTED, NOW.plusMinutes(2));

        assertEquals(TournamentStatus.REWARDS_DISTRIBUTED, tournament.getStatus());
        assertEquals(NOW.plusMinutes(2), tournament.getRewardsDistributedAt());
        assertEquals(NOW.plusMinutes(2), tournament.getUpdatedAt());
    }

    @Test
    void groupFormatsStartThroughActive() {
        Tournament tournament = headToHead(HeadToHeadType.GROUP_KNOCKOUT);
        assertFalse(stateMachine.canTransition(TournamentStatus.DRAFT, TournamentStatus.GROUP_STAGE));

        stateMachine.transition(tournament, TournamentStatus.ACTIVE, NOW);
        stateMachine.transition(tournament, TournamentStatus.GROUP_STAGE, NOW.plusSeconds(1));
        stateMachine.transition(tournament, TournamentStatus.KNOCKOUT_STAGE, NOW.plusMinutes(5));

        assertEquals(TournamentStatus.KNOCKOUT_STAGE, tournament.getStatus());
        assertEquals(NOW, tournament.getStartedAt());
    }

    @Test
    void everyNonTerminalStateCanBeCancelled() {
        for (TournamentStatus status : EnumSet.complementOf(
                EnumSet.of(TournamentStatus.CANCELLED, TournamentStatus.REWARDS_DISTRIBUTED))) {
            assertTrue(stateMachine.canTransition(status, TournamentStatus.CANCELLED), status.name());
        }
        assertFalse(stateMachine.canTransition(TournamentStatus.REWARDS_DISTRIBUTED, TournamentStatus.CANCELLED));
        assertFalse(stateMachine.canTransition(TournamentStatus.CANCELLED, TournamentStatus.CANCELLED));
    }

    @Test
    void backwardsAndSkippingMovesAreRejected() {
        assertFalse(stateMachine.canTransition(TournamentStatus.ACTIVE, TournamentStatus.DRAFT));
        assertFalse(stateMachine.canTransition(TournamentStatus.DRAFT, TournamentStatus.COMPLETED));
        assertFalse(stateMachine.canTransition(TournamentStatus.GROUP_STAGE, TournamentStatus.COMPLETED));
        assertFalse(stateMachine.canTransition(TournamentStatus.ACTIVE, TournamentStatus.REWARDS_DISTRIBUTED));

        Tournament tournament = headToHead(HeadToHeadType.LEAGUE);
        TournamentEngineException ex = assertThrows(
                TournamentEngineException.class,
                () -> stateMachine.transition(tournament, TournamentStatus.REWARDS_DISTRIBUTED, NOW)
        );
        assertEquals("invalid_state", ex.getCode());
        assertEquals(TournamentStatus.DRAFT, tournament.getStatus());
    }

    @Test
    void cancellationRecordsCancelledAt() {
        Tournament tournament = headToHead(HeadToHeadType.KNOCKOUT);
        tournament.setStatus(TournamentStatus.KNOCKOUT_STAGE);

        stateMachine.transition(tournament, TournamentStatus.CANCELLED, NOW);

        assertEquals(NOW, tournament.getCancelledAt());
        assertTrue(tournament.getStatus().isTerminal());
    }
}
