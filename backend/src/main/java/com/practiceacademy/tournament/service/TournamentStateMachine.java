package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.web.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guarded lifecycle transitions. Forward-only, with CANCELLED reachable from every non-terminal state. Every
 * tournament starts through ACTIVE; group formats continue from there into GROUP_STAGE.
 */
@Component
public class TournamentStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TournamentStateMachine.class);
    private static final Map<TournamentStatus, Set<TournamentStatus>> ALLOWED_TRANSITIONS =
            new EnumMap<>(TournamentStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(TournamentStatus.DRAFT, EnumSet.of(
                TournamentStatus.ACTIVE, TournamentStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(TournamentStatus.ACTIVE, EnumSet.of(
                TournamentStatus.GROUP_STAGE, TournamentStatus.RESULTS_COMPLETE, TournamentStatus.COMPLETED, TournamentStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(TournamentStatus.GROUP_STAGE, EnumSet.of(
                TournamentStatus.KNOCKOUT_STAGE, TournamentStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(TournamentStatus.KNOCKOUT_STAGE, EnumSet.of(
                TournamentStatus.RESULTS_COMPLETE, TournamentStatus.COMPLETED, TournamentStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(TournamentStatus.RESULTS_COMPLETE, EnumSet.of(
                TournamentStatus.COMPLETED, TournamentStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(TournamentStatus.COMPLETED, EnumSet.of(
                TournamentStatus.REWARDS_DISTRIBUTED, TournamentStatus.CANCELLED));
        ALLOWED_TRANSITIONS.put(TournamentStatus.REWARDS_DISTRIBUTED, EnumSet.noneOf(TournamentStatus.class));
        ALLOWED_TRANSITIONS.put(TournamentStatus.CANCELLED, EnumSet.noneOf(TournamentStatus.class));
    }

    public boolean canTransition(TournamentStatus from, TournamentStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public void transition(Tournament tournament, TournamentStatus target, OffsetDateTime now) {
        TournamentStatus current = tournament.getStatus();
        if (!canTransition(current, target)) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournament.getTournamentId() + " cannot move from " + current + " to " + target
            );
        }
        tournament.setStatus(target);
        tournament.setUpdatedAt(now);
        switch (target) {
            case ACTIVE -> tournament.setStartedAt(now);
            case COMPLETED -> tournament.setCompletedAt(now);
            case REWARDS_DISTRIBUTED -> tournament.setRewardsDistributedAt(now);
            case CANCELLED -> tournament.setCancelledAt(now);
            default -> {
            }
        }
        log.info("Tournament {} moved from {} to {}", tournament.getTournamentId(), current, target);
    }
}
