package com.practiceacademy.tournament.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.practiceacademy.tournament.model.MatchOutcome;
import com.practiceacademy.tournament.model.MatchOutcomeJsonCodec;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.MatchStatus;
import com.practiceacademy.tournament.model.MetricKind;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.repository.TournamentMatchRepository;
import com.practiceacademy.tournament.repository.TournamentRepository;
import com.practiceacademy.tournament.web.TournamentEngineException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class MatchResultRecorder {

    private static final Logger log = LoggerFactory.getLogger(MatchResultRecorder.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentMatchRepository tournamentMatchRepository;
    private final TournamentRankingService tournamentRankingService;
    private final TournamentStateMachine tournamentStateMachine;

    /**
     * Validates and stores a match outcome, advances knockout participants and recomputes the ranking table.
     * Re-submitting the identical outcome for a completed match returns the match unchanged.
     */
    @Transactional
    public TournamentMatch recordResult(UUID matchId, MatchOutcome outcome) {
        if (outcome == null) {
            throw TournamentEngineException.validation("Match outcome is required");
        }
        UUID tournamentId = tournamentMatchRepository.findById(matchId)
                .map(TournamentMatch::getTournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("match", matchId));

        // tournament row first, then the match row: same lock order as cancellation
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        TournamentMatch match = tournamentMatchRepository.findByMatchIdForUpdate(matchId)
                .orElseThrow(() -> TournamentEngineException.notFound("match", matchId));

        if (match.isVoided()) {
            throw TournamentEngineException.invalidState("Match " + matchId + " is void");
        }
        if (outcome.format() != tournament.getFormat()) {
            throw TournamentEngineException.validation(
                    "Outcome type " + outcome.format() + " does not match tournament format " + tournament.getFormat()
            );
        }

        UUID winner = validateOutcome(tournament, match, outcome);
        ObjectNode outcomeJson = MatchOutcomeJsonCodec.toJson(outcome);

        if (match.isCompleted()) {
            if (outcomeJson.equals(match.getOutcomeJson())) {
                log.debug("Ignoring identical re-submission for completed match {}", matchId);
                return match;
            }
            throw TournamentEngineException.invalidState("Match " + matchId + " is already completed");
        }
        if (!tournament.getStatus().acceptsResults()) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " does not accept results in status " + tournament.getStatus()
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        match.setOutcomeJson(outcomeJson);
        match.setWinnerParticipantId(winner);
        match.setStatus(MatchStatus.COMPLETED);
        match.setCompletedAt(now);
        match.setUpdatedAt(now);
        tournamentMatchRepository.save(match);

        if (winner != null) {
            advance(match, winner, now);
        }

        tournamentRankingService.recompute(tournament, now);
        closeResultsIfComplete(tournament, now);
        tournamentRepository.save(tournament);

        log.info("Recorded {} result for match {} in tournament {}", match.getStage(), matchId, tournamentId);
        return match;
    }

    /**
     * Returns the winner the outcome implies, or null for draws and individual rounds.
     */
    UUID validateOutcome(Tournament tournament, TournamentMatch match, MatchOutcome outcome) {
        if (outcome instanceof MatchOutcome.HeadToHead headToHead) {
            return validateHeadToHead(match, headToHead);
        }
        validateIndividual(tournament, (MatchOutcome.IndividualRanking) outcome);
        return null;
    }

    private UUID validateHeadToHead(TournamentMatch match, MatchOutcome.HeadToHead outcome) {
        if (match.getParticipant1Id() == null || match.getParticipant2Id() == null) {
            throw TournamentEngineException.invalidState(
                    "Match " + match.getMatchId() + " is still waiting for its participants"
            );
        }
        UUID decider = outcome.deciderWinnerId();
        if (decider != null && !match.involves(decider)) {
            throw TournamentEngineException.validation("Decider " + decider + " is not a participant of this match");
        }

        MatchOutcome.HeadToHeadResult result = outcome.result();
        if (match.getStage() != MatchStage.KNOCKOUT) {
            if (decider != null) {
                throw TournamentEngineException.validation("A decider only applies to knockout matches");
            }
            return switch (result) {
                case PARTICIPANT1_WIN -> match.getParticipant1Id();
                case PARTICIPANT2_WIN -> match.getParticipant2Id();
                case DRAW -> null;
            };
        }

        UUID scoreWinner = switch (result) {
            case PARTICIPANT1_WIN -> match.getParticipant1Id();
            case PARTICIPANT2_WIN -> match.getParticipant2Id();
            case DRAW -> null;
        };
        if (scoreWinner == null) {
            if (decider == null) {
                throw TournamentEngineException.validation("A level knockout score requires a decider winner");
            }
            return decider;
        }
        if (decider != null && !decider.equals(scoreWinner)) {
            throw TournamentEngineException.validation("Decider winner contradicts the score");
        }
        return scoreWinner;
    }

    private void validateIndividual(Tournament tournament, MatchOutcome.IndividualRanking outcome) {
        MetricKind metric = tournament.getMetricKind() == null ? MetricKind.SCORE : tournament.getMetricKind();
        BigDecimal value = outcome.value();
        switch (metric) {
            case TIME, DISTANCE -> {
                if (value.signum() < 0) {
                    throw TournamentEngineException.validation(metric + " value must not be negative");
                }
            }
            case PLACEMENT -> {
                requireIntegral(metric, value);
                if (value.compareTo(BigDecimal.ONE) < 0) {
                    throw TournamentEngineException.validation("PLACEMENT value must be at least 1");
                }
            }
            case ROUNDS -> {
                requireIntegral(metric, value);
                if (value.signum() < 0) {
                    throw TournamentEngineException.validation("ROUNDS value must not be negative");
                }
            }
            case SCORE -> {
            }
        }

        String expectedUnit = tournament.getMeasurementUnit();
        if (expectedUnit != null && outcome.unit() != null
                && !expectedUnit.trim().toLowerCase(Locale.ROOT).equals(outcome.unit().toLowerCase(Locale.ROOT))) {
            throw TournamentEngineException.validation(
                    "Unit " + outcome.unit() + " does not match tournament unit " + expectedUnit
            );
        }
    }

    private static void requireIntegral(MetricKind metric, BigDecimal value) {
        if (value.stripTrailingZeros().scale() > 0) {
            throw TournamentEngineException.validation(metric + " value must be a whole number");
        }
    }

    private void advance(TournamentMatch match, UUID winner, OffsetDateTime now) {
        if (match.getNextMatchId() != null) {
            assignToSlot(match.getNextMatchId(), match.getNextMatchSlot(), winner, now);
        }
        if (match.getLoserNextMatchId() != null) {
            UUID loser = winner.equals(match.getParticipant1Id()) ? match.getParticipant2Id() : match.getParticipant1Id();
            assignToSlot(match.getLoserNextMatchId(), match.getLoserNextMatchSlot(), loser, now);
        }
    }

    private void assignToSlot(UUID targetMatchId, Integer slot, UUID participantId, OffsetDateTime now) {
        TournamentMatch target = tournamentMatchRepository.findByMatchIdForUpdate(targetMatchId)
                .orElseThrow(() -> new IllegalStateException("Bracket link points to missing match " + targetMatchId));
        if (slot == null || (slot != 1 && slot != 2)) {
            throw new IllegalStateException("Bracket link to match " + targetMatchId + " has invalid slot " + slot);
        }
        UUID occupant = slot == 1 ? target.getParticipant1Id() : target.getParticipant2Id();
        if (occupant != null && !occupant.equals(participantId)) {
            throw new IllegalStateException(
                    "Slot " + slot + " of match " + targetMatchId + " is already taken by " + occupant
            );
        }
        if (slot == 1) {
            target.setParticipant1Id(participantId);
        } else {
            target.setParticipant2Id(participantId);
        }
        target.setUpdatedAt(now);
        tournamentMatchRepository.save(target);
    }

    private void closeResultsIfComplete(Tournament tournament, OffsetDateTime now) {
        TournamentStatus status = tournament.getStatus();
        if (status != TournamentStatus.ACTIVE && status != TournamentStatus.KNOCKOUT_STAGE) {
            return;
        }
        List<TournamentMatch> matches = tournamentMatchRepository
                .findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(tournament.getTournamentId());
        boolean allComplete = matches.stream()
                .filter(candidate -> !candidate.isVoided())
                .allMatch(TournamentMatch::isCompleted);
        if (allComplete) {
            tournamentStateMachine.transition(tournament, TournamentStatus.RESULTS_COMPLETE, now);
        }
    }
}
