package com.practiceacademy.tournament.model;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Format-dependent match result. The variant must agree with the tournament format.
 */
public sealed interface MatchOutcome permits MatchOutcome.HeadToHead, MatchOutcome.IndividualRanking {

    TournamentFormat format();

    record HeadToHead(
            int participant1Score,
            int participant2Score,
            UUID deciderWinnerId
    ) implements MatchOutcome {

        public HeadToHead {
            if (participant1Score < 0 || participant2Score < 0) {
                throw new IllegalArgumentException("Head-to-head scores must be non-negative");
            }
        }

        public static HeadToHead of(int participant1Score, int participant2Score) {
            return new HeadToHead(participant1Score, participant2Score, null);
        }

        @Override
        public TournamentFormat format() {
            return TournamentFormat.HEAD_TO_HEAD;
        }

        public HeadToHeadResult result() {
            if (participant1Score > participant2Score) {
                return HeadToHeadResult.PARTICIPANT1_WIN;
            }
            if (participant2Score > participant1Score) {
                return HeadToHeadResult.PARTICIPANT2_WIN;
            }
            return HeadToHeadResult.DRAW;
        }
    }

    record IndividualRanking(
            BigDecimal value,
            String unit
    ) implements MatchOutcome {

        public IndividualRanking {
            if (value == null) {
                throw new IllegalArgumentException("Individual ranking value is required");
            }
            unit = unit == null || unit.isBlank() ? null : unit.trim();
        }

        @Override
        public TournamentFormat format() {
            return TournamentFormat.INDIVIDUAL_RANKING;
        }
    }

    enum HeadToHeadResult {
        PARTICIPANT1_WIN,
        DRAW,
        PARTICIPANT2_WIN
    }
}
