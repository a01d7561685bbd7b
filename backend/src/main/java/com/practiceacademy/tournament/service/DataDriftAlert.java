package com.practiceacademy.tournament.service;

import java.util.UUID;

/**
 * A badge that contradicts the participant's resolved rank. Reported, never corrected.
 */
public record DataDriftAlert(
        UUID tournamentId,
        UUID participantId,
        String badgeType,
        int resolvedRank,
        String rankSource
) {
}
