package com.practiceacademy.tournament.service;

import java.math.BigDecimal;
import java.util.UUID;

public record RankingRow(
        UUID participantId,
        int rank,
        BigDecimal points,
        int wins,
        int draws,
        int losses,
        int goalsFor,
        int goalsAgainst,
        BigDecimal metricValue,
        int roundsCompleted
) {
}
