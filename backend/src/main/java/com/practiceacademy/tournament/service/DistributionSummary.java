package com.practiceacademy.tournament.service;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DistributionSummary(
        UUID tournamentId,
        boolean alreadyDistributed,
        int participantsRewarded,
        int participantsSkipped,
        int newEntriesCreated,
        int existingEntriesMatched,
        long totalCredits,
        long totalXp,
        BigDecimal totalSkillPoints,
        int badgesAwarded,
        List<DataDriftAlert> dataDriftAlerts,
        OffsetDateTime distributedAt
) {
}
