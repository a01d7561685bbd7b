package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.PlacementTier;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ParticipantRewardSummary(
        UUID tournamentId,
        UUID participantId,
        Integer placement,
        PlacementTier placementTier,
        long credits,
        long placementXp,
        long skillBonusXp,
        long totalXp,
        Map<String, BigDecimal> skillPoints,
        List<Badge> badges,
        String rarestBadge,
        OffsetDateTime distributedAt
) {

    public record Badge(
            String badgeType,
            String title,
            String rarity,
            boolean milestone,
            OffsetDateTime earnedAt
    ) {
    }
}
