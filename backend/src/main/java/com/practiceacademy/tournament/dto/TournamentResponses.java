package com.practiceacademy.tournament.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.practiceacademy.tournament.model.HeadToHeadType;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.MatchStatus;
import com.practiceacademy.tournament.model.MetricKind;
import com.practiceacademy.tournament.model.PlacementTier;
import com.practiceacademy.tournament.model.RankingDirection;
import com.practiceacademy.tournament.model.RewardKind;
import com.practiceacademy.tournament.model.RoundAggregation;
import com.practiceacademy.tournament.model.TournamentFormat;
import com.practiceacademy.tournament.model.TournamentStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class TournamentResponses {

    private TournamentResponses() {
    }

    public record TournamentDetail(
            UUID tournamentId,
            String name,
            TournamentFormat format,
            HeadToHeadType headToHeadType,
            MetricKind metricKind,
            RankingDirection rankingDirection,
            RoundAggregation roundAggregation,
            Integer roundCount,
            String measurementUnit,
            boolean thirdPlaceMatch,
            Integer groupCount,
            Integer qualifiersPerGroup,
            Integer maxEnrollments,
            Long drawSeed,
            TournamentStatus status,
            boolean sessionsGenerated,
            OffsetDateTime sessionsGeneratedAt,
            boolean rewardConfigured,
            String cancellationReason,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime startedAt,
            OffsetDateTime rankingsComputedAt,
            OffsetDateTime completedAt,
            OffsetDateTime rewardsDistributedAt,
            OffsetDateTime cancelledAt
    ) {
    }

    public record Enrollment(
            UUID enrollmentId,
            UUID tournamentId,
            UUID participantId,
            Integer finalPlacement,
            OffsetDateTime enrolledAt
    ) {
    }

    public record MatchSummary(
            UUID matchId,
            UUID tournamentId,
            MatchStage stage,
            Integer roundNumber,
            Integer matchNumber,
            String groupLabel,
            UUID participant1Id,
            UUID participant2Id,
            UUID nextMatchId,
            Integer nextMatchSlot,
            boolean thirdPlaceMatch,
            MatchStatus status,
            JsonNode outcome,
            UUID winnerParticipantId,
            boolean voided,
            OffsetDateTime completedAt
    ) {
    }

    public record Generation(
            UUID tournamentId,
            String outcome,
            int matchCount,
            List<MatchSummary> matches
    ) {
    }

    public record RankingEntry(
            UUID participantId,
            Integer rank,
            BigDecimal points,
            Integer wins,
            Integer draws,
            Integer losses,
            Integer goalsFor,
            Integer goalsAgainst,
            BigDecimal metricValue,
            Integer roundsCompleted,
            OffsetDateTime computedAt
    ) {
    }

    public record QualifierSnapshotView(
            UUID tournamentId,
            Integer qualifiersPerGroup,
            JsonNode qualifiers,
            OffsetDateTime createdAt
    ) {
    }

    public record LedgerEntry(
            UUID entryId,
            UUID tournamentId,
            UUID participantId,
            RewardKind rewardKind,
            String reason,
            String idempotencyKey,
            BigDecimal amount,
            Integer resolvedRank,
            PlacementTier placementTier,
            JsonNode metadata,
            OffsetDateTime createdAt
    ) {
    }
}
