package com.practiceacademy.tournament.dto;

import com.practiceacademy.tournament.model.HeadToHeadType;
import com.practiceacademy.tournament.model.MatchOutcome;
import com.practiceacademy.tournament.model.MetricKind;
import com.practiceacademy.tournament.model.RankingDirection;
import com.practiceacademy.tournament.model.RoundAggregation;
import com.practiceacademy.tournament.model.TournamentFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public final class TournamentRequests {

    private TournamentRequests() {
    }

    public record CreateTournamentRequest(
            @NotBlank(message = "name is required")
            @Size(max = 200, message = "name must be at most 200 characters")
            String name,

            @NotNull(message = "format is required")
            TournamentFormat format,

            HeadToHeadType headToHeadType,

            MetricKind metricKind,

            RankingDirection rankingDirection,

            RoundAggregation roundAggregation,

            @Min(value = 1, message = "roundCount must be at least 1")
            @Max(value = 50, message = "roundCount must be at most 50")
            Integer roundCount,

            @Size(max = 32, message = "measurementUnit must be at most 32 characters")
            String measurementUnit,

            boolean thirdPlaceMatch,

            @Min(value = 1, message = "groupCount must be at least 1")
            Integer groupCount,

            @Min(value = 1, message = "qualifiersPerGroup must be at least 1")
            Integer qualifiersPerGroup,

            @NotNull(message = "maxEnrollments is required")
            @Min(value = 1, message = "maxEnrollments must be at least 1")
            @Max(value = 10000, message = "maxEnrollments must be at most 10000")
            Integer maxEnrollments,

            Long drawSeed
    ) {
        @AssertTrue(message = "headToHeadType is required for HEAD_TO_HEAD tournaments")
        public boolean isHeadToHeadTypeConsistent() {
            return format != TournamentFormat.HEAD_TO_HEAD || headToHeadType != null;
        }

        @AssertTrue(message = "metricKind is required for INDIVIDUAL_RANKING tournaments")
        public boolean isMetricKindConsistent() {
            return format != TournamentFormat.INDIVIDUAL_RANKING || metricKind != null;
        }
    }

    public record EnrollRequest(
            @NotEmpty(message = "participantIds must not be empty")
            @Size(max = 10000, message = "participantIds must have at most 10000 entries")
            List<@NotNull(message = "participantIds must not contain null") UUID> participantIds
    ) {
    }

    public record SubmitResultRequest(
            @NotNull(message = "type is required")
            TournamentFormat type,

            @Min(value = 0, message = "participant1Score must be non-negative")
            Integer participant1Score,

            @Min(value = 0, message = "participant2Score must be non-negative")
            Integer participant2Score,

            UUID deciderWinnerId,

            BigDecimal value,

            @Size(max = 32, message = "unit must be at most 32 characters")
            String unit
    ) {
        @AssertTrue(message = "HEAD_TO_HEAD results need both scores; INDIVIDUAL_RANKING results need a value")
        public boolean isShapeConsistent() {
            if (type == null) {
                return true;
            }
            if (type == TournamentFormat.HEAD_TO_HEAD) {
                return participant1Score != null && participant2Score != null && value == null;
            }
            return value != null && participant1Score == null && participant2Score == null && deciderWinnerId == null;
        }

        public MatchOutcome toOutcome() {
            if (type == null) {
                throw new IllegalArgumentException("type is required");
            }
            if (type == TournamentFormat.HEAD_TO_HEAD) {
                if (participant1Score == null || participant2Score == null) {
                    throw new IllegalArgumentException("both participant scores are required");
                }
                return new MatchOutcome.HeadToHead(participant1Score, participant2Score, deciderWinnerId);
            }
            return new MatchOutcome.IndividualRanking(value, unit);
        }
    }

    public record CancelTournamentRequest(
            @Size(max = 500, message = "reason must be at most 500 characters")
            String reason
    ) {
    }

    public record DistributeRewardsRequest(
            @Valid
            RewardConfig rewardConfig
    ) {
    }
}
