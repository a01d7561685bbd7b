package com.practiceacademy.tournament.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "tournaments")
public class Tournament {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "name", nullable = false, columnDefinition = "TEXT")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, length = 32, updatable = false)
    private TournamentFormat format;

    @Enumerated(EnumType.STRING)
    @Column(name = "head_to_head_type", length = 32, updatable = false)
    private HeadToHeadType headToHeadType;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric_kind", length = 32)
    private MetricKind metricKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "ranking_direction", length = 16)
    private RankingDirection rankingDirection;

    @Enumerated(EnumType.STRING)
    @Column(name = "round_aggregation", length = 16)
    private RoundAggregation roundAggregation;

    @Column(name = "round_count", nullable = false)
    private Integer roundCount = 1;

    @Column(name = "measurement_unit", length = 32)
    private String measurementUnit;

    @Column(name = "third_place_match", nullable = false)
    private boolean thirdPlaceMatch;

    @Column(name = "group_count")
    private Integer groupCount;

    @Column(name = "qualifiers_per_group", nullable = false)
    private Integer qualifiersPerGroup = 2;

    @Column(name = "max_enrollments", nullable = false)
    private Integer maxEnrollments;

    @Column(name = "draw_seed")
    private Long drawSeed;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private TournamentStatus status = TournamentStatus.DRAFT;

    @Column(name = "sessions_generated", nullable = false)
    private boolean sessionsGenerated;

    @Column(name = "sessions_generated_at")
    private OffsetDateTime sessionsGeneratedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "reward_config_json", columnDefinition = "jsonb")
    private JsonNode rewardConfigJson;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "rankings_computed_at")
    private OffsetDateTime rankingsComputedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "rewards_distributed_at")
    private OffsetDateTime rewardsDistributedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    public boolean isGroupKnockout() {
        return format == TournamentFormat.HEAD_TO_HEAD && headToHeadType == HeadToHeadType.GROUP_KNOCKOUT;
    }

    public boolean isKnockoutBracket() {
        return format == TournamentFormat.HEAD_TO_HEAD
                && (headToHeadType == HeadToHeadType.KNOCKOUT || headToHeadType == HeadToHeadType.GROUP_KNOCKOUT);
    }

    public RankingDirection resolveRankingDirection() {
        if (rankingDirection != null) {
            return rankingDirection;
        }
        return metricKind != null ? metricKind.defaultDirection() : RankingDirection.DESCENDING;
    }
}
