package com.practiceacademy.tournament.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "tournament_rankings",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_tournament_rankings_tournament_participant",
                columnNames = {"tournament_id", "participant_id"}
        )
)
public class TournamentRanking {

    @Id
    @Column(name = "ranking_id", nullable = false, updatable = false)
    private UUID rankingId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    @Column(name = "rank", nullable = false)
    private Integer rank;

    @Column(name = "points", nullable = false, precision = 18, scale = 3)
    private BigDecimal points = BigDecimal.ZERO;

    @Column(name = "wins", nullable = false)
    private Integer wins = 0;

    @Column(name = "draws", nullable = false)
    private Integer draws = 0;

    @Column(name = "losses", nullable = false)
    private Integer losses = 0;

    @Column(name = "goals_for", nullable = false)
    private Integer goalsFor = 0;

    @Column(name = "goals_against", nullable = false)
    private Integer goalsAgainst = 0;

    @Column(name = "metric_value", precision = 18, scale = 3)
    private BigDecimal metricValue;

    @Column(name = "rounds_completed", nullable = false)
    private Integer roundsCompleted = 0;

    @Column(name = "computed_at", nullable = false)
    private OffsetDateTime computedAt = OffsetDateTime.now();
}
