package com.practiceacademy.tournament.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "tournament_enrollments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_tournament_enrollments_tournament_participant",
                columnNames = {"tournament_id", "participant_id"}
        )
)
public class TournamentEnrollment {

    @Id
    @Column(name = "enrollment_id", nullable = false, updatable = false)
    private UUID enrollmentId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    /**
     * Placement recorded by the enrollment side (manual placement entry or legacy import).
     * Second link of the reward rank fallback chain.
     */
    @Column(name = "final_placement")
    private Integer finalPlacement;

    @Column(name = "enrolled_at", nullable = false, updatable = false)
    private OffsetDateTime enrolledAt = OffsetDateTime.now();
}
