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
@Table(name = "tournament_matches")
public class TournamentMatch {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private UUID matchId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", nullable = false, length = 16, updatable = false)
    private MatchStage stage;

    @Column(name = "round_number", nullable = false, updatable = false)
    private Integer roundNumber;

    @Column(name = "match_number", nullable = false, updatable = false)
    private Integer matchNumber;

    @Column(name = "group_label", length = 8, updatable = false)
    private String groupLabel;

    @Column(name = "participant1_id")
    private UUID participant1Id;

    @Column(name = "participant2_id")
    private UUID participant2Id;

    @Column(name = "next_match_id", updatable = false)
    private UUID nextMatchId;

    @Column(name = "next_match_slot", updatable = false)
    private Integer nextMatchSlot;

    @Column(name = "loser_next_match_id", updatable = false)
    private UUID loserNextMatchId;

    @Column(name = "loser_next_match_slot", updatable = false)
    private Integer loserNextMatchSlot;

    @Column(name = "third_place_match", nullable = false, updatable = false)
    private boolean thirdPlaceMatch;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MatchStatus status = MatchStatus.SCHEDULED;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "outcome_json", columnDefinition = "jsonb")
    private JsonNode outcomeJson;

    @Column(name = "winner_participant_id")
    private UUID winnerParticipantId;

    @Column(name = "voided", nullable = false)
    private boolean voided;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "voided_at")
    private OffsetDateTime voidedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean isCompleted() {
        return status == MatchStatus.COMPLETED;
    }

    public boolean involves(UUID participantId) {
        return participantId != null
                && (participantId.equals(participant1Id) || participantId.equals(participant2Id));
    }
}
