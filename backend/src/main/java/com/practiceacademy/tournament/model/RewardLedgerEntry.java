package com.practiceacademy.tournament.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only award row. References the tournament and participant without owning them.
 */
@Getter
@Setter
@Entity
@Table(
        name = "reward_ledger_entries",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_reward_ledger_entries_idempotency_key",
                columnNames = "idempotency_key"
        )
)
public class RewardLedgerEntry {

    @Id
    @Column(name = "entry_id", nullable = false, updatable = false)
    private UUID entryId;

    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "participant_id", nullable = false, updatable = false)
    private UUID participantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reward_kind", nullable = false, length = 16, updatable = false)
    private RewardKind rewardKind;

    @Column(name = "reason", nullable = false, length = 64, updatable = false)
    private String reason;

    @Column(name = "idempotency_key", nullable = false, length = 255, updatable = false)
    private String idempotencyKey;

    @Column(name = "amount", nullable = false, precision = 18, scale = 3, updatable = false)
    private BigDecimal amount = BigDecimal.ZERO;

    @Column(name = "resolved_rank", updatable = false)
    private Integer resolvedRank;

    @Enumerated(EnumType.STRING)
    @Column(name = "placement_tier", length = 32, updatable = false)
    private PlacementTier placementTier;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata_json", columnDefinition = "jsonb", updatable = false)
    private JsonNode metadataJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
