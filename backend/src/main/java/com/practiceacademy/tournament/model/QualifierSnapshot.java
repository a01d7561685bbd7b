package com.practiceacademy.tournament.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable record of the group-stage qualifiers that seeded a knockout bracket.
 * At most one per tournament.
 */
@Getter
@Setter
@Entity
@Table(name = "tournament_qualifier_snapshots")
public class QualifierSnapshot {

    @Id
    @Column(name = "tournament_id", nullable = false, updatable = false)
    private UUID tournamentId;

    @Column(name = "qualifiers_per_group", nullable = false, updatable = false)
    private Integer qualifiersPerGroup;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "qualifiers_json", nullable = false, columnDefinition = "jsonb", updatable = false)
    private JsonNode qualifiersJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
