package com.practiceacademy.tournament.repository;

import com.practiceacademy.tournament.model.RewardKind;
import com.practiceacademy.tournament.model.RewardLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RewardLedgerEntryRepository extends JpaRepository<RewardLedgerEntry, UUID> {

    Optional<RewardLedgerEntry> findByIdempotencyKey(String idempotencyKey);

    List<RewardLedgerEntry> findByTournamentIdOrderByCreatedAtAsc(UUID tournamentId);

    List<RewardLedgerEntry> findByTournamentIdAndParticipantIdAndRewardKind(
            UUID tournamentId,
            UUID participantId,
            RewardKind rewardKind
    );

    List<RewardLedgerEntry> findByTournamentIdAndParticipantIdOrderByCreatedAtAsc(UUID tournamentId, UUID participantId);

    List<RewardLedgerEntry> findByParticipantIdOrderByCreatedAtAscTournamentIdAsc(UUID participantId);

    long countByParticipantIdAndRewardKindAndReason(UUID participantId, RewardKind rewardKind, String reason);

    @Query("select count(distinct e.tournamentId) from RewardLedgerEntry e where e.participantId = :participantId")
    long countDistinctTournamentsByParticipantId(@Param("participantId") UUID participantId);
}
