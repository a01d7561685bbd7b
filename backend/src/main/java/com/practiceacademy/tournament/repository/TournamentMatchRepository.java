package com.practiceacademy.tournament.repository;

import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.TournamentMatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TournamentMatchRepository extends JpaRepository<TournamentMatch, UUID> {

    List<TournamentMatch> findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(UUID tournamentId);

    List<TournamentMatch> findByTournamentIdAndStageOrderByRoundNumberAscMatchNumberAsc(UUID tournamentId, MatchStage stage);

    boolean existsByTournamentIdAndStage(UUID tournamentId, MatchStage stage);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from TournamentMatch m where m.matchId = :matchId")
    Optional<TournamentMatch> findByMatchIdForUpdate(@Param("matchId") UUID matchId);

    @Modifying(flushAutomatically = true)
    @Query("""
            update TournamentMatch m
               set m.voided = true,
                   m.voidedAt = :voidedAt,
                   m.updatedAt = :voidedAt
             where m.tournamentId = :tournamentId
               and m.voided = false
            """)
    int voidAllForTournament(@Param("tournamentId") UUID tournamentId, @Param("voidedAt") OffsetDateTime voidedAt);
}
