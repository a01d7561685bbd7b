package com.practiceacademy.tournament.repository;

import com.practiceacademy.tournament.model.TournamentRanking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TournamentRankingRepository extends JpaRepository<TournamentRanking, UUID> {

    List<TournamentRanking> findByTournamentIdOrderByRankAsc(UUID tournamentId);

    Optional<TournamentRanking> findByTournamentIdAndParticipantId(UUID tournamentId, UUID participantId);

    @Modifying(flushAutomatically = true)
    @Query("delete from TournamentRanking r where r.tournamentId = :tournamentId")
    int deleteAllForTournament(@Param("tournamentId") UUID tournamentId);
}
