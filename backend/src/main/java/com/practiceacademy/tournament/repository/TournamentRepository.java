package com.practiceacademy.tournament.repository;

import com.practiceacademy.tournament.model.Tournament;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TournamentRepository extends JpaRepository<Tournament, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Tournament t where t.tournamentId = :tournamentId")
    Optional<Tournament> findByTournamentIdForUpdate(@Param("tournamentId") UUID tournamentId);

    /**
     * Compare-and-set of the generation marker. Returns 1 for the single caller that flips it.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update Tournament t
               set t.sessionsGenerated = true,
                   t.sessionsGeneratedAt = :generatedAt,
                   t.updatedAt = :generatedAt
             where t.tournamentId = :tournamentId
               and t.sessionsGenerated = false
            """)
    int markSessionsGenerated(
            @Param("tournamentId") UUID tournamentId,
            @Param("generatedAt") OffsetDateTime generatedAt
    );
}
