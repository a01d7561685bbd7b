package com.practiceacademy.tournament.repository;

import com.practiceacademy.tournament.model.TournamentEnrollment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TournamentEnrollmentRepository extends JpaRepository<TournamentEnrollment, UUID> {

    List<TournamentEnrollment> findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(UUID tournamentId);

    Optional<TournamentEnrollment> findByTournamentIdAndParticipantId(UUID tournamentId, UUID participantId);

    long countByTournamentId(UUID tournamentId);

    /**
     * Returns 0 when the participant already holds a row for the tournament; the existing row is left untouched.
     */
    @Modifying
    @Query(value = """
            insert into tournament_enrollments (enrollment_id, tournament_id, participant_id, enrolled_at)
            values (:enrollmentId, :tournamentId, :participantId, :enrolledAt)
            on conflict (tournament_id, participant_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("enrollmentId") UUID enrollmentId,
            @Param("tournamentId") UUID tournamentId,
            @Param("participantId") UUID participantId,
            @Param("enrolledAt") OffsetDateTime enrolledAt
    );
}
