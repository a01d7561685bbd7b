package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentEnrollment;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentRanking;
import com.practiceacademy.tournament.repository.TournamentEnrollmentRepository;
import com.practiceacademy.tournament.repository.TournamentMatchRepository;
import com.practiceacademy.tournament.repository.TournamentRankingRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Persists the ranking table. Each run replaces every row of the tournament, never patches individual rows.
 */
@Service
@RequiredArgsConstructor
public class TournamentRankingService {

    private static final Logger log = LoggerFactory.getLogger(TournamentRankingService.class);

    private final TournamentEnrollmentRepository tournamentEnrollmentRepository;
    private final TournamentMatchRepository tournamentMatchRepository;
    private final TournamentRankingRepository tournamentRankingRepository;
    private final RankingCalculator rankingCalculator;

    @Transactional
    public List<TournamentRanking> recompute(Tournament tournament, OffsetDateTime now) {
        UUID tournamentId = tournament.getTournamentId();
        List<UUID> participants = tournamentEnrollmentRepository
                .findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(tournamentId)
                .stream()
                .map(TournamentEnrollment::getParticipantId)
                .toList();
        List<TournamentMatch> matches =
                tournamentMatchRepository.findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(tournamentId);

        List<RankingRow> rows = rankingCalculator.compute(tournament, participants, matches);

        tournamentRankingRepository.deleteAllForTournament(tournamentId);
        List<TournamentRanking> saved = tournamentRankingRepository.saveAll(
                rows.stream().map(row -> toEntity(tournamentId, row, now)).toList()
        );
        tournament.setRankingsComputedAt(now);
        log.debug("Recomputed {} ranking rows for tournament {}", saved.size(), tournamentId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<TournamentRanking> getRankings(UUID tournamentId) {
        return tournamentRankingRepository.findByTournamentIdOrderByRankAsc(tournamentId);
    }

    private static TournamentRanking toEntity(UUID tournamentId, RankingRow row, OffsetDateTime now) {
        TournamentRanking ranking = new TournamentRanking();
        ranking.setRankingId(UUID.randomUUID());
        ranking.setTournamentId(tournamentId);
        ranking.setParticipantId(row.participantId());
        ranking.setRank(row.rank());
        ranking.setPoints(row.points());
        ranking.setWins(row.wins());
        ranking.setDraws(row.draws());
        ranking.setLosses(row.losses());
        ranking.setGoalsFor(row.goalsFor());
        ranking.setGoalsAgainst(row.goalsAgainst());
        ranking.setMetricValue(row.metricValue());
        ranking.setRoundsCompleted(row.roundsCompleted());
        ranking.setComputedAt(now);
        return ranking;
    }
}
