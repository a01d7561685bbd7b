package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentEnrollment;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.repository.TournamentEnrollmentRepository;
import com.practiceacademy.tournament.repository.TournamentMatchRepository;
import com.practiceacademy.tournament.repository.TournamentRepository;
import com.practiceacademy.tournament.web.TournamentEngineException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Runs initial match generation at most once per tournament.
 * <p>
 * The tournament row is locked and {@code sessions_generated} is claimed with a conditional update before any
 * match is inserted. A caller that loses the claim inserts nothing and gets the winner's matches back. Claim and
 * inserts share one transaction, so a storage failure leaves neither matches nor the flag behind.
 */
@Service
@RequiredArgsConstructor
public class SessionGenerationGuard {

    private static final Logger log = LoggerFactory.getLogger(SessionGenerationGuard.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentEnrollmentRepository tournamentEnrollmentRepository;
    private final TournamentMatchRepository tournamentMatchRepository;
    private final TournamentBracketBuilder tournamentBracketBuilder;
    private final TournamentStateMachine tournamentStateMachine;

    @Transactional
    public GenerationResult ensureGeneratedOnce(UUID tournamentId) {
        OffsetDateTime now = OffsetDateTime.now();
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));

        if (tournament.isSessionsGenerated()) {
            log.debug("Sessions for tournament {} already generated at {}", tournamentId, tournament.getSessionsGeneratedAt());
            return GenerationResult.alreadyGenerated(
                    tournamentId,
                    tournamentMatchRepository.findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(tournamentId)
            );
        }
        if (tournament.getStatus() != TournamentStatus.DRAFT) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " cannot generate sessions in status " + tournament.getStatus()
            );
        }

        List<UUID> participants = tournamentEnrollmentRepository
                .findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(tournamentId)
                .stream()
                .map(TournamentEnrollment::getParticipantId)
                .toList();
        int minimum = TournamentBracketBuilder.minimumParticipants(tournament);
        if (participants.size() < minimum) {
            throw TournamentEngineException.validation(
                    "Tournament requires at least " + minimum + " participants, has " + participants.size()
            );
        }

        TournamentBracketBuilder.BracketPlan plan;
        try {
            plan = tournamentBracketBuilder.build(tournament, participants, now);
        } catch (IllegalArgumentException ex) {
            throw TournamentEngineException.validation(ex.getMessage());
        }

        if (tournamentRepository.markSessionsGenerated(tournamentId, now) != 1) {
            log.warn("Lost the generation claim for tournament {}; returning the committed matches", tournamentId);
            return GenerationResult.alreadyGenerated(
                    tournamentId,
                    tournamentMatchRepository.findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(tournamentId)
            );
        }

        List<TournamentMatch> matches = plan.matches().stream()
                .map(TournamentBracketBuilder.PlannedMatch::toMatch)
                .toList();
        List<TournamentMatch> persisted = tournamentMatchRepository.saveAllAndFlush(matches);

        tournament.setSessionsGenerated(true);
        tournament.setSessionsGeneratedAt(now);
        tournamentStateMachine.transition(tournament, TournamentStatus.ACTIVE, now);
        if (plan.stage() == MatchStage.GROUP) {
            tournamentStateMachine.transition(tournament, TournamentStatus.GROUP_STAGE, now);
        }
        tournamentRepository.save(tournament);

        log.info(
                "Generated {} {} matches for tournament {} with {} participants",
                persisted.size(),
                plan.stage(),
                tournamentId,
                participants.size()
        );
        return GenerationResult.generated(tournamentId, persisted);
    }
}
