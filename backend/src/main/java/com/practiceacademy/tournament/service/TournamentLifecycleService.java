package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.config.TournamentEngineProperties;
import com.practiceacademy.tournament.dto.RewardConfig;
import com.practiceacademy.tournament.dto.TournamentRequests;
import com.practiceacademy.tournament.dto.TournamentResponses;
import com.practiceacademy.tournament.mapper.TournamentResponseMapper;
import com.practiceacademy.tournament.model.HeadToHeadType;
import com.practiceacademy.tournament.model.MatchOutcome;
import com.practiceacademy.tournament.model.RoundAggregation;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentEnrollment;
import com.practiceacademy.tournament.model.TournamentFormat;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentRanking;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.repository.QualifierSnapshotRepository;
import com.practiceacademy.tournament.repository.RewardLedgerEntryRepository;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry points of the tournament engine. Generation, result recording, stage finalization and reward distribution
 * are delegated to their dedicated services.
 */
@Service
@RequiredArgsConstructor
public class TournamentLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TournamentLifecycleService.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentEnrollmentRepository tournamentEnrollmentRepository;
    private final TournamentMatchRepository tournamentMatchRepository;
    private final QualifierSnapshotRepository qualifierSnapshotRepository;
    private final RewardLedgerEntryRepository rewardLedgerEntryRepository;
    private final SessionGenerationGuard sessionGenerationGuard;
    private final GenerationJobPublisher generationJobPublisher;
    private final MatchResultRecorder matchResultRecorder;
    private final GroupStageFinalizer groupStageFinalizer;
    private final TournamentRankingService tournamentRankingService;
    private final RewardDistributionService rewardDistributionService;
    private final RewardConfigValidator rewardConfigValidator;
    private final RewardConfigCodec rewardConfigCodec;
    private final TournamentStateMachine tournamentStateMachine;
    private final TournamentResponseMapper tournamentResponseMapper;
    private final TournamentEngineProperties properties;

    @Transactional
    public TournamentResponses.TournamentDetail createTournament(TournamentRequests.CreateTournamentRequest request) {
        if (request.format() == TournamentFormat.HEAD_TO_HEAD && request.headToHeadType() == null) {
            throw TournamentEngineException.validation("headToHeadType is required for HEAD_TO_HEAD tournaments");
        }
        if (request.format() == TournamentFormat.INDIVIDUAL_RANKING && request.metricKind() == null) {
            throw TournamentEngineException.validation("metricKind is required for INDIVIDUAL_RANKING tournaments");
        }

        OffsetDateTime now = OffsetDateTime.now();
        Tournament tournament = new Tournament();
        tournament.setTournamentId(UUID.randomUUID());
        tournament.setName(request.name().trim());
        tournament.setFormat(request.format());
        tournament.setMaxEnrollments(request.maxEnrollments());
        tournament.setStatus(TournamentStatus.DRAFT);
        tournament.setCreatedAt(now);
        tournament.setUpdatedAt(now);

        if (request.format() == TournamentFormat.HEAD_TO_HEAD) {
            tournament.setHeadToHeadType(request.headToHeadType());
            tournament.setRoundCount(1);
            tournament.setThirdPlaceMatch(request.thirdPlaceMatch() && request.headToHeadType() != HeadToHeadType.LEAGUE);
            tournament.setDrawSeed(request.drawSeed());
            if (request.headToHeadType() == HeadToHeadType.GROUP_KNOCKOUT) {
                tournament.setGroupCount(request.groupCount());
                tournament.setQualifiersPerGroup(request.qualifiersPerGroup() != null
                        ? request.qualifiersPerGroup()
                        : properties.getGroups().getDefaultQualifiersPerGroup());
            }
        } else {
            tournament.setMetricKind(request.metricKind());
            tournament.setRankingDirection(request.rankingDirection() != null
                    ? request.rankingDirection()
                    : request.metricKind().defaultDirection());
            tournament.setRoundAggregation(request.roundAggregation() != null
                    ? request.roundAggregation()
                    : RoundAggregation.SUM);
            tournament.setRoundCount(request.roundCount() != null ? request.roundCount() : 1);
            tournament.setMeasurementUnit(request.measurementUnit() == null || request.measurementUnit().isBlank()
                    ? null
                    : request.measurementUnit().trim());
        }

        Tournament saved = tournamentRepository.save(tournament);
        log.info("Created {} tournament {} ({})", saved.getFormat(), saved.getTournamentId(), saved.getName());
        return tournamentResponseMapper.toTournamentDetail(saved);
    }

    @Transactional(readOnly = true)
    public TournamentResponses.TournamentDetail getTournament(UUID tournamentId) {
        return tournamentResponseMapper.toTournamentDetail(requireTournament(tournamentId));
    }

    /**
     * Adds participants to a DRAFT tournament. Each insert is skipped by the unique (tournament, participant) key when
     * the row already exists, and the roster is re-read afterwards. Exceeding capacity rolls the whole call back.
     */
    @Transactional
    public List<TournamentResponses.Enrollment> enroll(UUID tournamentId, TournamentRequests.EnrollRequest request) {
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        if (tournament.getStatus() != TournamentStatus.DRAFT || tournament.isSessionsGenerated()) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " is not open for enrollment in status " + tournament.getStatus()
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        int inserted = 0;
        for (UUID participantId : new LinkedHashSet<>(request.participantIds())) {
            inserted += tournamentEnrollmentRepository.insertIfAbsent(UUID.randomUUID(), tournamentId, participantId, now);
        }
        List<TournamentEnrollment> roster =
                tournamentEnrollmentRepository.findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(tournamentId);
        if (roster.size() > tournament.getMaxEnrollments()) {
            throw TournamentEngineException.conflict(
                    "capacity_reached",
                    "Tournament " + tournamentId + " allows " + tournament.getMaxEnrollments() + " participants"
            );
        }
        if (inserted > 0) {
            log.info("Enrolled {} participants in tournament {}", inserted, tournamentId);
        }
        return tournamentResponseMapper.toEnrollments(roster);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.Enrollment> listEnrollments(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentResponseMapper.toEnrollments(
                tournamentEnrollmentRepository.findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(tournamentId)
        );
    }

    /**
     * Generates the first stage. Large rosters are handed to the background worker and answered with QUEUED.
     */
    public TournamentResponses.Generation startTournament(UUID tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        if (!tournament.isSessionsGenerated() && tournament.getStatus() == TournamentStatus.DRAFT) {
            long enrolled = tournamentEnrollmentRepository.countByTournamentId(tournamentId);
            if (enrolled >= properties.getGeneration().getAsyncThreshold()) {
                generationJobPublisher.publish(new GenerationJobMessage(
                        tournamentId,
                        TournamentBracketBuilder.firstStage(tournament),
                        1
                ));
                return tournamentResponseMapper.toGeneration(GenerationResult.queued(tournamentId));
            }
        }
        return tournamentResponseMapper.toGeneration(sessionGenerationGuard.ensureGeneratedOnce(tournamentId));
    }

    public TournamentResponses.MatchSummary submitResult(UUID matchId, TournamentRequests.SubmitResultRequest request) {
        MatchOutcome outcome;
        try {
            outcome = request.toOutcome();
        } catch (IllegalArgumentException ex) {
            throw TournamentEngineException.validation("Malformed match outcome: " + ex.getMessage());
        }
        TournamentMatch match = matchResultRecorder.recordResult(matchId, outcome);
        return tournamentResponseMapper.toMatchSummary(match);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.MatchSummary> listMatches(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentResponseMapper.toMatchSummaries(
                tournamentMatchRepository.findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(tournamentId)
        );
    }

    public TournamentResponses.QualifierSnapshotView finalizeGroupStage(UUID tournamentId) {
        return tournamentResponseMapper.toQualifierSnapshot(groupStageFinalizer.finalizeGroupStage(tournamentId));
    }

    @Transactional(readOnly = true)
    public TournamentResponses.QualifierSnapshotView getQualifierSnapshot(UUID tournamentId) {
        return qualifierSnapshotRepository.findById(tournamentId)
                .map(tournamentResponseMapper::toQualifierSnapshot)
                .orElseThrow(() -> TournamentEngineException.notFound("qualifier_snapshot", tournamentId));
    }

    /**
     * Runs the final ranking computation, records each participant's final placement and moves to COMPLETED.
     * Calling it again on a completed tournament changes nothing.
     */
    @Transactional
    public TournamentResponses.TournamentDetail completeTournament(UUID tournamentId) {
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        TournamentStatus status = tournament.getStatus();
        if (status == TournamentStatus.COMPLETED || status == TournamentStatus.REWARDS_DISTRIBUTED) {
            return tournamentResponseMapper.toTournamentDetail(tournament);
        }
        if (status != TournamentStatus.ACTIVE
                && status != TournamentStatus.KNOCKOUT_STAGE
                && status != TournamentStatus.RESULTS_COMPLETE) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " cannot be completed in status " + status
            );
        }

        long pending = tournamentMatchRepository.findByTournamentIdOrderByStageAscRoundNumberAscMatchNumberAsc(tournamentId)
                .stream()
                .filter(match -> !match.isVoided() && !match.isCompleted())
                .count();
        if (pending > 0) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " still has " + pending + " matches without a result"
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        List<TournamentRanking> rankings = tournamentRankingService.recompute(tournament, now);
        Map<UUID, Integer> finalRanks = rankings.stream()
                .collect(Collectors.toMap(TournamentRanking::getParticipantId, TournamentRanking::getRank));
        for (TournamentEnrollment enrollment
                : tournamentEnrollmentRepository.findByTournamentIdOrderByEnrolledAtAscParticipantIdAsc(tournamentId)) {
            Integer rank = finalRanks.get(enrollment.getParticipantId());
            if (rank != null) {
                enrollment.setFinalPlacement(rank);
                tournamentEnrollmentRepository.save(enrollment);
            }
        }

        tournamentStateMachine.transition(tournament, TournamentStatus.COMPLETED, now);
        return tournamentResponseMapper.toTournamentDetail(tournamentRepository.save(tournament));
    }

    /**
     * Cancels a tournament that is not yet terminal. Generated matches stay for audit but are flagged void.
     */
    @Transactional
    public TournamentResponses.TournamentDetail cancelTournament(UUID tournamentId, String reason) {
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        if (tournament.getStatus() == TournamentStatus.CANCELLED) {
            return tournamentResponseMapper.toTournamentDetail(tournament);
        }

        OffsetDateTime now = OffsetDateTime.now();
        tournamentStateMachine.transition(tournament, TournamentStatus.CANCELLED, now);
        tournament.setCancellationReason(reason == null || reason.isBlank() ? null : reason.trim());
        int voided = tournamentMatchRepository.voidAllForTournament(tournamentId, now);
        Tournament saved = tournamentRepository.save(tournament);
        log.info("Cancelled tournament {}; {} matches voided", tournamentId, voided);
        return tournamentResponseMapper.toTournamentDetail(saved);
    }

    @Transactional
    public TournamentResponses.TournamentDetail saveRewardConfig(UUID tournamentId, RewardConfig config) {
        rewardConfigValidator.validate(config);
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        if (tournament.getStatus() == TournamentStatus.REWARDS_DISTRIBUTED
                || tournament.getStatus() == TournamentStatus.CANCELLED) {
            throw TournamentEngineException.invalidState(
                    "Reward configuration of tournament " + tournamentId + " is frozen in status " + tournament.getStatus()
            );
        }
        tournament.setRewardConfigJson(rewardConfigCodec.toJson(config));
        tournament.setUpdatedAt(OffsetDateTime.now());
        log.info("Saved reward configuration for tournament {} with {} enabled skills",
                tournamentId, config.enabledSkills().size());
        return tournamentResponseMapper.toTournamentDetail(tournamentRepository.save(tournament));
    }

    public DistributionSummary distributeRewards(UUID tournamentId, RewardConfig config) {
        return rewardDistributionService.distributeRewards(tournamentId, config);
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.RankingEntry> getRankings(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentResponseMapper.toRankingEntries(tournamentRankingService.getRankings(tournamentId));
    }

    @Transactional(readOnly = true)
    public List<TournamentResponses.LedgerEntry> listRewardLedger(UUID tournamentId) {
        requireTournament(tournamentId);
        return tournamentResponseMapper.toLedgerEntries(
                rewardLedgerEntryRepository.findByTournamentIdOrderByCreatedAtAsc(tournamentId)
        );
    }

    public ParticipantRewardSummary participantRewardSummary(UUID tournamentId, UUID participantId) {
        return rewardDistributionService.participantRewardSummary(tournamentId, participantId);
    }

    /**
     * Every ledger row of one participant across tournaments, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TournamentResponses.LedgerEntry> participantLedger(UUID participantId) {
        return tournamentResponseMapper.toLedgerEntries(
                rewardLedgerEntryRepository.findByParticipantIdOrderByCreatedAtAscTournamentIdAsc(participantId)
        );
    }

    private Tournament requireTournament(UUID tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
    }
}
