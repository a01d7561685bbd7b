package com.practiceacademy.tournament.mapper;

import com.practiceacademy.tournament.dto.TournamentResponses;
import com.practiceacademy.tournament.model.QualifierSnapshot;
import com.practiceacademy.tournament.model.RewardLedgerEntry;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentEnrollment;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentRanking;
import com.practiceacademy.tournament.service.GenerationResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class TournamentResponseMapper {

    public TournamentResponses.TournamentDetail toTournamentDetail(Tournament tournament) {
        return new TournamentResponses.TournamentDetail(
                tournament.getTournamentId(),
                tournament.getName(),
                tournament.getFormat(),
                tournament.getHeadToHeadType(),
                tournament.getMetricKind(),
                tournament.getRankingDirection(),
                tournament.getRoundAggregation(),
                tournament.getRoundCount(),
                tournament.getMeasurementUnit(),
                tournament.isThirdPlaceMatch(),
                tournament.getGroupCount(),
                tournament.getQualifiersPerGroup(),
                tournament.getMaxEnrollments(),
                tournament.getDrawSeed(),
                tournament.getStatus(),
                tournament.isSessionsGenerated(),
                tournament.getSessionsGeneratedAt(),
                tournament.getRewardConfigJson() != null && !tournament.getRewardConfigJson().isNull(),
                tournament.getCancellationReason(),
                tournament.getCreatedAt(),
                tournament.getUpdatedAt(),
                tournament.getStartedAt(),
                tournament.getRankingsComputedAt(),
                tournament.getCompletedAt(),
                tournament.getRewardsDistributedAt(),
                tournament.getCancelledAt()
        );
    }

    public TournamentResponses.Enrollment toEnrollment(TournamentEnrollment enrollment) {
        return new TournamentResponses.Enrollment(
                enrollment.getEnrollmentId(),
                enrollment.getTournamentId(),
                enrollment.getParticipantId(),
                enrollment.getFinalPlacement(),
                enrollment.getEnrolledAt()
        );
    }

    public List<TournamentResponses.Enrollment> toEnrollments(Collection<TournamentEnrollment> enrollments) {
        return enrollments.stream().map(this::toEnrollment).toList();
    }

    public TournamentResponses.MatchSummary toMatchSummary(TournamentMatch match) {
        return new TournamentResponses.MatchSummary(
                match.getMatchId(),
                match.getTournamentId(),
                match.getStage(),
                match.getRoundNumber(),
                match.getMatchNumber(),
                match.getGroupLabel(),
                match.getParticipant1Id(),
                match.getParticipant2Id(),
                match.getNextMatchId(),
                match.getNextMatchSlot(),
                match.isThirdPlaceMatch(),
                match.getStatus(),
                match.getOutcomeJson(),
                match.getWinnerParticipantId(),
                match.isVoided(),
                match.getCompletedAt()
        );
    }

    public List<TournamentResponses.MatchSummary> toMatchSummaries(Collection<TournamentMatch> matches) {
        return matches.stream().map(this::toMatchSummary).toList();
    }

    public TournamentResponses.Generation toGeneration(GenerationResult result) {
        return new TournamentResponses.Generation(
                result.tournamentId(),
                result.outcome().name(),
                result.matches().size(),
                toMatchSummaries(result.matches())
        );
    }

    public TournamentResponses.RankingEntry toRankingEntry(TournamentRanking ranking) {
        return new TournamentResponses.RankingEntry(
                ranking.getParticipantId(),
                ranking.getRank(),
                ranking.getPoints(),
                ranking.getWins(),
                ranking.getDraws(),
                ranking.getLosses(),
                ranking.getGoalsFor(),
                ranking.getGoalsAgainst(),
                ranking.getMetricValue(),
                ranking.getRoundsCompleted(),
                ranking.getComputedAt()
        );
    }

    public List<TournamentResponses.RankingEntry> toRankingEntries(Collection<TournamentRanking> rankings) {
        return rankings.stream().map(this::toRankingEntry).toList();
    }

    public TournamentResponses.QualifierSnapshotView toQualifierSnapshot(QualifierSnapshot snapshot) {
        return new TournamentResponses.QualifierSnapshotView(
                snapshot.getTournamentId(),
                snapshot.getQualifiersPerGroup(),
                snapshot.getQualifiersJson(),
                snapshot.getCreatedAt()
        );
    }

    public TournamentResponses.LedgerEntry toLedgerEntry(RewardLedgerEntry entry) {
        return new TournamentResponses.LedgerEntry(
                entry.getEntryId(),
                entry.getTournamentId(),
                entry.getParticipantId(),
                entry.getRewardKind(),
                entry.getReason(),
                entry.getIdempotencyKey(),
                entry.getAmount(),
                entry.getResolvedRank(),
                entry.getPlacementTier(),
                entry.getMetadataJson(),
                entry.getCreatedAt()
        );
    }

    public List<TournamentResponses.LedgerEntry> toLedgerEntries(Collection<RewardLedgerEntry> entries) {
        return entries.stream().map(this::toLedgerEntry).toList();
    }
}
