package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.MatchOutcome;
import com.practiceacademy.tournament.model.MatchOutcomeJsonCodec;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.RankingDirection;
import com.practiceacademy.tournament.model.RoundAggregation;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentFormat;
import com.practiceacademy.tournament.model.TournamentMatch;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Full recomputation of standings from completed, non-void matches. Ranks are dense and unique: the participant id
 * is always the last tie-break.
 */
@Component
public class RankingCalculator {

    private static final BigDecimal WIN_POINTS = BigDecimal.valueOf(3);
    private static final BigDecimal DRAW_POINTS = BigDecimal.ONE;

    static final Comparator<UUID> PARTICIPANT_ID_ORDER = Comparator.comparing(UUID::toString);

    private static final Comparator<Standing> POINTS_CHAIN = Comparator
            .comparing(Standing::points, Comparator.reverseOrder())
            .thenComparing(Standing::goalDifference, Comparator.reverseOrder())
            .thenComparing(Standing::goalsFor, Comparator.reverseOrder())
            .thenComparing(Standing::participantId, PARTICIPANT_ID_ORDER);

    public List<RankingRow> compute(Tournament tournament, Collection<UUID> participants, List<TournamentMatch> matches) {
        if (tournament.getFormat() == TournamentFormat.INDIVIDUAL_RANKING) {
            return rankIndividual(
                    participants,
                    matches,
                    tournament.resolveRankingDirection(),
                    tournament.getRoundAggregation() == null ? RoundAggregation.SUM : tournament.getRoundAggregation()
            );
        }
        if (tournament.isKnockoutBracket()) {
            return rankWithBracketPlacement(participants, matches);
        }
        return rankHeadToHead(participants, matches);
    }

    /**
     * Points table: 3 per win, 1 per draw, then goal difference, goals for and participant id.
     */
    public List<RankingRow> rankHeadToHead(Collection<UUID> participants, List<TournamentMatch> matches) {
        List<Standing> standings = new ArrayList<>(tally(participants, matches).values());
        standings.sort(POINTS_CHAIN);
        return toRows(standings);
    }

    List<RankingRow> rankWithBracketPlacement(Collection<UUID> participants, List<TournamentMatch> matches) {
        Map<UUID, Integer> placement = bracketPlacement(matches);
        List<Standing> standings = new ArrayList<>(tally(participants, matches).values());
        standings.sort(Comparator
                .comparing((Standing standing) -> placement.getOrDefault(standing.participantId(), Integer.MAX_VALUE))
                .thenComparing(POINTS_CHAIN));
        return toRows(standings);
    }

    List<RankingRow> rankIndividual(
            Collection<UUID> participants,
            List<TournamentMatch> matches,
            RankingDirection direction,
            RoundAggregation aggregation
    ) {
        Map<UUID, BigDecimal> aggregate = new LinkedHashMap<>();
        Map<UUID, Integer> roundsCompleted = new LinkedHashMap<>();
        for (UUID participantId : participants) {
            roundsCompleted.put(participantId, 0);
        }
        for (TournamentMatch match : matches) {
            if (!counts(match) || !roundsCompleted.containsKey(match.getParticipant1Id())) {
                continue;
            }
            MatchOutcome outcome = MatchOutcomeJsonCodec.fromJson(match.getOutcomeJson());
            if (!(outcome instanceof MatchOutcome.IndividualRanking individual)) {
                continue;
            }
            UUID participantId = match.getParticipant1Id();
            roundsCompleted.merge(participantId, 1, Integer::sum);
            aggregate.merge(participantId, individual.value(), (current, next) -> combine(current, next, direction, aggregation));
        }

        Comparator<BigDecimal> metricOrder = direction == RankingDirection.ASCENDING
                ? Comparator.naturalOrder()
                : Comparator.reverseOrder();
        List<UUID> ordered = new ArrayList<>(roundsCompleted.keySet());
        ordered.sort(Comparator
                .comparing((UUID id) -> aggregate.get(id), Comparator.nullsLast(metricOrder))
                .thenComparing(PARTICIPANT_ID_ORDER));

        List<RankingRow> rows = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            UUID participantId = ordered.get(i);
            rows.add(new RankingRow(
                    participantId,
                    i + 1,
                    BigDecimal.ZERO,
                    0,
                    0,
                    0,
                    0,
                    0,
                    aggregate.get(participantId),
                    roundsCompleted.get(participantId)
            ));
        }
        return List.copyOf(rows);
    }

    /**
     * Lower is better: champion 0, runner-up 1, third-place winner 2, third-place loser 3, still alive 4, then
     * eliminated participants with later rounds ahead of earlier ones. Participants that never reached the bracket
     * have no entry.
     */
    static Map<UUID, Integer> bracketPlacement(List<TournamentMatch> matches) {
        List<TournamentMatch> knockout = matches.stream()
                .filter(match -> match.getStage() == MatchStage.KNOCKOUT && !match.isVoided())
                .toList();
        int finalRound = knockout.stream()
                .mapToInt(TournamentMatch::getRoundNumber)
                .max()
                .orElse(0);

        Map<UUID, Integer> placement = new LinkedHashMap<>();
        for (TournamentMatch match : knockout) {
            assignIfAbsent(placement, match.getParticipant1Id(), 4);
            assignIfAbsent(placement, match.getParticipant2Id(), 4);
        }
        for (TournamentMatch match : knockout) {
            if (!match.isCompleted() || match.getWinnerParticipantId() == null) {
                continue;
            }
            UUID winner = match.getWinnerParticipantId();
            UUID loser = winner.equals(match.getParticipant1Id()) ? match.getParticipant2Id() : match.getParticipant1Id();
            if (match.isThirdPlaceMatch()) {
                placement.put(winner, 2);
                placement.put(loser, 3);
            } else if (match.getNextMatchId() == null) {
                placement.put(winner, 0);
                placement.put(loser, 1);
            } else if (loser != null) {
                int eliminated = 4 + (finalRound - match.getRoundNumber());
                placement.compute(loser, (id, current) -> current != null && current < 4 ? current : eliminated);
            }
        }
        return placement;
    }

    private static void assignIfAbsent(Map<UUID, Integer> placement, UUID participantId, int value) {
        if (participantId != null) {
            placement.putIfAbsent(participantId, value);
        }
    }

    private static Map<UUID, Standing> tally(Collection<UUID> participants, List<TournamentMatch> matches) {
        Map<UUID, Standing> standings = new LinkedHashMap<>();
        for (UUID participantId : participants) {
            standings.put(participantId, Standing.empty(participantId));
        }
        for (TournamentMatch match : matches) {
            if (!counts(match)
                    || !standings.containsKey(match.getParticipant1Id())
                    || !standings.containsKey(match.getParticipant2Id())) {
                continue;
            }
            MatchOutcome outcome = MatchOutcomeJsonCodec.fromJson(match.getOutcomeJson());
            if (!(outcome instanceof MatchOutcome.HeadToHead headToHead)) {
                continue;
            }
            UUID first = match.getParticipant1Id();
            UUID second = match.getParticipant2Id();
            int firstScore = headToHead.participant1Score();
            int secondScore = headToHead.participant2Score();

            UUID winner = resolveWinner(first, second, firstScore, secondScore, match.getWinnerParticipantId());

            standings.computeIfPresent(first, (id, s) -> s.apply(firstScore, secondScore, first, winner));
            standings.computeIfPresent(second, (id, s) -> s.apply(secondScore, firstScore, second, winner));
        }
        return standings;
    }

    private static UUID resolveWinner(UUID first, UUID second, int firstScore, int secondScore, UUID decider) {
        if (firstScore != secondScore) {
            return firstScore > secondScore ? first : second;
        }
        return decider;
    }

    private static boolean counts(TournamentMatch match) {
        return match.isCompleted() && !match.isVoided() && match.getOutcomeJson() != null;
    }

    private static BigDecimal combine(
            BigDecimal current,
            BigDecimal next,
            RankingDirection direction,
            RoundAggregation aggregation
    ) {
        if (aggregation == RoundAggregation.SUM) {
            return current.add(next);
        }
        boolean nextIsBetter = direction == RankingDirection.ASCENDING
                ? next.compareTo(current) < 0
                : next.compareTo(current) > 0;
        return nextIsBetter ? next : current;
    }

    private static List<RankingRow> toRows(List<Standing> standings) {
        List<RankingRow> rows = new ArrayList<>(standings.size());
        for (int i = 0; i < standings.size(); i++) {
            Standing s = standings.get(i);
            rows.add(new RankingRow(
                    s.participantId(),
                    i + 1,
                    s.points(),
                    s.wins(),
                    s.draws(),
                    s.losses(),
                    s.goalsFor(),
                    s.goalsAgainst(),
                    null,
                    s.wins() + s.draws() + s.losses()
            ));
        }
        return List.copyOf(rows);
    }

    private record Standing(
            UUID participantId,
            int wins,
            int draws,
            int losses,
            int goalsFor,
            int goalsAgainst
    ) {

        static Standing empty(UUID participantId) {
            return new Standing(participantId, 0, 0, 0, 0, 0);
        }

        Standing apply(int scored, int conceded, UUID self, UUID winner) {
            if (winner == null) {
                return new Standing(participantId, wins, draws + 1, losses, goalsFor + scored, goalsAgainst + conceded);
            }
            if (winner.equals(self)) {
                return new Standing(participantId, wins + 1, draws, losses, goalsFor + scored, goalsAgainst + conceded);
            }
            return new Standing(participantId, wins, draws, losses + 1, goalsFor + scored, goalsAgainst + conceded);
        }

        BigDecimal points() {
            return WIN_POINTS.multiply(BigDecimal.valueOf(wins)).add(DRAW_POINTS.multiply(BigDecimal.valueOf(draws)));
        }

        int goalDifference() {
            return goalsFor - goalsAgainst;
        }
    }
}
