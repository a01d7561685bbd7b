package com.practiceacademy.tournament.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.QualifierSnapshot;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.repository.QualifierSnapshotRepository;
import com.practiceacademy.tournament.repository.TournamentMatchRepository;
import com.practiceacademy.tournament.repository.TournamentRepository;
import com.practiceacademy.tournament.web.TournamentEngineException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Closes the group stage of a group + knockout tournament: ranks every group, snapshots the qualifiers and seeds the
 * knockout bracket from them.
 */
@Service
@RequiredArgsConstructor
public class GroupStageFinalizer {

    private static final Logger log = LoggerFactory.getLogger(GroupStageFinalizer.class);

    private final TournamentRepository tournamentRepository;
    private final TournamentMatchRepository tournamentMatchRepository;
    private final QualifierSnapshotRepository qualifierSnapshotRepository;
    private final RankingCalculator rankingCalculator;
    private final TournamentBracketBuilder tournamentBracketBuilder;
    private final TournamentRankingService tournamentRankingService;
    private final TournamentStateMachine tournamentStateMachine;

    @Transactional
    public QualifierSnapshot finalizeGroupStage(UUID tournamentId) {
        Tournament tournament = tournamentRepository.findByTournamentIdForUpdate(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("tournament", tournamentId));
        if (!tournament.isGroupKnockout()) {
            throw TournamentEngineException.validation("Tournament " + tournamentId + " has no group stage");
        }

        QualifierSnapshot existing = qualifierSnapshotRepository.findById(tournamentId).orElse(null);
        if (existing != null) {
            log.debug("Group stage of tournament {} already finalized at {}", tournamentId, existing.getCreatedAt());
            return existing;
        }
        if (tournament.getStatus() != TournamentStatus.GROUP_STAGE) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " cannot finalize its group stage in status " + tournament.getStatus()
            );
        }

        List<TournamentMatch> groupMatches = tournamentMatchRepository
                .findByTournamentIdAndStageOrderByRoundNumberAscMatchNumberAsc(tournamentId, MatchStage.GROUP);
        long pending = groupMatches.stream()
                .filter(match -> !match.isVoided() && !match.isCompleted())
                .count();
        if (pending > 0) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " still has " + pending + " group matches to play"
            );
        }

        int qualifiersPerGroup = tournamentBracketBuilder.resolveQualifiersPerGroup(tournament);
        Map<String, List<RankingRow>> groupTables = rankGroups(groupMatches);
        List<UUID> seeding = seedByGroupRank(groupTables, qualifiersPerGroup);
        if (seeding.size() < 2) {
            throw TournamentEngineException.validation("Group stage produced fewer than two qualifiers");
        }

        OffsetDateTime now = OffsetDateTime.now();
        QualifierSnapshot snapshot = new QualifierSnapshot();
        snapshot.setTournamentId(tournamentId);
        snapshot.setQualifiersPerGroup(qualifiersPerGroup);
        snapshot.setQualifiersJson(toJson(groupTables, qualifiersPerGroup, seeding));
        snapshot.setCreatedAt(now);
        QualifierSnapshot persisted = qualifierSnapshotRepository.saveAndFlush(snapshot);

        TournamentBracketBuilder.BracketPlan plan = tournamentBracketBuilder.buildKnockout(
                tournamentId,
                seeding,
                tournament.isThirdPlaceMatch(),
                now
        );
        tournamentMatchRepository.saveAllAndFlush(plan.matches().stream()
                .map(TournamentBracketBuilder.PlannedMatch::toMatch)
                .toList());

        tournamentStateMachine.transition(tournament, TournamentStatus.KNOCKOUT_STAGE, now);
        tournamentRankingService.recompute(tournament, now);
        tournamentRepository.save(tournament);

        log.info(
                "Finalized group stage of tournament {}: {} qualifiers from {} groups, {} knockout matches",
                tournamentId,
                seeding.size(),
                groupTables.size(),
                plan.matches().size()
        );
        return persisted;
    }

    Map<String, List<RankingRow>> rankGroups(List<TournamentMatch> groupMatches) {
        Map<String, Set<UUID>> members = new TreeMap<>();
        Map<String, List<TournamentMatch>> matchesByGroup = new TreeMap<>();
        for (TournamentMatch match : groupMatches) {
            String label = match.getGroupLabel() == null ? "" : match.getGroupLabel();
            Set<UUID> group = members.computeIfAbsent(label, ignored -> new LinkedHashSet<>());
            group.add(match.getParticipant1Id());
            group.add(match.getParticipant2Id());
            matchesByGroup.computeIfAbsent(label, ignored -> new ArrayList<>()).add(match);
        }

        Map<String, List<RankingRow>> tables = new TreeMap<>();
        members.forEach((label, participants) ->
                tables.put(label, rankingCalculator.rankHeadToHead(participants, matchesByGroup.get(label))));
        return tables;
    }

    /**
     * Group winners first, then runners-up, each tier in group order: A1, B1, A2, B2. Standard bracket seeding
     * then keeps winners apart and pairs A1 with B2.
     */
    static List<UUID> seedByGroupRank(Map<String, List<RankingRow>> groupTables, int qualifiersPerGroup) {
        List<UUID> seeding = new ArrayList<>();
        for (int tier = 0; tier < qualifiersPerGroup; tier++) {
            for (List<RankingRow> table : groupTables.values()) {
                if (tier < table.size()) {
                    seeding.add(table.get(tier).participantId());
                }
            }
        }
        return seeding;
    }

    private static ObjectNode toJson(Map<String, List<RankingRow>> groupTables, int qualifiersPerGroup, List<UUID> seeding) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("qualifiers_per_group", qualifiersPerGroup);
        ArrayNode groups = root.putArray("groups");
        groupTables.forEach((label, table) -> {
            ObjectNode group = groups.addObject();
            group.put("group", label);
            ArrayNode qualifiers = group.putArray("qualifiers");
            for (RankingRow row : table.subList(0, Math.min(qualifiersPerGroup, table.size()))) {
                ObjectNode qualifier = qualifiers.addObject();
                qualifier.put("participant_id", row.participantId().toString());
                qualifier.put("group_rank", row.rank());
                qualifier.put("points", row.points());
                qualifier.put("goal_difference", row.goalsFor() - row.goalsAgainst());
            }
        });
        ArrayNode seeds = root.putArray("seeding");
        seeding.forEach(participantId -> seeds.add(participantId.toString()));
        return root;
    }
}
