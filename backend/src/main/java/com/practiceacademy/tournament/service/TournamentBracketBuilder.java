package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.config.TournamentEngineProperties;
import com.practiceacademy.tournament.model.HeadToHeadType;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.MatchStatus;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentFormat;
import com.practiceacademy.tournament.model.TournamentMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Produces the matches of the current stage for a tournament. Pure apart from id generation; persistence is the
 * caller's job.
 */
@Component
@RequiredArgsConstructor
public class TournamentBracketBuilder {

    static final int MIN_HEAD_TO_HEAD_PARTICIPANTS = 2;
    static final int MIN_GROUP_KNOCKOUT_PARTICIPANTS = 3;
    static final int MIN_INDIVIDUAL_PARTICIPANTS = 1;

    private final TournamentEngineProperties properties;

    public static int minimumParticipants(Tournament tournament) {
        if (tournament.getFormat() == TournamentFormat.INDIVIDUAL_RANKING) {
            return MIN_INDIVIDUAL_PARTICIPANTS;
        }
        if (tournament.getHeadToHeadType() == HeadToHeadType.GROUP_KNOCKOUT) {
            return MIN_GROUP_KNOCKOUT_PARTICIPANTS;
        }
        return MIN_HEAD_TO_HEAD_PARTICIPANTS;
    }

    public static MatchStage firstStage(Tournament tournament) {
        if (tournament.getFormat() == TournamentFormat.INDIVIDUAL_RANKING) {
            return MatchStage.SINGLE;
        }
        if (tournament.getHeadToHeadType() == HeadToHeadType.GROUP_KNOCKOUT) {
            return MatchStage.GROUP;
        }
        return tournament.getHeadToHeadType() == HeadToHeadType.KNOCKOUT ? MatchStage.KNOCKOUT : MatchStage.SINGLE;
    }

    /**
     * Builds the first stage: the whole schedule for single-stage formats, the group stage for group + knockout.
     */
    public BracketPlan build(Tournament tournament, List<UUID> participants, OffsetDateTime generatedAt) {
        List<UUID> ordered = validateParticipants(participants, minimumParticipants(tournament));
        UUID tournamentId = tournament.getTournamentId();

        if (tournament.getFormat() == TournamentFormat.INDIVIDUAL_RANKING) {
            int rounds = tournament.getRoundCount() == null ? 1 : tournament.getRoundCount();
            return buildIndividualRounds(tournamentId, ordered, rounds, generatedAt);
        }
        HeadToHeadType type = tournament.getHeadToHeadType();
        if (type == null) {
            throw new IllegalArgumentException("Head-to-head tournament is missing its sub-type");
        }
        return switch (type) {
            case LEAGUE -> new BracketPlan(
                    MatchStage.SINGLE,
                    Map.of(),
                    roundRobin(tournamentId, ordered, null, MatchStage.SINGLE, generatedAt)
            );
            case KNOCKOUT -> buildKnockout(
                    tournamentId,
                    applyDraw(ordered, tournament.getDrawSeed()),
                    tournament.isThirdPlaceMatch(),
                    generatedAt
            );
            case GROUP_KNOCKOUT -> buildGroupStage(tournament, ordered, generatedAt);
        };
    }

    /**
     * Single-elimination bracket over participants in seed order (index 0 is the top seed). Byes are not
     * materialised: a top seed without a first-round opponent is placed straight into its round-two slot.
     */
    public BracketPlan buildKnockout(
            UUID tournamentId,
            List<UUID> seeded,
            boolean thirdPlaceMatch,
            OffsetDateTime generatedAt
    ) {
        List<UUID> ordered = validateParticipants(seeded, MIN_HEAD_TO_HEAD_PARTICIPANTS);
        int participantCount = ordered.size();
        int bracketSize = bracketSize(participantCount);
        int rounds = Integer.numberOfTrailingZeros(bracketSize);
        List<Integer> seedOrder = seedOrder(bracketSize);

        UUID[][] matchIds = new UUID[rounds + 1][];
        for (int round = 1; round <= rounds; round++) {
            matchIds[round] = new UUID[bracketSize >> round];
        }
        for (int position = 0; position < matchIds[1].length; position++) {
            if (isPlayable(seedOrder, position, participantCount)) {
                matchIds[1][position] = UUID.randomUUID();
            }
        }
        for (int round = 2; round <= rounds; round++) {
            for (int position = 0; position < matchIds[round].length; position++) {
                matchIds[round][position] = UUID.randomUUID();
            }
        }
        UUID thirdPlaceMatchId = thirdPlaceMatch && participantCount >= 4 ? UUID.randomUUID() : null;

        List<PlannedMatch> matches = new ArrayList<>(participantCount);
        for (int round = 1; round <= rounds; round++) {
            int matchNumber = 1;
            for (int position = 0; position < matchIds[round].length; position++) {
                UUID matchId = matchIds[round][position];
                if (matchId == null) {
                    continue;
                }
                UUID participant1 = null;
                UUID participant2 = null;
                if (round == 1) {
                    participant1 = ordered.get(seedOrder.get(position * 2) - 1);
                    participant2 = ordered.get(seedOrder.get(position * 2 + 1) - 1);
                } else if (round == 2) {
                    participant1 = byeAdvancer(seedOrder, position * 2, participantCount, ordered);
                    participant2 = byeAdvancer(seedOrder, position * 2 + 1, participantCount, ordered);
                }

                boolean semifinal = round == rounds - 1;
                matches.add(new PlannedMatch(
                        matchId,
                        tournamentId,
                        MatchStage.KNOCKOUT,
                        round,
                        matchNumber++,
                        null,
                        participant1,
                        participant2,
                        round < rounds ? matchIds[round + 1][position / 2] : null,
                        round < rounds ? position % 2 + 1 : null,
                        semifinal ? thirdPlaceMatchId : null,
                        semifinal && thirdPlaceMatchId != null ? position % 2 + 1 : null,
                        false,
                        generatedAt
                ));
            }
        }
        if (thirdPlaceMatchId != null) {
            matches.add(new PlannedMatch(
                    thirdPlaceMatchId,
                    tournamentId,
                    MatchStage.KNOCKOUT,
                    rounds,
                    2,
                    null,
                    null,
                    null,
                    null,
                    null,
                    null,
                    null,
                    true,
                    generatedAt
            ));
        }
        return new BracketPlan(MatchStage.KNOCKOUT, Map.of(), List.copyOf(matches));
    }

    BracketPlan buildGroupStage(Tournament tournament, List<UUID> participants, OffsetDateTime generatedAt) {
        List<Integer> sizes = groupSizes(participants.size(), tournament.getGroupCount());
        int qualifiersPerGroup = resolveQualifiersPerGroup(tournament);
        int smallestGroup = sizes.get(sizes.size() - 1);
        if (sizes.size() * Math.min(qualifiersPerGroup, smallestGroup) < MIN_HEAD_TO_HEAD_PARTICIPANTS) {
            throw new IllegalArgumentException("Group configuration would qualify fewer than two participants");
        }

        Map<String, List<UUID>> groups = new LinkedHashMap<>();
        List<PlannedMatch> matches = new ArrayList<>();
        int offset = 0;
        for (int i = 0; i < sizes.size(); i++) {
            String label = groupLabel(i);
            List<UUID> members = List.copyOf(participants.subList(offset, offset + sizes.get(i)));
            offset += sizes.get(i);
            groups.put(label, members);
            matches.addAll(roundRobin(tournament.getTournamentId(), members, label, MatchStage.GROUP, generatedAt));
        }
        return new BracketPlan(MatchStage.GROUP, Collections.unmodifiableMap(groups), List.copyOf(matches));
    }

    BracketPlan buildIndividualRounds(UUID tournamentId, List<UUID> participants, int rounds, OffsetDateTime generatedAt) {
        if (rounds < 1) {
            throw new IllegalArgumentException("Round count must be at least 1");
        }
        List<PlannedMatch> matches = new ArrayList<>(participants.size() * rounds);
        for (int round = 1; round <= rounds; round++) {
            for (int i = 0; i < participants.size(); i++) {
                matches.add(new PlannedMatch(
                        UUID.randomUUID(),
                        tournamentId,
                        MatchStage.SINGLE,
                        round,
                        i + 1,
                        null,
                        participants.get(i),
                        null,
                        null,
                        null,
                        null,
                        null,
                        false,
                        generatedAt
                ));
            }
        }
        return new BracketPlan(MatchStage.SINGLE, Map.of(), List.copyOf(matches));
    }

    /**
     * Circle-method schedule: every unordered pair meets once, one round at a time.
     */
    List<PlannedMatch> roundRobin(
            UUID tournamentId,
            List<UUID> participants,
            String groupLabel,
            MatchStage stage,
            OffsetDateTime generatedAt
    ) {
        List<UUID> rotation = new ArrayList<>(participants);
        if (rotation.size() % 2 == 1) {
            rotation.add(null);
        }
        int slots = rotation.size();
        List<PlannedMatch> matches = new ArrayList<>();
        for (int round = 1; round < slots; round++) {
            int matchNumber = 1;
            for (int i = 0; i < slots / 2; i++) {
                UUID home = rotation.get(i);
                UUID away = rotation.get(slots - 1 - i);
                if (home == null || away == null) {
                    continue;
                }
                matches.add(new PlannedMatch(
                        UUID.randomUUID(),
                        tournamentId,
                        stage,
                        round,
                        matchNumber++,
                        groupLabel,
                        home,
                        away,
                        null,
                        null,
                        null,
                        null,
                        false,
                        generatedAt
                ));
            }
            // fix the first slot, rotate the rest clockwise
            rotation.add(1, rotation.remove(slots - 1));
        }
        return matches;
    }

    List<Integer> groupSizes(int participantCount, Integer configuredGroupCount) {
        int groupCount;
        if (configuredGroupCount != null && configuredGroupCount > 0) {
            groupCount = configuredGroupCount;
        } else {
            int preferred = Math.max(2, properties.getGroups().getPreferredGroupSize());
            groupCount = (participantCount + preferred - 1) / preferred;
        }
        groupCount = Math.max(1, groupCount);
        if (participantCount / groupCount < 2) {
            throw new IllegalArgumentException(
                    "Cannot split " + participantCount + " participants into " + groupCount + " groups of at least two"
            );
        }
        int base = participantCount / groupCount;
        int remainder = participantCount % groupCount;
        List<Integer> sizes = new ArrayList<>(groupCount);
        for (int i = 0; i < groupCount; i++) {
            sizes.add(base + (i < remainder ? 1 : 0));
        }
        return sizes;
    }

    int resolveQualifiersPerGroup(Tournament tournament) {
        Integer configured = tournament.getQualifiersPerGroup();
        if (configured != null && configured > 0) {
            return configured;
        }
        return Math.max(1, properties.getGroups().getDefaultQualifiersPerGroup());
    }

    static String groupLabel(int index) {
        StringBuilder label = new StringBuilder();
        int value = index;
        do {
            label.insert(0, (char) ('A' + value % 26));
            value = value / 26 - 1;
        } while (value >= 0);
        return label.toString();
    }

    static int bracketSize(int participantCount) {
        int size = 1;
        while (size < participantCount) {
            size <<= 1;
        }
        return Math.max(2, size);
    }

    /**
     * Standard seed order for a bracket of {@code size}: 1 meets size, 2 meets size-1, and the top two seeds sit in
     * opposite halves.
     */
    static List<Integer> seedOrder(int size) {
        List<Integer> order = new ArrayList<>(List.of(1, 2));
        while (order.size() < size) {
            int next = order.size() * 2 + 1;
            List<Integer> expanded = new ArrayList<>(order.size() * 2);
            for (Integer seed : order) {
                expanded.add(seed);
                expanded.add(next - seed);
            }
            order = expanded;
        }
        return order;
    }

    private static boolean isPlayable(List<Integer> seedOrder, int position, int participantCount) {
        return seedOrder.get(position * 2) <= participantCount && seedOrder.get(position * 2 + 1) <= participantCount;
    }

    private static UUID byeAdvancer(List<Integer> seedOrder, int roundOnePosition, int participantCount, List<UUID> seeded) {
        if (isPlayable(seedOrder, roundOnePosition, participantCount)) {
            return null;
        }
        int seed = Math.min(seedOrder.get(roundOnePosition * 2), seedOrder.get(roundOnePosition * 2 + 1));
        return seeded.get(seed - 1);
    }

    private static List<UUID> applyDraw(List<UUID> participants, Long drawSeed) {
        if (drawSeed == null) {
            return participants;
        }
        List<UUID> drawn = new ArrayList<>(participants);
        Collections.shuffle(drawn, new Random(drawSeed));
        return drawn;
    }

    private static List<UUID> validateParticipants(List<UUID> participants, int minimum) {
        if (participants == null || participants.size() < minimum) {
            throw new IllegalArgumentException(
                    "At least " + minimum + " participants are required, got "
                            + (participants == null ? 0 : participants.size())
            );
        }
        Set<UUID> seen = new HashSet<>();
        for (UUID participantId : participants) {
            if (participantId == null) {
                throw new IllegalArgumentException("Participant id is required");
            }
            if (!seen.add(participantId)) {
                throw new IllegalArgumentException("Duplicate participant: " + participantId);
            }
        }
        return List.copyOf(participants);
    }

    public record BracketPlan(
            MatchStage stage,
            Map<String, List<UUID>> groups,
            List<PlannedMatch> matches
    ) {
    }

    public record PlannedMatch(
            UUID matchId,
            UUID tournamentId,
            MatchStage stage,
            Integer roundNumber,
            Integer matchNumber,
            String groupLabel,
            UUID participant1Id,
            UUID participant2Id,
            UUID nextMatchId,
            Integer nextMatchSlot,
            UUID loserNextMatchId,
            Integer loserNextMatchSlot,
            boolean thirdPlaceMatch,
            OffsetDateTime createdAt
    ) {

        public TournamentMatch toMatch() {
            TournamentMatch match = new TournamentMatch();
            match.setMatchId(matchId);
            match.setTournamentId(tournamentId);
            match.setStage(stage);
            match.setRoundNumber(roundNumber);
            match.setMatchNumber(matchNumber);
            match.setGroupLabel(groupLabel);
            match.setParticipant1Id(participant1Id);
            match.setParticipant2Id(participant2Id);
            match.setNextMatchId(nextMatchId);
            match.setNextMatchSlot(nextMatchSlot);
            match.setLoserNextMatchId(loserNextMatchId);
            match.setLoserNextMatchSlot(loserNextMatchSlot);
            match.setThirdPlaceMatch(thirdPlaceMatch);
            match.setStatus(MatchStatus.SCHEDULED);
            match.setCreatedAt(createdAt);
            match.setUpdatedAt(createdAt);
            return match;
        }
    }
}
