package com.practiceacademy.tournament.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.practiceacademy.tournament.config.TournamentEngineProperties;
import com.practiceacademy.tournament.model.HeadToHeadType;
import com.practiceacademy.tournament.model.MatchOutcome;
import com.practiceacademy.tournament.model.MatchStage;
import com.practiceacademy.tournament.model.MatchStatus;
import com.practiceacademy.tournament.model.QualifierSnapshot;
import com.practiceacademy.tournament.model.Tournament;
import com.practiceacademy.tournament.model.TournamentMatch;
import com.practiceacademy.tournament.model.TournamentStatus;
import com.practiceacademy.tournament.repository.QualifierSnapshotRepository;
import com.practiceacademy.tournament.repository.TournamentMatchRepository;
import com.practiceacademy.tournament.repository.TournamentRepository;
import com.practiceacademy.tournament.web.TournamentEngineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.practiceacademy.tournament.service.TournamentFixtures.complete;
import static com.practiceacademy.tournament.service.TournamentFixtures.headToHead;
import static com.practiceacademy.tournament.service.TournamentFixtures.participants;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroupStageFinalizerTest {

    @Mock
    private TournamentRepository tournamentRepository;

    @Mock
    private TournamentMatchRepository tournamentMatchRepository;

    @Mock
    private QualifierSnapshotRepository qualifierSnapshotRepository;

    @Mock
    private TournamentRankingService tournamentRankingService;

    private final TournamentBracketBuilder bracketBuilder = new TournamentBracketBuilder(new TournamentEngineProperties());
    private final List<UUID> players = participants(7);

    private Tournament tournament;
    private List<TournamentMatch> groupMatches;
    private GroupStageFinalizer finalizer;

    @BeforeEach
    void setUp() {
        tournament = headToHead(HeadToHeadType.GROUP_KNOCKOUT);
        groupMatches = new ArrayList<>(bracketBuilder.build(tournament, players, OffsetDateTime.now()).matches().stream()
                .map(TournamentBracketBuilder.PlannedMatch::toMatch)
                .toList());
        tournament.setStatus(TournamentStatus.GROUP_STAGE);
        tournament.setSessionsGenerated(true);

        finalizer = new GroupStageFinalizer(
                tournamentRepository,
                tournamentMatchRepository,
                qualifierSnapshotRepository,
                new RankingCalculator(),
                bracketBuilder,
                tournamentRankingService,
                new TournamentStateMachine()
        );

        UUID tournamentId = tournament.getTournamentId();
        when(tournamentRepository.findByTournamentIdForUpdate(tournamentId)).thenReturn(Optional.of(tournament));
        lenient().when(tournamentMatchRepository.findByTournamentIdAndStageOrderByRoundNumberAscMatchNumberAsc(
                tournamentId, MatchStage.GROUP)).thenReturn(groupMatches);
        lenient().when(qualifierSnapshotRepository.saveAndFlush(any())).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(tournamentMatchRepository.saveAllAndFlush(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void sevenPlayersProduceFourQualifiersAndAThreeMatchKnockout() {
        playGroupsLowerIdWins();
        when(qualifierSnapshotRepository.findById(tournament.getTournamentId())).thenReturn(Optional.empty());

        QualifierSnapshot snapshot = finalizer.finalizeGroupStage(tournament.getTournamentId());

        JsonNode seeding = snapshot.getQualifiersJson().get("seeding");
        assertEquals(4, seeding.size());
        // group A is players 1-4, group B players 5-7: tiered seeding A1, B1, A2, B2
        assertEquals(players.get(0).toString(), seeding.get(0).asText());
        assertEquals(players.get(4).toString(), seeding.get(1).asText());
        assertEquals(players.get(1).toString(), seeding.get(2).asText());
        assertEquals(players.get(5).toString(), seeding.get(3).asText());
        assertEquals(2, snapshot.getQualifiersJson().get("groups").size());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<TournamentMatch>> knockout = ArgumentCaptor.forClass(List.class);
        verify(tournamentMatchRepository).saveAllAndFlush(knockout.capture());
        List<TournamentMatch> bracket = knockout.getValue();
        assertEquals(3, bracket.size());
        bracket.forEach(match -> assertEquals(MatchStage.KNOCKOUT, match.getStage()));
        // group winners cannot meet before the final
        assertEquals(players.get(0), bracket.get(0).getParticipant1Id());
        assertEquals(players.get(5), bracket.get(0).getParticipant2Id());
        assertEquals(players.get(4), bracket.get(1).getParticipant1Id());
        assertEquals(players.get(1), bracket.get(1).getParticipant2Id());

        assertEquals(TournamentStatus.KNOCKOUT_STAGE, tournament.getStatus());
        verify(tournamentRankingService).recompute(any(), any());
        verify(tournamentRepository).save(tournament);
    }

    @Test
    void secondFinalizeReturnsTheStoredSnapshot() {
        QualifierSnapshot stored = new QualifierSnapshot();
        stored.setTournamentId(tournament.getTournamentId());
        stored.setQualifiersPerGroup(2);
        tournament.setStatus(TournamentStatus.KNOCKOUT_STAGE);
        when(qualifierSnapshotRepository.findById(tournament.getTournamentId())).thenReturn(Optional.of(stored));

        QualifierSnapshot snapshot = finalizer.finalizeGroupStage(tournament.getTournamentId());

        assertSame(stored, snapshot);
        verify(tournamentMatchRepository, never()).saveAllAndFlush(anyList());
        assertEquals(TournamentStatus.KNOCKOUT_STAGE, tournament.getStatus());
    }

    @Test
    void unplayedGroupMatchesBlockFinalization() {
        playGroupsLowerIdWins();
        TournamentMatch unplayed = groupMatches.get(0);
        unplayed.setStatus(MatchStatus.SCHEDULED);
        when(qualifierSnapshotRepository.findById(tournament.getTournamentId())).thenReturn(Optional.empty());

        TournamentEngineException ex = assertThrows(
                TournamentEngineException.class,
                () -> finalizer.finalizeGroupStage(tournament.getTournamentId())
        );

        assertEquals("invalid_state", ex.getCode());
        verify(qualifierSnapshotRepository, never()).saveAndFlush(any());
    }

    @Test
    void tournamentsWithoutGroupsCannotFinalize() {
        tournament.setHeadToHeadType(HeadToHeadType.LEAGUE);

        TournamentEngineException ex = assertThrows(
                TournamentEngineException.class,
                () -> finalizer.finalizeGroupStage(tournament.getTournamentId())
        );

        assertEquals("validation_failed", ex.getCode());
    }

    private void playGroupsLowerIdWins() {
        for (TournamentMatch match : groupMatches) {
            UUID first = match.getParticipant1Id();
            UUID second = match.getParticipant2Id();
            boolean firstWins = first.toString().compareTo(second.toString()) < 0;
            complete(match, firstWins ? MatchOutcome.HeadToHead.of(1, 0) : MatchOutcome.HeadToHead.of(0, 1));
            match.setWinnerParticipantId(firstWins ? first : second);
        }
    }
}
