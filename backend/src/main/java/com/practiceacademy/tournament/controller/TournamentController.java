package com.practiceacademy.tournament.controller;

import com.practiceacademy.tournament.dto.RewardConfig;
import com.practiceacademy.tournament.dto.TournamentRequests;
import com.practiceacademy.tournament.dto.TournamentResponses;
import com.practiceacademy.tournament.service.DistributionSummary;
import com.practiceacademy.tournament.service.ParticipantRewardSummary;
import com.practiceacademy.tournament.service.TournamentLifecycleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentLifecycleService tournamentLifecycleService;

    public TournamentController(TournamentLifecycleService tournamentLifecycleService) {
        this.tournamentLifecycleService = tournamentLifecycleService;
    }

    @PostMapping
    public ResponseEntity<TournamentResponses.TournamentDetail> createTournament(
            @Valid @RequestBody TournamentRequests.CreateTournamentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tournamentLifecycleService.createTournament(request));
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> getTournament(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.getTournament(tournamentId));
    }

    @PostMapping("/{tournamentId}/enrollments")
    public ResponseEntity<List<TournamentResponses.Enrollment>> enroll(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody TournamentRequests.EnrollRequest request
    ) {
        return ResponseEntity.ok(tournamentLifecycleService.enroll(tournamentId, request));
    }

    @GetMapping("/{tournamentId}/enrollments")
    public ResponseEntity<List<TournamentResponses.Enrollment>> listEnrollments(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.listEnrollments(tournamentId));
    }

    @PostMapping("/{tournamentId}/start")
    public ResponseEntity<TournamentResponses.Generation> startTournament(@PathVariable UUID tournamentId) {
        TournamentResponses.Generation generation = tournamentLifecycleService.startTournament(tournamentId);
        HttpStatus status = "QUEUED".equals(generation.outcome()) ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(generation);
    }

    @GetMapping("/{tournamentId}/matches")
    public ResponseEntity<List<TournamentResponses.MatchSummary>> listMatches(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.listMatches(tournamentId));
    }

    @PostMapping("/matches/{matchId}/result")
    public ResponseEntity<TournamentResponses.MatchSummary> submitResult(
            @PathVariable UUID matchId,
            @Valid @RequestBody TournamentRequests.SubmitResultRequest request
    ) {
        return ResponseEntity.ok(tournamentLifecycleService.submitResult(matchId, request));
    }

    @PostMapping("/{tournamentId}/group-stage/finalize")
    public ResponseEntity<TournamentResponses.QualifierSnapshotView> finalizeGroupStage(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.finalizeGroupStage(tournamentId));
    }

    @GetMapping("/{tournamentId}/group-stage/qualifiers")
    public ResponseEntity<TournamentResponses.QualifierSnapshotView> getQualifiers(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.getQualifierSnapshot(tournamentId));
    }

    @PostMapping("/{tournamentId}/complete")
    public ResponseEntity<TournamentResponses.TournamentDetail> completeTournament(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.completeTournament(tournamentId));
    }

    @PostMapping("/{tournamentId}/cancel")
    public ResponseEntity<TournamentResponses.TournamentDetail> cancelTournament(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody(required = false) TournamentRequests.CancelTournamentRequest request
    ) {
        String reason = request == null ? null : request.reason();
        return ResponseEntity.ok(tournamentLifecycleService.cancelTournament(tournamentId, reason));
    }

    @GetMapping("/{tournamentId}/rankings")
    public ResponseEntity<List<TournamentResponses.RankingEntry>> getRankings(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.getRankings(tournamentId));
    }

    @PutMapping("/{tournamentId}/reward-config")
    public ResponseEntity<TournamentResponses.TournamentDetail> saveRewardConfig(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody RewardConfig rewardConfig
    ) {
        return ResponseEntity.ok(tournamentLifecycleService.saveRewardConfig(tournamentId, rewardConfig));
    }

    @PostMapping("/{tournamentId}/rewards/distribute")
    public ResponseEntity<DistributionSummary> distributeRewards(
            @PathVariable UUID tournamentId,
            @Valid @RequestBody(required = false) TournamentRequests.DistributeRewardsRequest request
    ) {
        RewardConfig config = request == null ? null : request.rewardConfig();
        return ResponseEntity.ok(tournamentLifecycleService.distributeRewards(tournamentId, config));
    }

    @GetMapping("/{tournamentId}/rewards")
    public ResponseEntity<List<TournamentResponses.LedgerEntry>> listRewardLedger(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentLifecycleService.listRewardLedger(tournamentId));
    }

    @GetMapping("/{tournamentId}/participants/{participantId}/rewards")
    public ResponseEntity<ParticipantRewardSummary> getParticipantRewards(
            @PathVariable UUID tournamentId,
            @PathVariable UUID participantId
    ) {
        return ResponseEntity.ok(tournamentLifecycleService.participantRewardSummary(tournamentId, participantId));
    }

    @GetMapping("/participants/{participantId}/ledger")
    public ResponseEntity<List<TournamentResponses.LedgerEntry>> getParticipantLedger(@PathVariable UUID participantId) {
        return ResponseEntity.ok(tournamentLifecycleService.participantLedger(participantId));
    }
}
