package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.TournamentMatch;

import java.util.List;
import java.util.UUID;

public record GenerationResult(
        UUID tournamentId,
        Outcome outcome,
        List<TournamentMatch> matches
) {

    public static GenerationResult generated(UUID tournamentId, List<TournamentMatch> matches) {
        return new GenerationResult(tournamentId, Outcome.GENERATED, List.copyOf(matches));
    }

    public static GenerationResult alreadyGenerated(UUID tournamentId, List<TournamentMatch> matches) {
        return new GenerationResult(tournamentId, Outcome.ALREADY_GENERATED, List.copyOf(matches));
    }

    public static GenerationResult queued(UUID tournamentId) {
        return new GenerationResult(tournamentId, Outcome.QUEUED, List.of());
    }

    public enum Outcome {
        GENERATED,
        ALREADY_GENERATED,
        QUEUED
    }
}
