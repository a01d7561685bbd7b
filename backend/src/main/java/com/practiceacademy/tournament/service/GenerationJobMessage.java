package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.MatchStage;

import java.util.UUID;

public record GenerationJobMessage(
        UUID tournamentId,
        MatchStage stage,
        int attempt
) {
    public GenerationJobMessage {
        if (tournamentId == null) {
            throw new IllegalArgumentException("tournamentId is required");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage is required");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
    }

    /**
     * Jobs sharing this key would generate the same matches, so only one of them needs to wait in a queue.
     */
    public String pendingKey() {
        return tournamentId + ":" + stage.name();
    }

    public GenerationJobMessage nextAttempt() {
        return new GenerationJobMessage(tournamentId, stage, attempt + 1);
    }
}
