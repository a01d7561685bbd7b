package com.practiceacademy.tournament.model;

public enum TournamentStatus {
    DRAFT,
    ACTIVE,
    GROUP_STAGE,
    KNOCKOUT_STAGE,
    RESULTS_COMPLETE,
    COMPLETED,
    REWARDS_DISTRIBUTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == REWARDS_DISTRIBUTED || this == CANCELLED;
    }

    public boolean acceptsResults() {
        return this == ACTIVE || this == GROUP_STAGE || this == KNOCKOUT_STAGE;
    }
}
