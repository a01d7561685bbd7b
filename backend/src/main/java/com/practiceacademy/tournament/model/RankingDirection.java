package com.practiceacademy.tournament.model;

public enum RankingDirection {
    /**
     * Lower value ranks higher.
     */
    ASCENDING,
    /**
     * Higher value ranks higher.
     */
    DESCENDING
}
