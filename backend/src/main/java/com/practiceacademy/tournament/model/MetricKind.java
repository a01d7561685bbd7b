package com.practiceacademy.tournament.model;

public enum MetricKind {
    SCORE(RankingDirection.DESCENDING, false),
    TIME(RankingDirection.ASCENDING, false),
    DISTANCE(RankingDirection.DESCENDING, false),
    PLACEMENT(RankingDirection.ASCENDING, true),
    ROUNDS(RankingDirection.DESCENDING, true);

    private final RankingDirection defaultDirection;
    private final boolean integral;

    MetricKind(RankingDirection defaultDirection, boolean integral) {
        this.defaultDirection = defaultDirection;
        this.integral = integral;
    }

    public RankingDirection defaultDirection() {
        return defaultDirection;
    }

    public boolean isIntegral() {
        return integral;
    }
}
