package com.practiceacademy.tournament.model;

public enum PlacementTier {
    FIRST_PLACE,
    SECOND_PLACE,
    THIRD_PLACE,
    TOP_25_PERCENT,
    PARTICIPATION;

    /**
     * Resolves the tier for a 1-based rank among {@code totalParticipants}.
     * The top-25% tier only applies below the podium.
     */
    public static PlacementTier forRank(int rank, int totalParticipants) {
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be positive: " + rank);
        }
        if (rank == 1) {
            return FIRST_PLACE;
        }
        if (rank == 2) {
            return SECOND_PLACE;
        }
        if (rank == 3) {
            return THIRD_PLACE;
        }
        int topQuarterCutoff = (int) Math.ceil(totalParticipants * 0.25d);
        if (rank <= topQuarterCutoff) {
            return TOP_25_PERCENT;
        }
        return PARTICIPATION;
    }
}
