package com.leaderboard.ratings.ranking;

/**
 * Validity of the ranked view. Writes move it to DIRTY, a recompute pass moves it back to CLEAN.
 */
public enum RankingState {
    CLEAN,
    DIRTY;

    public RankingState onMutation() {
        return DIRTY;
    }

    public RankingState onRecompute() {
        return CLEAN;
    }

    public boolean needsRecompute() {
        return this == DIRTY;
    }
}
