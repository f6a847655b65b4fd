package com.leaderboard.ratings.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

/**
 * A competitor record owned by the registry.
 * The rank is derived by the ranking index and is stale while the index is dirty;
 * 0 means the record has never been ranked.
 */
@Getter
@Setter
@AllArgsConstructor
public class Competitor {

    public static final int MIN_RATING = 100;
    public static final int MAX_RATING = 5000;
    public static final int UNRANKED = 0;

    private final String handle;
    private int rating;
    private int rank;

    public static Competitor unranked(String handle, int rating) {
        return new Competitor(handle, clampRating(rating), UNRANKED);
    }

    public static int clampRating(int rating) {
        if (rating < MIN_RATING) {
            return MIN_RATING;
        }
        if (rating > MAX_RATING) {
            return MAX_RATING;
        }
        return rating;
    }

    /**
     * Value copy of the current state, detached from later mutation.
     */
    public RankedUser snapshot() {
        return RankedUser.builder()
            .username(handle)
            .rating(rating)
            .rank(rank)
            .build();
    }
}
