package com.leaderboard.ratings.ranking;

import com.leaderboard.ratings.model.Competitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Ordered, tie-ranked view over the registry's competitor records.
 * <p>
 * The index keeps references to the registry's own records and rewrites their
 * {@code rank} on every recompute pass. Competitors are ordered by rating
 * descending, then handle ascending; ranks follow competition ranking, so tied
 * ratings share a rank and the next distinct rating takes its count-based position
 * (5000, 5000, 4990 ranks as 1, 1, 3).
 * <p>
 * Not thread-safe. A recompute pass mutates shared records and must run under
 * exclusive access.
 */
@Component
public class RankingIndex {
    
    private static final Logger logger = LoggerFactory.getLogger(RankingIndex.class);
    
    public static final Comparator<Competitor> RANKING_ORDER = Comparator
        .comparingInt(Competitor::getRating).reversed()
        .thenComparing(Competitor::getHandle);
    
    private final List<Competitor> ordered = new ArrayList<>();
    private final Map<Integer, Integer> firstRankByRating = new HashMap<>();
    private RankingState state = RankingState.DIRTY;
    
    public void markDirty() {
        state = state.onMutation();
    }
    
    public RankingState getState() {
        return state;
    }
    
    /**
     * Re-sorts and re-ranks when dirty.
     *
     * @param records the registry's records in insertion order; the registry only
     *                ever appends, so records past the indexed count are new
     * @return true if a pass ran, false if the view was already clean
     */
    public boolean recompute(List<Competitor> records) {
        if (!state.needsRecompute()) {
            return false;
        }
        
        long startNanos = System.nanoTime();
        
        // Previous order is kept so the stable sort starts from nearly sorted input.
        for (int i = ordered.size(); i < records.size(); i++) {
            ordered.add(records.get(i));
        }
        ordered.sort(RANKING_ORDER);
        
        firstRankByRating.clear();
        int currentRank = 1;
        for (int i = 0; i < ordered.size(); i++) {
            Competitor competitor = ordered.get(i);
            if (i > 0 && ordered.get(i - 1).getRating() != competitor.getRating()) {
                currentRank = i + 1;
            }
            competitor.setRank(currentRank);
            firstRankByRating.putIfAbsent(competitor.getRating(), currentRank);
        }
        
        state = state.onRecompute();
        
        logger.debug("Recomputed ranks for {} competitors ({} distinct ratings) in {} us",
            ordered.size(), firstRankByRating.size(), (System.nanoTime() - startNanos) / 1_000);
        return true;
    }
    
    public List<Competitor> ordered() {
        return Collections.unmodifiableList(ordered);
    }
    
    /**
     * Rank held by the given rating as of the last recompute pass.
     */
    public OptionalInt rankForRating(int rating) {
        Integer rank = firstRankByRating.get(rating);
        return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
    }
}
