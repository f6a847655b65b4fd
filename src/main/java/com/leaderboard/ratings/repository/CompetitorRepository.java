package com.leaderboard.ratings.repository;

import com.leaderboard.ratings.model.Competitor;

import java.util.List;
import java.util.Optional;

/**
 * Exclusive store of competitor records. Implementations are not thread-safe;
 * callers serialize access.
 */
public interface CompetitorRepository {
    boolean create(String handle, int rating);
    boolean updateRating(String handle, int rating);
    int count();
    Optional<Competitor> findByHandle(String handle);
    Optional<Competitor> resolve(String handleInAnyCase);
    Optional<Competitor> findByPosition(int position);
    List<Competitor> findAll();
}
