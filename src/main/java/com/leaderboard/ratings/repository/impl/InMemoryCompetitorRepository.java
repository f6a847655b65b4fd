package com.leaderboard.ratings.repository.impl;

import com.leaderboard.ratings.model.Competitor;
import com.leaderboard.ratings.repository.CompetitorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Competitor records kept in insertion order, with a handle-to-position index and
 * a case-folded handle index. A rating update rewrites a single slot in place.
 */
@Repository
public class InMemoryCompetitorRepository implements CompetitorRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCompetitorRepository.class);
    
    private final List<Competitor> records = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final Map<String, String> foldedHandles = new HashMap<>();
    
    @Override
    public boolean create(String handle, int rating) {
        validateHandle(handle);
        
        String folded = fold(handle);
        if (positions.containsKey(handle) || foldedHandles.containsKey(folded)) {
            logger.warn("Rejected duplicate competitor handle: {} (existing: {})",
                handle, foldedHandles.getOrDefault(folded, handle));
            return false;
        }
        
        records.add(Competitor.unranked(handle, rating));
        positions.put(handle, records.size() - 1);
        foldedHandles.put(folded, handle);
        return true;
    }
    
    @Override
    public boolean updateRating(String handle, int rating) {
        Integer position = handle == null ? null : positions.get(handle);
        if (position == null) {
            return false;
        }
        
        records.get(position).setRating(Competitor.clampRating(rating));
        return true;
    }
    
    @Override
    public int count() {
        return records.size();
    }
    
    @Override
    public Optional<Competitor> findByHandle(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        Integer position = positions.get(handle);
        return position == null ? Optional.empty() : Optional.of(records.get(position));
    }
    
    @Override
    public Optional<Competitor> resolve(String handleInAnyCase) {
        if (handleInAnyCase == null || handleInAnyCase.trim().isEmpty()) {
            return Optional.empty();
        }
        String handle = foldedHandles.get(fold(handleInAnyCase));
        return handle == null ? Optional.empty() : findByHandle(handle);
    }
    
    @Override
    public Optional<Competitor> findByPosition(int position) {
        if (position < 0 || position >= records.size()) {
            return Optional.empty();
        }
        return Optional.of(records.get(position));
    }
    
    @Override
    public List<Competitor> findAll() {
        return Collections.unmodifiableList(records);
    }
    
    private static String fold(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
    
    private void validateHandle(String handle) {
        if (handle == null || handle.trim().isEmpty()) {
            throw new IllegalArgumentException("Handle cannot be null or empty");
        }
    }
}
