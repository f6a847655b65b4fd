package com.leaderboard.ratings.service;

import com.leaderboard.ratings.model.Competitor;
import com.leaderboard.ratings.model.RankedUser;
import com.leaderboard.ratings.ranking.RankingIndex;
import com.leaderboard.ratings.repository.CompetitorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Ranked queries and rating updates over the competitor registry.
 * <p>
 * One read/write lock guards the registry and the ranking index. Writes and the
 * recompute pass hold the write lock; copying results out holds the read lock.
 * Reads recompute and copy in two separate lock spans, so a write can land in
 * between: a snapshot may then carry a rating newer than the pass that ranked it.
 * Ranks and order inside a snapshot always come from one complete pass.
 */
@Service
public class LeaderboardService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    private final CompetitorRepository competitorRepository;
    private final RankingIndex rankingIndex;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired
    public LeaderboardService(CompetitorRepository competitorRepository, RankingIndex rankingIndex) {
        this.competitorRepository = competitorRepository;
        this.rankingIndex = rankingIndex;
    }

    /**
     * Add a competitor with a clamped rating.
     *
     * @return false if the handle, in any case, is already registered
     */
    public boolean addCompetitor(String username, int rating) {
        lock.writeLock().lock();
        try {
            boolean created = competitorRepository.create(username, rating);
            if (created) {
                rankingIndex.markDirty();
            }
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Set a competitor's rating, clamped into range.
     *
     * @return false if no competitor has exactly this handle; nothing changes then
     */
    public boolean updateRating(String username, int newRating) {
        lock.writeLock().lock();
        try {
            boolean updated = competitorRepository.updateRating(username, newRating);
            if (updated) {
                rankingIndex.markDirty();
            }
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Get one page of the ranked leaderboard. Pages are 1-based; a page past the
     * end is empty.
     */
    public List<RankedUser> getLeaderboard(int page, int pageSize) {
        ensureRanked();

        return withReadLock(() -> {
            List<Competitor> ordered = rankingIndex.ordered();
            long start = (long) (page - 1) * pageSize;
            if (start >= ordered.size()) {
                return Collections.<RankedUser>emptyList();
            }
            int end = (int) Math.min(start + pageSize, ordered.size());

            List<RankedUser> result = new ArrayList<>(end - (int) start);
            for (int i = (int) start; i < end; i++) {
                result.add(ordered.get(i).snapshot());
            }
            logger.debug("Served leaderboard page {} (pageSize {}): {} users", page, pageSize, result.size());
            return result;
        });
    }

    /**
     * Case-insensitive substring search over handles, in rank order.
     * An empty term matches every competitor.
     */
    public List<RankedUser> searchUsers(String searchTerm) {
        ensureRanked();
        String needle = fold(searchTerm == null ? "" : searchTerm);

        return withReadLock(() -> {
            List<RankedUser> results = new ArrayList<>();
            for (Competitor competitor : rankingIndex.ordered()) {
                if (fold(competitor.getHandle()).contains(needle)) {
                    results.add(competitor.snapshot());
                }
            }
            logger.debug("Search for '{}' matched {} users", searchTerm, results.size());
            return results;
        });
    }

    public long getTotalUsers() {
        return withReadLock(() -> (long) competitorRepository.count());
    }

    /**
     * Case-insensitive exact lookup, ranked as of a fresh recompute pass.
     */
    public Optional<RankedUser> findUser(String username) {
        ensureRanked();
        return withReadLock(() -> competitorRepository.resolve(username).map(Competitor::snapshot));
    }

    /**
     * Competitor at a registry position (insertion order), without forcing a
     * recompute; the rank may be stale.
     */
    public Optional<RankedUser> getUserAt(int position) {
        return withReadLock(() -> competitorRepository.findByPosition(position).map(Competitor::snapshot));
    }

    /**
     * Rank that the given rating holds, or empty when no competitor has it.
     */
    public OptionalInt getRankForRating(int rating) {
        ensureRanked();
        return withReadLock(() -> rankingIndex.rankForRating(rating));
    }

    private void ensureRanked() {
        lock.writeLock().lock();
        try {
            rankingIndex.recompute(competitorRepository.findAll());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T withReadLock(Supplier<T> read) {
        lock.readLock().lock();
        try {
            return read.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static String fold(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
