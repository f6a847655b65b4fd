package com.leaderboard.ratings.service;

import com.leaderboard.ratings.model.RankedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves a random competitor's rating by a bounded random delta on every tick.
 * The service clamps the result, so deltas are not pre-validated here.
 */
@Component
public class RatingUpdateSimulator {
    
    private static final Logger logger = LoggerFactory.getLogger(RatingUpdateSimulator.class);
    
    private final LeaderboardService leaderboardService;
    private final boolean enabled;
    private final int maxDelta;
    private final int logInterval;
    private final Random random;
    private final AtomicLong updateCount = new AtomicLong();
    
    @Autowired
    public RatingUpdateSimulator(
            LeaderboardService leaderboardService,
            @Value("${leaderboard.simulation.enabled:true}") boolean enabled,
            @Value("${leaderboard.simulation.max-delta:50}") int maxDelta,
            @Value("${leaderboard.simulation.log-interval:100}") int logInterval) {
        this(leaderboardService, enabled, maxDelta, logInterval, new Random());
    }
    
    RatingUpdateSimulator(LeaderboardService leaderboardService, boolean enabled, int maxDelta,
            int logInterval, Random random) {
        if (maxDelta < 0) {
            throw new IllegalArgumentException("maxDelta cannot be negative");
        }
        this.leaderboardService = leaderboardService;
        this.enabled = enabled;
        this.maxDelta = maxDelta;
        this.logInterval = logInterval;
        this.random = random;
    }
    
    /**
     * Runs every leaderboard.simulation.interval-ms (10 updates per second by default).
     */
    @Scheduled(fixedRateString = "${leaderboard.simulation.interval-ms:100}",
        initialDelayString = "${leaderboard.simulation.initial-delay-ms:1000}")
    public void simulateUpdate() {
        if (!enabled) {
            return;
        }
        
        try {
            applyRandomUpdate();
        } catch (Exception e) {
            logger.error("Error applying simulated rating update", e);
        }
    }
    
    /**
     * @return true if a competitor's rating was written
     */
    boolean applyRandomUpdate() {
        long totalUsers = leaderboardService.getTotalUsers();
        if (totalUsers == 0) {
            return false;
        }
        
        int position = random.nextInt((int) Math.min(totalUsers, Integer.MAX_VALUE));
        Optional<RankedUser> user = leaderboardService.getUserAt(position);
        if (user.isEmpty()) {
            return false;
        }
        
        int delta = random.nextInt(2 * maxDelta + 1) - maxDelta;
        String username = user.get().getUsername();
        boolean updated = leaderboardService.updateRating(username, user.get().getRating() + delta);
        
        if (updated) {
            long count = updateCount.incrementAndGet();
            if (logInterval > 0 && count % logInterval == 0) {
                logger.info("Processed {} simulated rating updates", count);
            }
        }
        return updated;
    }
    
    public long getUpdateCount() {
        return updateCount.get();
    }
}
