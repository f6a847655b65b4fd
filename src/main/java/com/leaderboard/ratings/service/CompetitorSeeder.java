package com.leaderboard.ratings.service;

import com.leaderboard.ratings.model.Competitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Creates the initial competitors at start-up.
 * Handles are {@code <first>_<last><n>} with {@code n} the sequence number, so they never collide.
 */
@Component
public class CompetitorSeeder implements ApplicationRunner {
    
    private static final Logger logger = LoggerFactory.getLogger(CompetitorSeeder.class);
    
    static final String[] FIRST_NAMES = {
        "rahul", "priya", "amit", "sneha", "vikram", "anjali", "rohan", "pooja",
        "arjun", "neha", "karan", "divya", "raj", "shreya", "aditya", "kavya",
        "siddharth", "riya", "varun", "meera", "akash", "tanvi", "dev", "ishita",
        "aman", "nisha", "harsh", "ananya", "kunal", "sanya"
    };
    
    static final String[] LAST_NAMES = {
        "kumar", "sharma", "patel", "singh", "verma", "gupta", "reddy", "mehta",
        "joshi", "nair", "burman", "mathur", "kapoor", "mishra", "iyer", "desai",
        "bhat", "menon", "rao", "krishnan", "agarwal", "malhotra", "chopra", "sinha",
        "pandey", "chauhan", "ghosh", "banerjee", "saxena", "trivedi"
    };
    
    private final LeaderboardService leaderboardService;
    private final int seedCount;
    private final int progressInterval;
    private final Random random;
    
    @Autowired
    public CompetitorSeeder(
            LeaderboardService leaderboardService,
            @Value("${leaderboard.seed.count:1000}") int seedCount,
            @Value("${leaderboard.seed.progress-interval:1000}") int progressInterval) {
        this(leaderboardService, seedCount, progressInterval, new Random());
    }
    
    CompetitorSeeder(LeaderboardService leaderboardService, int seedCount, int progressInterval, Random random) {
        this.leaderboardService = leaderboardService;
        this.seedCount = seedCount;
        this.progressInterval = progressInterval;
        this.random = random;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        seed(seedCount);
    }
    
    /**
     * @return the number of competitors actually created
     */
    public int seed(int count) {
        if (count <= 0) {
            logger.info("Seeding disabled (leaderboard.seed.count={})", count);
            return 0;
        }
        
        logger.info("Seeding leaderboard with {} users", count);
        int created = 0;
        for (int i = 0; i < count; i++) {
            String firstName = FIRST_NAMES[random.nextInt(FIRST_NAMES.length)];
            String lastName = LAST_NAMES[random.nextInt(LAST_NAMES.length)];
            String username = firstName + "_" + lastName + i;
            int rating = Competitor.MIN_RATING + random.nextInt(Competitor.MAX_RATING - Competitor.MIN_RATING + 1);
            
            if (leaderboardService.addCompetitor(username, rating)) {
                created++;
            }
            
            if (progressInterval > 0 && (i + 1) % progressInterval == 0) {
                logger.info("Seeded {} users...", i + 1);
            }
        }
        
        logger.info("Successfully seeded {} users (total: {})", created, leaderboardService.getTotalUsers());
        return created;
    }
}
