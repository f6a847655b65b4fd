package com.leaderboard.ratings.service;

import com.leaderboard.ratings.model.Competitor;
import com.leaderboard.ratings.model.RankedUser;
import com.leaderboard.ratings.ranking.RankingIndex;
import com.leaderboard.ratings.repository.impl.InMemoryCompetitorRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LeaderboardServiceConcurrencyTest {

    private static final int USERS = 200;

    private LeaderboardService leaderboardService;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        leaderboardService = new LeaderboardService(new InMemoryCompetitorRepository(), new RankingIndex());
        for (int i = 0; i < USERS; i++) {
            leaderboardService.addCompetitor("user" + i, 1000 + (i % 20) * 50);
        }
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    /**
     * Ranks and order in a page come from one complete recompute pass, so they
     * must be internally consistent even while ratings keep moving.
     */
    private static void assertRanksFromOnePass(List<RankedUser> page, int firstRank) {
        assertFalse(page.isEmpty());
        assertEquals(firstRank, page.get(0).getRank());
        for (int i = 0; i < page.size(); i++) {
            RankedUser user = page.get(i);
            assertTrue(user.getRating() >= Competitor.MIN_RATING && user.getRating() <= Competitor.MAX_RATING);
            assertTrue(user.getRank() >= 1 && user.getRank() <= USERS);
            if (i > 0) {
                assertTrue(user.getRank() >= page.get(i - 1).getRank());
            }
            // Competition ranking never exceeds the position on the page
            assertTrue(user.getRank() <= firstRank + i);
        }
    }

    @Test
    void testConcurrentUpdatesOnDistinctHandles_ThenReadSeesFullPostUpdateRanking() throws Exception {
        // Arrange
        Map<String, Integer> expectedRatings = new HashMap<>();
        for (int i = 0; i < USERS; i++) {
            expectedRatings.put("user" + i, 100 + (i * 37) % 4901);
        }
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // Act
        for (int t = 0; t < 8; t++) {
            int threadIndex = t;
            futures.add(executor.submit(() -> {
                startGate.await();
                for (int i = threadIndex; i < USERS; i += 8) {
                    String username = "user" + i;
                    assertTrue(leaderboardService.updateRating(username, expectedRatings.get(username)));
                }
                return null;
            }));
        }
        startGate.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        List<RankedUser> page = leaderboardService.getLeaderboard(1, USERS);

        // Assert
        assertEquals(USERS, page.size());
        for (RankedUser user : page) {
            assertEquals(expectedRatings.get(user.getUsername()).intValue(), user.getRating());
            long strictlyBetter = expectedRatings.values().stream()
                .filter(rating -> rating > user.getRating())
                .count();
            assertEquals(strictlyBetter + 1, user.getRank());
        }
    }

    @Test
    void testReadersNeverSeeRanksFromAPartialSort() throws Exception {
        // Arrange
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // Act: 4 writers move ratings while 4 readers page and search
        for (int t = 0; t < 4; t++) {
            int seed = t;
            futures.add(executor.submit(() -> {
                Random random = new Random(seed);
                startGate.await();
                for (int i = 0; i < 2_000; i++) {
                    String username = "user" + random.nextInt(USERS);
                    leaderboardService.updateRating(username, random.nextInt(6000) - 500);
                }
                return null;
            }));
        }
        for (int t = 0; t < 4; t++) {
            int readerIndex = t;
            futures.add(executor.submit(() -> {
                startGate.await();
                for (int i = 0; i < 300; i++) {
                    if (readerIndex % 2 == 0) {
                        assertRanksFromOnePass(leaderboardService.getLeaderboard(1, 100), 1);
                        List<RankedUser> secondPage = leaderboardService.getLeaderboard(2, 100);
                        assertEquals(100, secondPage.size());
                        assertRanksFromOnePass(secondPage, secondPage.get(0).getRank());
                    } else {
                        List<RankedUser> all = leaderboardService.searchUsers("USER");
                        assertEquals(USERS, all.size());
                        assertRanksFromOnePass(all, 1);
                    }
                }
                return null;
            }));
        }
        startGate.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }

        // Assert: once writers stop, the view is fully consistent
        List<RankedUser> finalView = leaderboardService.getLeaderboard(1, USERS);
        assertEquals(USERS, finalView.size());
        for (int i = 0; i + 1 < finalView.size(); i++) {
            RankedUser current = finalView.get(i);
            RankedUser next = finalView.get(i + 1);
            assertTrue(current.getRating() >= next.getRating());
            if (current.getRating() == next.getRating()) {
                assertEquals(current.getRank(), next.getRank());
            } else {
                assertTrue(next.getRank() > current.getRank());
            }
        }
        assertEquals(USERS, leaderboardService.getTotalUsers());
    }
}
