package com.leaderboard.ratings.controller;

import com.leaderboard.ratings.dto.ApiStatusResponse;
import com.leaderboard.ratings.dto.LeaderboardResponse;
import com.leaderboard.ratings.dto.SearchResponse;
import com.leaderboard.ratings.dto.StatsResponse;
import com.leaderboard.ratings.exception.InvalidRequestException;
import com.leaderboard.ratings.exception.UserNotFoundException;
import com.leaderboard.ratings.model.RankedUser;
import com.leaderboard.ratings.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class LeaderboardController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);
    
    static final int DEFAULT_PAGE = 1;
    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 100;
    
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }
    
    @GetMapping({"", "/"})
    public ResponseEntity<ApiStatusResponse> getApiStatus() {
        return ResponseEntity.ok(ApiStatusResponse.builder()
            .status("running")
            .message("Leaderboard API is live!")
            .users(leaderboardService.getTotalUsers())
            .build());
    }
    
    /**
     * Get one page of the ranked leaderboard.
     * GET /api/leaderboard?page=1&pageSize=50
     * <p>
     * Never fails: a page below 1 becomes 1, a page size outside [1, 100] becomes 50,
     * and unparsable values fall back to the same defaults.
     */
    @GetMapping("/leaderboard")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String pageSize) {
        
        int pageNumber = parseOrDefault("page", page, DEFAULT_PAGE);
        int size = parseOrDefault("pageSize", pageSize, DEFAULT_PAGE_SIZE);
        
        if (pageNumber < 1) {
            pageNumber = DEFAULT_PAGE;
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            size = DEFAULT_PAGE_SIZE;
        }
        
        List<RankedUser> users = leaderboardService.getLeaderboard(pageNumber, size);
        
        LeaderboardResponse response = LeaderboardResponse.builder()
            .users(users)
            .page(pageNumber)
            .pageSize(size)
            .totalUsers(leaderboardService.getTotalUsers())
            .build();
        
        logger.debug("Returned leaderboard page {} with {} users", pageNumber, users.size());
        return ResponseEntity.ok(response);
    }
    
    /**
     * Case-insensitive substring search over usernames.
     * GET /api/search?q=term
     */
    @GetMapping("/search")
    public ResponseEntity<SearchResponse> searchUsers(@RequestParam(required = false) String q) {
        if (q == null || q.isEmpty()) {
            throw new InvalidRequestException("query parameter 'q' is required");
        }
        
        List<RankedUser> results = leaderboardService.searchUsers(q);
        
        return ResponseEntity.ok(SearchResponse.builder()
            .results(results)
            .count(results.size())
            .build());
    }
    
    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(StatsResponse.builder()
            .totalUsers(leaderboardService.getTotalUsers())
            .status("healthy")
            .build());
    }
    
    /**
     * Look up one user, ignoring case.
     * GET /api/users/{username}
     */
    @GetMapping("/users/{username}")
    public ResponseEntity<RankedUser> getUser(@PathVariable String username) {
        RankedUser user = leaderboardService.findUser(username)
            .orElseThrow(() -> new UserNotFoundException(username));
        return ResponseEntity.ok(user);
    }
    
    private int parseOrDefault(String name, String value, int defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring unparsable {} '{}', using {}", name, value, defaultValue);
            return defaultValue;
        }
    }
}
