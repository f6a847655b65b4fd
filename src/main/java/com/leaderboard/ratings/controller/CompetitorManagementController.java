package com.leaderboard.ratings.controller;

import com.leaderboard.ratings.dto.CreateUserRequest;
import com.leaderboard.ratings.dto.UpdateRatingRequest;
import com.leaderboard.ratings.exception.DuplicateUserException;
import com.leaderboard.ratings.exception.UserNotFoundException;
import com.leaderboard.ratings.model.RankedUser;
import com.leaderboard.ratings.service.LeaderboardService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for adding competitors and setting ratings by hand.
 */
@RestController
@RequestMapping("/api/users")
public class CompetitorManagementController {
    
    private static final Logger logger = LoggerFactory.getLogger(CompetitorManagementController.class);
    
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public CompetitorManagementController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }
    
    /**
     * Create a competitor. The rating is clamped into [100, 5000].
     * POST /api/users
     */
    @PostMapping
    public ResponseEntity<RankedUser> createUser(@Valid @RequestBody CreateUserRequest request) {
        logger.info("Received POST request to create user - username: {}, rating: {}", 
            request.getUsername(), request.getRating());
        
        if (!leaderboardService.addCompetitor(request.getUsername(), request.getRating())) {
            throw new DuplicateUserException(request.getUsername());
        }
        
        RankedUser created = leaderboardService.findUser(request.getUsername())
            .orElseThrow(() -> new UserNotFoundException(request.getUsername()));
        
        logger.info("Successfully created user - username: {}, rating: {}, rank: {}", 
            created.getUsername(), created.getRating(), created.getRank());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
    
    /**
     * Set a user's rating. The username must match exactly.
     * PUT /api/users/{username}/rating
     */
    @PutMapping("/{username}/rating")
    public ResponseEntity<RankedUser> updateRating(
            @PathVariable String username,
            @Valid @RequestBody UpdateRatingRequest request) {
        
        logger.info("Received PUT request to update rating - username: {}, rating: {}", 
            username, request.getRating());
        
        if (!leaderboardService.updateRating(username, request.getRating())) {
            logger.warn("Rating update for unknown user: {}", username);
            throw new UserNotFoundException(username);
        }
        
        RankedUser updated = leaderboardService.findUser(username)
            .orElseThrow(() -> new UserNotFoundException(username));
        
        logger.info("Successfully updated rating - username: {}, rating: {}, rank: {}", 
            username, updated.getRating(), updated.getRank());
        return ResponseEntity.ok(updated);
    }
}
