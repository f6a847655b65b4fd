package com.leaderboard.ratings.exception;

public class DuplicateUserException extends LeaderboardException {
    public DuplicateUserException(String username) {
        super("User " + username + " already exists", "DUPLICATE_USER");
    }
}
