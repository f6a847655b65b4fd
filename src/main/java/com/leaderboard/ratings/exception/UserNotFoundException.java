package com.leaderboard.ratings.exception;

public class UserNotFoundException extends LeaderboardException {
    public UserNotFoundException(String username) {
        super("User not found: " + username, "USER_NOT_FOUND");
    }
}
