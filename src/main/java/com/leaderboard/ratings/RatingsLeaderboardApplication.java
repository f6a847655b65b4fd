package com.leaderboard.ratings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RatingsLeaderboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(RatingsLeaderboardApplication.class, args);
    }
}
