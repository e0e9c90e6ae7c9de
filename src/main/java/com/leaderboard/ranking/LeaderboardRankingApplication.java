package com.leaderboard.ranking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeaderboardRankingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaderboardRankingApplication.class, args);
    }
}
