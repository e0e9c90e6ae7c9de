package com.leaderboard.ranking.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(LeaderboardProperties.class)
public class LeaderboardConfig {

    // Snapshot dates and cache timestamps are UTC
    @Bean
    public Clock leaderboardClock() {
        return Clock.systemUTC();
    }
}
