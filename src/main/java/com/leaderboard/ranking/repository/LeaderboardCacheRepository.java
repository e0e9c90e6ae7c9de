package com.leaderboard.ranking.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache backend holding serialized leaderboards.
 */
public interface LeaderboardCacheRepository {
    Optional<String> get(String key);
    void put(String key, String value, Duration ttl);
    boolean delete(String key);
    boolean isAvailable();
}
