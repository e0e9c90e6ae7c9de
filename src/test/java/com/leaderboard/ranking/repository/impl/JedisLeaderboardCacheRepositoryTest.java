package com.leaderboard.ranking.repository.impl;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JedisLeaderboardCacheRepositoryTest {

    @Test
    void testNotAvailableBeforeInit() {
        JedisLeaderboardCacheRepository repository = new JedisLeaderboardCacheRepository();

        assertFalse(repository.isAvailable());
    }

    @Test
    void testBlankKeyRejected() {
        JedisLeaderboardCacheRepository repository = new JedisLeaderboardCacheRepository();

        assertThrows(IllegalArgumentException.class, () -> repository.get(" "));
        assertThrows(IllegalArgumentException.class, () -> repository.delete(null));
        assertThrows(IllegalArgumentException.class, () -> repository.put("", "{}", Duration.ofMinutes(5)));
    }

    @Test
    void testOperationsFailWithoutPool() {
        // Callers treat these failures as a cache miss
        JedisLeaderboardCacheRepository repository = new JedisLeaderboardCacheRepository();

        assertThrows(IllegalStateException.class, () -> repository.get("lb:tournament:1"));
        assertThrows(IllegalStateException.class, () -> repository.put("lb:tournament:1", "{}", Duration.ofMinutes(5)));
    }
}
