package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** JSON document stored under a scope's cache key. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CachedLeaderboard {
    private List<LeaderboardEntry> entries;
    private Instant cachedAt;
}
