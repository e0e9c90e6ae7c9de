package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One ranked row of a computed leaderboard. Derived and cacheable, never a system of record.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {
    private ScopeType scopeType;
    private String scopeReference;
    private String gameFilter;

    private Long playerId;
    private Long teamId;

    private int rank;
    private int points;
    private int wins;
    private int losses;
    private double winRate;
    private boolean active;
    private Instant lastUpdated;

    public SubjectType subjectType() {
        return SubjectType.of(playerId, teamId);
    }

    public Long subjectId() {
        return playerId != null ? playerId : teamId;
    }

    /**
     * wins / (wins + losses), rounded to four decimals; 0 when no games were played.
     */
    public static double winRate(int wins, int losses) {
        int games = wins + losses;
        if (games <= 0) {
            return 0.0;
        }
        return Math.round(((double) wins / games) * 10_000d) / 10_000d;
    }
}
