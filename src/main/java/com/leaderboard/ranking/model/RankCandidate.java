package com.leaderboard.ranking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A subject with everything the tie-break chain looks at, before a rank is assigned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankCandidate {
    private Long playerId;
    private Long teamId;
    private Integer placement;
    private int points;
    private int wins;
    private int losses;
    private Instant registeredAt;
    private boolean active;
    private Instant lastUpdated;
}
