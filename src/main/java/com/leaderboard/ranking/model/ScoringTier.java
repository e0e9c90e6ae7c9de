package com.leaderboard.ranking.model;

import lombok.Value;

/**
 * Inclusive placement range worth a fixed number of points.
 * A null {@code toPlacement} makes the tier open ended. Configuration binds
 * it through the constructor.
 */
@Value
public class ScoringTier {
    private int fromPlacement;
    private Integer toPlacement;
    private int points;

    public static ScoringTier exactly(int placement, int points) {
        return new ScoringTier(placement, placement, points);
    }

    public static ScoringTier range(int from, int to, int points) {
        return new ScoringTier(from, to, points);
    }

    public static ScoringTier andBelow(int from, int points) {
        return new ScoringTier(from, null, points);
    }

    public boolean covers(int placement) {
        return placement >= fromPlacement && (toPlacement == null || placement <= toPlacement);
    }
}
