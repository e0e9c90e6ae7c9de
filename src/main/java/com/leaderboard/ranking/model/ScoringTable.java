package com.leaderboard.ranking.model;

import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.exception.InvalidScoringTableException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Placement-to-points lookup for one game format. Validated on construction:
 * tiers start at placement 1, are contiguous, end with an open tier, and their
 * points never increase and never drop by more than the preceding tier is worth.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ScoringTable {

    public static final String STANDARD = "standard";
    public static final String BATTLE_ROYALE = "battle_royale";

    private final String format;
    private final List<ScoringTier> tiers;

    private ScoringTable(String format, List<ScoringTier> tiers) {
        this.format = format;
        this.tiers = tiers;
    }

    public static ScoringTable of(String format, List<ScoringTier> tiers) {
        if (format == null || format.trim().isEmpty()) {
            throw new InvalidScoringTableException("Scoring table format cannot be null or empty");
        }
        if (tiers == null || tiers.isEmpty()) {
            throw new InvalidScoringTableException("Scoring table '" + format + "' has no tiers");
        }
        List<ScoringTier> copy = new ArrayList<>(tiers);
        validate(format, copy);
        return new ScoringTable(format, Collections.unmodifiableList(copy));
    }

    /** 1st 1000, 2nd 750, 3rd 500, 4th-8th 250, 9th-16th 100, 17th and below 25. */
    public static ScoringTable standard() {
        return of(STANDARD, List.of(
            ScoringTier.exactly(1, 1000),
            ScoringTier.exactly(2, 750),
            ScoringTier.exactly(3, 500),
            ScoringTier.range(4, 8, 250),
            ScoringTier.range(9, 16, 100),
            ScoringTier.andBelow(17, 25)));
    }

    /** 1st 12, 2nd 9, 3rd 7, 4th 5, 5th-8th 3, 9th and below 0. */
    public static ScoringTable battleRoyale() {
        return of(BATTLE_ROYALE, List.of(
            ScoringTier.exactly(1, 12),
            ScoringTier.exactly(2, 9),
            ScoringTier.exactly(3, 7),
            ScoringTier.exactly(4, 5),
            ScoringTier.range(5, 8, 3),
            ScoringTier.andBelow(9, 0)));
    }

    public int pointsFor(int placement) {
        if (placement < 1) {
            throw new InvalidRequestException("Placement must be a positive integer, got " + placement);
        }
        for (ScoringTier tier : tiers) {
            if (tier.covers(placement)) {
                return tier.getPoints();
            }
        }
        // unreachable: validation guarantees an open last tier
        throw new IllegalStateException("No tier covers placement " + placement + " in table " + format);
    }

    private static void validate(String format, List<ScoringTier> tiers) {
        int expectedFrom = 1;
        ScoringTier previous = null;
        for (int i = 0; i < tiers.size(); i++) {
            ScoringTier tier = tiers.get(i);
            boolean last = i == tiers.size() - 1;

            if (tier.getFromPlacement() != expectedFrom) {
                throw new InvalidScoringTableException("Scoring table '" + format + "' tier " + (i + 1)
                    + " must start at placement " + expectedFrom + " but starts at " + tier.getFromPlacement());
            }
            if (tier.getToPlacement() == null && !last) {
                throw new InvalidScoringTableException("Scoring table '" + format
                    + "' has an open-ended tier before its last tier");
            }
            if (tier.getToPlacement() != null && last) {
                throw new InvalidScoringTableException("Scoring table '" + format
                    + "' must end with an open-ended tier so every placement scores");
            }
            if (tier.getToPlacement() != null && tier.getToPlacement() < tier.getFromPlacement()) {
                throw new InvalidScoringTableException("Scoring table '" + format + "' tier " + (i + 1)
                    + " ends before it starts");
            }
            if (tier.getPoints() < 0) {
                throw new InvalidScoringTableException("Scoring table '" + format + "' tier " + (i + 1)
                    + " has negative points");
            }
            if (previous != null && tier.getPoints() > previous.getPoints()) {
                throw new InvalidScoringTableException("Scoring table '" + format
                    + "' points increase at placement " + tier.getFromPlacement());
            }

            previous = tier;
            if (!last) {
                expectedFrom = tier.getToPlacement() + 1;
            }
        }
    }
}
