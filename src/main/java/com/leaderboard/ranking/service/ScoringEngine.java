package com.leaderboard.ranking.service;

import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.model.ScoringTable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Pure point arithmetic for tournament results.
 */
@Component
public class ScoringEngine {

    public static final int POINTS_PER_WIN = 10;

    private final ScoringTableRegistry scoringTableRegistry;

    @Autowired
    public ScoringEngine(ScoringTableRegistry scoringTableRegistry) {
        this.scoringTableRegistry = scoringTableRegistry;
    }

    /** Points for a placement under the default table. */
    public int placementPoints(int placement) {
        return placementPoints(placement, scoringTableRegistry.getDefaultTable());
    }

    public int placementPoints(int placement, ScoringTable table) {
        return table.pointsFor(placement);
    }

    public int winBonus(int wins) {
        if (wins < 0) {
            throw new InvalidRequestException("Wins cannot be negative");
        }
        return wins * POINTS_PER_WIN;
    }

    /** Placement points plus win bonus, as counted for tournament scope. */
    public int tournamentPoints(int placement, int wins, ScoringTable table) {
        return placementPoints(placement, table) + winBonus(wins);
    }
}
