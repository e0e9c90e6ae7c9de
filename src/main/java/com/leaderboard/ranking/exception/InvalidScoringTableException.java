package com.leaderboard.ranking.exception;

public class InvalidScoringTableException extends LeaderboardException {
    public InvalidScoringTableException(String message) {
        super(message, "INVALID_SCORING_TABLE");
    }
}
