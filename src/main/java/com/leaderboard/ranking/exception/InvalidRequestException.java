package com.leaderboard.ranking.exception;

/**
 * Malformed request or configuration error (bad scope name, missing season id,
 * out-of-range paging). Surfaced as HTTP 400, never silently defaulted.
 */
public class InvalidRequestException extends LeaderboardException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
