package com.leaderboard.ranking.exception;

/**
 * The competition record store failed or did not answer within the caller's
 * timeout. No leaderboard can be computed without it, so this propagates.
 */
public class RecordStoreException extends LeaderboardException {
    public RecordStoreException(String message, Throwable cause) {
        super(message, "RECORD_STORE_ERROR", cause);
    }
}
