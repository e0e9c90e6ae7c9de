package com.leaderboard.ranking.model;

public enum SubjectType {
    PLAYER,
    TEAM;

    /**
     * The subject a ranked row is recorded under: the player when set, else the team.
     * Null when the row carries neither id.
     */
    public static SubjectType of(Long playerId, Long teamId) {
        if (playerId != null) {
            return PLAYER;
        }
        return teamId != null ? TEAM : null;
    }

    public String key(long subjectId) {
        return name() + ":" + subjectId;
    }
}
