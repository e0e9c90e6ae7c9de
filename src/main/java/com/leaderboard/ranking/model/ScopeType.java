package com.leaderboard.ranking.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScopeType {
    TOURNAMENT("tournament"),
    SEASON("season"),
    ALL_TIME("all_time");

    private final String wireName;

    ScopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve the wire name used by the API and the snapshot table.
     * Returns {@code null} for anything unknown so callers can word their own error.
     */
    public static ScopeType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (ScopeType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
