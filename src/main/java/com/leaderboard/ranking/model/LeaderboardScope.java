package com.leaderboard.ranking.model;

import com.leaderboard.ranking.exception.InvalidRequestException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Boundary of one leaderboard instance: a single tournament, a season
 * (optionally narrowed to one game) or all time (optionally narrowed to one game).
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LeaderboardScope {

    public static final String ALL_GAMES = "ALL";

    private static final String CACHE_KEY_PREFIX = "lb:";

    private final ScopeType type;
    private final Long tournamentId;
    private final String seasonId;
    private final String gameCode;

    private LeaderboardScope(ScopeType type, Long tournamentId, String seasonId, String gameCode) {
        this.type = type;
        this.tournamentId = tournamentId;
        this.seasonId = seasonId;
        this.gameCode = gameCode;
    }

    public static LeaderboardScope tournament(long tournamentId) {
        return new LeaderboardScope(ScopeType.TOURNAMENT, tournamentId, null, null);
    }

    public static LeaderboardScope season(String seasonId, String gameCode) {
        if (isBlank(seasonId)) {
            throw new InvalidRequestException("season_id is required for scope=season");
        }
        return new LeaderboardScope(ScopeType.SEASON, null, seasonId.trim(), normalizeGame(gameCode));
    }

    public static LeaderboardScope allTime(String gameCode) {
        return new LeaderboardScope(ScopeType.ALL_TIME, null, null, normalizeGame(gameCode));
    }

    /**
     * Parse a season or all-time scope from request parameters.
     * Tournament scope has its own entry point and is rejected here.
     */
    public static LeaderboardScope parseAggregate(String scope, String seasonId, String gameCode) {
        ScopeType type = ScopeType.fromWireName(scope);
        if (type == ScopeType.SEASON) {
            return season(seasonId, gameCode);
        }
        if (type == ScopeType.ALL_TIME) {
            return allTime(gameCode);
        }
        throw new InvalidRequestException("Invalid scope: " + scope + ". Must be 'season' or 'all_time'");
    }

    /**
     * Parse any scope, including tournament, from request parameters.
     */
    public static LeaderboardScope parse(String scope, Long tournamentId, String seasonId, String gameCode) {
        if (ScopeType.fromWireName(scope) == ScopeType.TOURNAMENT) {
            if (tournamentId == null) {
                throw new InvalidRequestException("tournament_id is required for scope=tournament");
            }
            return tournament(tournamentId);
        }
        return parseAggregate(scope, seasonId, gameCode);
    }

    public String cacheKey() {
        switch (type) {
            case TOURNAMENT:
                return CACHE_KEY_PREFIX + "tournament:" + tournamentId;
            case SEASON:
                return CACHE_KEY_PREFIX + "season:" + seasonId + ":" + gameFilter();
            default:
                return CACHE_KEY_PREFIX + "all_time:" + gameFilter();
        }
    }

    /** Tournament id or season id; empty for all-time. */
    public String scopeReference() {
        switch (type) {
            case TOURNAMENT:
                return String.valueOf(tournamentId);
            case SEASON:
                return seasonId;
            default:
                return "";
        }
    }

    public String gameFilter() {
        return gameCode != null ? gameCode : ALL_GAMES;
    }

    private static String normalizeGame(String gameCode) {
        if (isBlank(gameCode) || ALL_GAMES.equalsIgnoreCase(gameCode.trim())) {
            return null;
        }
        return gameCode.trim().toLowerCase();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
