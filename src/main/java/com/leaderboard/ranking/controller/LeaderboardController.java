package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.dto.LeaderboardEntryView;
import com.leaderboard.ranking.dto.LeaderboardResponse;
import com.leaderboard.ranking.dto.PlayerHistoryResponse;
import com.leaderboard.ranking.exception.LeaderboardNotFoundException;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.service.LeaderboardQueryService;
import com.leaderboard.ranking.service.SnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/leaderboards")
public class LeaderboardController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardQueryService queryService;
    private final SnapshotService snapshotService;
    private final LeaderboardProperties properties;

    @Autowired
    public LeaderboardController(
            LeaderboardQueryService queryService,
            SnapshotService snapshotService,
            LeaderboardProperties properties) {
        this.queryService = queryService;
        this.snapshotService = snapshotService;
        this.properties = properties;
    }

    /**
     * Ranked entries of one tournament.
     * GET /api/v1/leaderboards/tournament/{tournamentId}?limit=N&offset=M
     */
    @GetMapping("/tournament/{tournamentId}")
    public ResponseEntity<LeaderboardResponse> getTournamentLeaderboard(
            @PathVariable long tournamentId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        requireApiEnabled();
        logger.info("Received GET request for tournament leaderboard - tournamentId: {}, limit: {}, offset: {}",
            tournamentId, limit, offset);

        try {
            LeaderboardResponse response = queryService.list(LeaderboardScope.tournament(tournamentId), limit, offset,
                properties.getRequestTimeout());
            logger.info("Served tournament leaderboard - tournamentId: {}, total: {}, returned: {}, cacheHit: {}",
                tournamentId, response.getMetadata().getCount(), response.getEntries().size(),
                response.getMetadata().isCacheHit());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error serving tournament leaderboard - tournamentId: {}, error: {}",
                tournamentId, e.getMessage());
            throw e;
        }
    }

    /**
     * Season or all-time leaderboard, optionally narrowed to one game.
     * GET /api/v1/leaderboards/{scope}?seasonId=S&gameCode=G&limit=N&offset=M
     */
    @GetMapping("/{scope}")
    public ResponseEntity<LeaderboardResponse> getScopedLeaderboard(
            @PathVariable String scope,
            @RequestParam(required = false) String seasonId,
            @RequestParam(required = false) String gameCode,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        requireApiEnabled();
        logger.info("Received GET request for {} leaderboard - seasonId: {}, gameCode: {}, limit: {}, offset: {}",
            scope, seasonId, gameCode, limit, offset);

        LeaderboardScope leaderboardScope = LeaderboardScope.parseAggregate(scope, seasonId, gameCode);
        LeaderboardResponse response = queryService.list(leaderboardScope, limit, offset,
            properties.getRequestTimeout());
        return ResponseEntity.ok(response);
    }

    /**
     * Rank of a single player within a scope.
     * GET /api/v1/leaderboards/{scope}/players/{playerId}
     */
    @GetMapping("/{scope}/players/{playerId}")
    public ResponseEntity<LeaderboardEntryView> getPlayerRank(
            @PathVariable String scope,
            @PathVariable long playerId,
            @RequestParam(required = false) Long tournamentId,
            @RequestParam(required = false) String seasonId,
            @RequestParam(required = false) String gameCode) {
        requireApiEnabled();
        logger.info("Received GET request for player rank - scope: {}, playerId: {}", scope, playerId);

        LeaderboardScope leaderboardScope = LeaderboardScope.parse(scope, tournamentId, seasonId, gameCode);
        LeaderboardEntryView entry = queryService.findPlayerRank(leaderboardScope, playerId,
                properties.getRequestTimeout())
            .orElseThrow(() -> new LeaderboardNotFoundException(
                "Player " + playerId + " is not ranked in " + leaderboardScope.cacheKey()));
        return ResponseEntity.ok(entry);
    }

    /**
     * Daily rank history of a player, oldest first.
     * GET /api/v1/leaderboards/player/{playerId}/history?scope=all_time&days=30
     */
    @GetMapping("/player/{playerId}/history")
    public ResponseEntity<PlayerHistoryResponse> getPlayerHistory(
            @PathVariable long playerId,
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) Long tournamentId,
            @RequestParam(required = false) String seasonId,
            @RequestParam(required = false) String gameCode,
            @RequestParam(required = false) Integer days) {
        requireApiEnabled();
        logger.info("Received GET request for player history - playerId: {}, scope: {}, days: {}",
            playerId, scope, days);

        LeaderboardScope historyScope = scope == null || scope.trim().isEmpty()
            ? null
            : LeaderboardScope.parse(scope, tournamentId, seasonId, gameCode);
        return ResponseEntity.ok(snapshotService.getPlayerHistory(playerId, historyScope, days));
    }

    private void requireApiEnabled() {
        if (!properties.isApiEnabled()) {
            throw new LeaderboardNotFoundException("Leaderboard API is disabled");
        }
    }
}
