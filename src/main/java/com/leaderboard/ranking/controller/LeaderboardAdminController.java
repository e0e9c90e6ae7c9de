package com.leaderboard.ranking.controller;

import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.dto.CacheInvalidationResponse;
import com.leaderboard.ranking.dto.SnapshotRunSummary;
import com.leaderboard.ranking.exception.LeaderboardNotFoundException;
import com.leaderboard.ranking.service.LeaderboardCacheService;
import com.leaderboard.ranking.service.SnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Operational endpoints: explicit cache invalidation and on-demand snapshot runs.
 */
@RestController
@RequestMapping("/api/v1/leaderboards")
public class LeaderboardAdminController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardAdminController.class);

    private final LeaderboardCacheService cacheService;
    private final SnapshotService snapshotService;
    private final LeaderboardProperties properties;

    @Autowired
    public LeaderboardAdminController(
            LeaderboardCacheService cacheService,
            SnapshotService snapshotService,
            LeaderboardProperties properties) {
        this.cacheService = cacheService;
        this.snapshotService = snapshotService;
        this.properties = properties;
    }

    /**
     * Drop the cached list of one scope.
     * DELETE /api/v1/leaderboards/cache/{scope}?tournamentId=T&seasonId=S&gameCode=G
     */
    @DeleteMapping("/cache/{scope}")
    public ResponseEntity<CacheInvalidationResponse> invalidateCache(
            @PathVariable String scope,
            @RequestParam(required = false) Long tournamentId,
            @RequestParam(required = false) String seasonId,
            @RequestParam(required = false) String gameCode) {
        requireApiEnabled();
        logger.info("Received DELETE request to invalidate cache - scope: {}, tournamentId: {}, seasonId: {}, gameCode: {}",
            scope, tournamentId, seasonId, gameCode);

        boolean invalidated = cacheService.invalidate(scope, tournamentId, seasonId, gameCode);
        return ResponseEntity.ok(CacheInvalidationResponse.builder()
            .scope(scope)
            .tournamentId(tournamentId)
            .seasonId(seasonId)
            .gameCode(gameCode)
            .invalidated(invalidated)
            .build());
    }

    /**
     * Snapshot every tracked leaderboard now.
     * POST /api/v1/leaderboards/snapshots/run?date=yyyy-MM-dd
     */
    @PostMapping("/snapshots/run")
    public ResponseEntity<SnapshotRunSummary> runSnapshot(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        requireApiEnabled();
        logger.info("Received POST request to run snapshot - date: {}", date != null ? date : "today");

        try {
            SnapshotRunSummary summary = date != null
                ? snapshotService.runSnapshot(date)
                : snapshotService.runDailySnapshot();
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error running snapshot - date: {}, error: {}", date, e.getMessage());
            throw e;
        }
    }

    private void requireApiEnabled() {
        if (!properties.isApiEnabled()) {
            throw new LeaderboardNotFoundException("Leaderboard API is disabled");
        }
    }
}
