package com.leaderboard.ranking.service;

import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.dto.HistoryPoint;
import com.leaderboard.ranking.dto.PlayerHistoryResponse;
import com.leaderboard.ranking.dto.SnapshotRunSummary;
import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.exception.RecordStoreException;
import com.leaderboard.ranking.model.CachedHistory;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import com.leaderboard.ranking.repository.CompetitionRecordRepository;
import com.leaderboard.ranking.repository.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Daily point-in-time copies of every tracked leaderboard, and the per-player
 * rank history read back from them.
 */
@Service
public class SnapshotService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotService.class);

    private final SnapshotRepository snapshotRepository;
    private final CompetitionRecordRepository recordRepository;
    private final LeaderboardComputer leaderboardComputer;
    private final LeaderboardCacheService cacheService;
    private final LeaderboardProperties properties;
    private final Clock clock;

    @Autowired
    public SnapshotService(
            SnapshotRepository snapshotRepository,
            CompetitionRecordRepository recordRepository,
            LeaderboardComputer leaderboardComputer,
            LeaderboardCacheService cacheService,
            LeaderboardProperties properties,
            Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.recordRepository = recordRepository;
        this.leaderboardComputer = leaderboardComputer;
        this.cacheService = cacheService;
        this.properties = properties;
        this.clock = clock;
    }

    public SnapshotRunSummary runDailySnapshot() {
        return runSnapshot(today());
    }

    /**
     * Snapshot every tracked scope for {@code date}. Re-running for the same
     * date overwrites rank and points in place, so repeated runs converge.
     *
     * @throws InvalidRequestException the date lies in the future
     */
    public SnapshotRunSummary runSnapshot(LocalDate date) {
        LocalDate snapshotDate = date != null ? date : today();
        if (snapshotDate.isAfter(today())) {
            throw new InvalidRequestException("Snapshot date " + snapshotDate + " is in the future");
        }

        if (!properties.isComputeEnabled()) {
            logger.info("Computation disabled, skipping snapshot for {}", snapshotDate);
            return SnapshotRunSummary.builder()
                .date(snapshotDate)
                .status(SnapshotRunSummary.STATUS_SKIPPED)
                .build();
        }

        long started = System.nanoTime();
        List<LeaderboardScope> scopes = trackedScopes(snapshotDate);
        logger.info("Starting snapshot for {} across {} scopes", snapshotDate, scopes.size());

        SnapshotRunSummary summary = SnapshotRunSummary.builder()
            .date(snapshotDate)
            .status(SnapshotRunSummary.STATUS_COMPLETED)
            .build();

        for (LeaderboardScope scope : scopes) {
            try {
                snapshotScope(scope, snapshotDate, summary);
            } catch (RuntimeException e) {
                summary.setScopesFailed(summary.getScopesFailed() + 1);
                logger.error("Snapshot of {} for {} failed", scope.cacheKey(), snapshotDate, e);
            }
        }

        summary.setDurationMs((System.nanoTime() - started) / 1_000_000);
        logger.info("Snapshot for {} finished: {} scopes processed, {} skipped, {} failed, {} rows inserted, {} updated",
            snapshotDate, summary.getScopesProcessed(), summary.getScopesSkipped(), summary.getScopesFailed(),
            summary.getRowsInserted(), summary.getRowsUpdated());
        return summary;
    }

    private void snapshotScope(LeaderboardScope scope, LocalDate snapshotDate, SnapshotRunSummary summary) {
        String type = scope.getType().getWireName();
        Optional<LocalDate> latest = snapshotRepository.findLatestDate(type, scope.scopeReference(), scope.gameFilter());
        if (latest.isPresent() && latest.get().isAfter(snapshotDate)) {
            logger.info("Skipping {} for {}: newer snapshot from {} exists", scope.cacheKey(), snapshotDate, latest.get());
            summary.setScopesSkipped(summary.getScopesSkipped() + 1);
            return;
        }

        List<LeaderboardEntry> entries = leaderboardComputer.compute(scope, properties.getSnapshot().getScopeTimeout());
        Instant now = clock.instant();
        Set<Long> players = new LinkedHashSet<>();
        Set<String> subjects = new HashSet<>();

        for (LeaderboardEntry entry : entries) {
            LeaderboardSnapshot row = toSnapshot(scope, entry, snapshotDate, now);
            if (row == null) {
                continue;
            }
            // Entries arrive in rank order, so the best-ranked row of a subject is kept
            if (!subjects.add(row.subjectKey())) {
                logger.warn("Skipping rank {} of {} for {}: {} already recorded at a better rank",
                    entry.getRank(), scope.cacheKey(), snapshotDate, row.subjectKey());
                continue;
            }
            if (snapshotRepository.upsert(row) == SnapshotRepository.UpsertOutcome.INSERTED) {
                summary.setRowsInserted(summary.getRowsInserted() + 1);
            } else {
                summary.setRowsUpdated(summary.getRowsUpdated() + 1);
            }
            if (row.getSubjectType() == SubjectType.PLAYER) {
                players.add(row.getSubjectId());
            }
        }

        for (Long playerId : players) {
            cacheService.invalidatePlayerHistory(playerId, scope);
        }
        summary.setScopesProcessed(summary.getScopesProcessed() + 1);
        logger.debug("Snapshotted {} entries of {} for {}", entries.size(), scope.cacheKey(), snapshotDate);
    }

    static LeaderboardSnapshot toSnapshot(LeaderboardScope scope, LeaderboardEntry entry, LocalDate date,
                                          Instant updatedAt) {
        SubjectType subjectType = entry.subjectType();
        if (subjectType == null) {
            return null;
        }
        return LeaderboardSnapshot.builder()
            .snapshotDate(date)
            .leaderboardType(scope.getType().getWireName())
            .scopeReference(scope.scopeReference())
            .gameFilter(scope.gameFilter())
            .subjectType(subjectType)
            .subjectId(entry.subjectId())
            .playerId(entry.getPlayerId())
            .teamId(entry.getTeamId())
            .rank(entry.getRank())
            .points(entry.getPoints())
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Active tournaments, active seasons and all time; seasons and all time once
     * across every game plus once per configured game code.
     */
    List<LeaderboardScope> trackedScopes(LocalDate date) {
        List<Long> tournamentIds;
        List<String> seasonIds;
        try {
            tournamentIds = recordRepository.fetchActiveTournamentIds();
            seasonIds = recordRepository.fetchActiveSeasonIds(date);
        } catch (RuntimeException e) {
            throw new RecordStoreException("Failed to list active tournaments and seasons: " + e.getMessage(), e);
        }

        List<String> games = new ArrayList<>();
        games.add(null);
        games.addAll(properties.getSnapshot().getGameCodes());

        Set<LeaderboardScope> scopes = new LinkedHashSet<>();
        for (Long tournamentId : tournamentIds) {
            scopes.add(LeaderboardScope.tournament(tournamentId));
        }
        for (String seasonId : seasonIds) {
            for (String game : games) {
                scopes.add(LeaderboardScope.season(seasonId, game));
            }
        }
        for (String game : games) {
            scopes.add(LeaderboardScope.allTime(game));
        }
        return new ArrayList<>(scopes);
    }

    /**
     * Rank history of a player in one scope, oldest first.
     *
     * @param scope defaults to all time across every game when null
     * @param days  only the last {@code days} days when set; must be positive
     */
    public PlayerHistoryResponse getPlayerHistory(long playerId, LeaderboardScope scope, Integer days) {
        if (days != null && days < 1) {
            throw new InvalidRequestException("days must be a positive number");
        }
        LeaderboardScope historyScope = scope != null ? scope : LeaderboardScope.allTime(null);

        if (!properties.isComputeEnabled()) {
            return PlayerHistoryResponse.builder()
                .playerId(playerId)
                .history(new ArrayList<>())
                .count(0)
                .computationEnabled(false)
                .build();
        }

        boolean cacheHit = false;
        List<HistoryPoint> history;
        Optional<CachedHistory> cached = cacheService.getCachedHistory(playerId, historyScope,
            properties.getRequestTimeout());
        if (cached.isPresent() && cached.get().getHistory() != null) {
            history = cached.get().getHistory();
            cacheHit = true;
        } else {
            history = snapshotRepository.findHistory(SubjectType.PLAYER, playerId,
                    historyScope.getType().getWireName(), historyScope.scopeReference(),
                    historyScope.gameFilter(), null)
                .stream()
                .map(HistoryPoint::from)
                .toList();
            cacheService.cacheHistory(playerId, historyScope, history, properties.getRequestTimeout());
        }

        LocalDate fromDate = days != null ? today().minusDays(days) : null;
        List<HistoryPoint> window = history.stream()
            .filter(point -> fromDate == null || !point.getDate().isBefore(fromDate))
            .sorted(Comparator.comparing(HistoryPoint::getDate))
            .toList();

        return PlayerHistoryResponse.builder()
            .playerId(playerId)
            .history(window)
            .count(window.size())
            .cacheHit(cacheHit)
            .build();
    }

    /**
     * Delete snapshot rows dated before {@code retentionDays} days ago.
     *
     * @return number of rows removed
     */
    public int purgeSnapshotsOlderThan(int retentionDays) {
        if (retentionDays < 1) {
            throw new InvalidRequestException("Retention must be at least one day");
        }
        LocalDate cutoff = today().minusDays(retentionDays);
        int deleted = snapshotRepository.deleteOlderThan(cutoff);
        logger.info("Purged {} snapshot rows dated before {}", deleted, cutoff);
        return deleted;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
