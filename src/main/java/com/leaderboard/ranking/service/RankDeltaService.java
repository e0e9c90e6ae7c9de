package com.leaderboard.ranking.service;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import com.leaderboard.ranking.repository.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Rank movement since the latest snapshot taken before today. Movement is a
 * decoration of a leaderboard read: when the snapshot store cannot answer, the
 * read is served without it.
 */
@Service
public class RankDeltaService {

    private static final Logger logger = LoggerFactory.getLogger(RankDeltaService.class);

    private final SnapshotRepository snapshotRepository;
    private final TimeBoundedExecutor timeBoundedExecutor;
    private final Clock clock;

    @Autowired
    public RankDeltaService(SnapshotRepository snapshotRepository, TimeBoundedExecutor timeBoundedExecutor,
                            Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.timeBoundedExecutor = timeBoundedExecutor;
        this.clock = clock;
    }

    /**
     * Subject key to rank in the latest earlier snapshot of {@code scope}.
     * Empty when no earlier snapshot exists or the store fails or runs past the timeout.
     */
    public Map<String, Integer> previousRanks(LeaderboardScope scope, Duration timeout) {
        LocalDate today = LocalDate.now(clock);
        String type = scope.getType().getWireName();
        List<LeaderboardSnapshot> rows;
        try {
            rows = timeBoundedExecutor.call(
                () -> snapshotRepository.findLatestBefore(type, scope.scopeReference(), scope.gameFilter(), today),
                timeout);
        } catch (TimeoutException | ExecutionException e) {
            logger.warn("Previous ranks of {} unavailable, serving without rank changes: {}",
                scope.cacheKey(), e.getMessage());
            return new HashMap<>();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted reading previous ranks of {}", scope.cacheKey());
            return new HashMap<>();
        }

        Map<String, Integer> ranks = new HashMap<>();
        for (LeaderboardSnapshot row : rows) {
            ranks.putIfAbsent(row.subjectKey(), row.getRank());
        }
        return ranks;
    }

    /**
     * Rank of the entry's subject in {@code previousRanks}; null when the subject
     * was not ranked there.
     */
    public static Integer previousRankOf(LeaderboardEntry entry, Map<String, Integer> previousRanks) {
        SubjectType subjectType = entry.subjectType();
        if (subjectType == null) {
            return null;
        }
        return previousRanks.get(subjectType.key(entry.subjectId()));
    }
}
