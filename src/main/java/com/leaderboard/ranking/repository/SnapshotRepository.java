package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SnapshotRepository {
    /**
     * Insert the row, or overwrite rank and points of the row already stored
     * under the same natural key. Concurrent writers resolve last-write-wins.
     */
    UpsertOutcome upsert(LeaderboardSnapshot snapshot);

    Optional<LeaderboardSnapshot> findByNaturalKey(LeaderboardSnapshot probe);

    /**
     * Rows for one subject in one scope, ascending by date. {@code fromDate} is
     * inclusive; null means no lower bound.
     */
    List<LeaderboardSnapshot> findHistory(SubjectType subjectType, long subjectId, String leaderboardType,
                                          String scopeReference, String gameFilter, LocalDate fromDate);

    Optional<LocalDate> findLatestDate(String leaderboardType, String scopeReference, String gameFilter);

    /**
     * All rows of the most recent snapshot of a scope dated strictly before
     * {@code before}; empty when there is none.
     */
    List<LeaderboardSnapshot> findLatestBefore(String leaderboardType, String scopeReference, String gameFilter,
                                               LocalDate before);

    int deleteOlderThan(LocalDate cutoff);

    enum UpsertOutcome {
        INSERTED,
        UPDATED
    }
}
