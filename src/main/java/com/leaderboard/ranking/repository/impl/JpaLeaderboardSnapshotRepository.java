package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaLeaderboardSnapshotRepository extends JpaRepository<LeaderboardSnapshot, Long> {

    Optional<LeaderboardSnapshot> findBySnapshotDateAndLeaderboardTypeAndScopeReferenceAndGameFilterAndSubjectTypeAndSubjectId(
        LocalDate snapshotDate, String leaderboardType, String scopeReference, String gameFilter,
        SubjectType subjectType, Long subjectId);

    List<LeaderboardSnapshot> findBySubjectTypeAndSubjectIdAndLeaderboardTypeAndScopeReferenceAndGameFilterOrderBySnapshotDateAsc(
        SubjectType subjectType, Long subjectId, String leaderboardType, String scopeReference, String gameFilter);

    List<LeaderboardSnapshot> findBySubjectTypeAndSubjectIdAndLeaderboardTypeAndScopeReferenceAndGameFilterAndSnapshotDateGreaterThanEqualOrderBySnapshotDateAsc(
        SubjectType subjectType, Long subjectId, String leaderboardType, String scopeReference, String gameFilter,
        LocalDate fromDate);

    @Query("select max(s.snapshotDate) from LeaderboardSnapshot s "
        + "where s.leaderboardType = :type and s.scopeReference = :scopeReference and s.gameFilter = :gameFilter")
    LocalDate findLatestSnapshotDate(@Param("type") String leaderboardType,
                                     @Param("scopeReference") String scopeReference,
                                     @Param("gameFilter") String gameFilter);

    @Query("select max(s.snapshotDate) from LeaderboardSnapshot s "
        + "where s.leaderboardType = :type and s.scopeReference = :scopeReference and s.gameFilter = :gameFilter "
        + "and s.snapshotDate < :before")
    LocalDate findLatestSnapshotDateBefore(@Param("type") String leaderboardType,
                                           @Param("scopeReference") String scopeReference,
                                           @Param("gameFilter") String gameFilter,
                                           @Param("before") LocalDate before);

    List<LeaderboardSnapshot> findByLeaderboardTypeAndScopeReferenceAndGameFilterAndSnapshotDateOrderByRankAsc(
        String leaderboardType, String scopeReference, String gameFilter, LocalDate snapshotDate);

    /**
     * PostgreSQL upsert on the natural key; the row written last wins.
     */
    @Modifying
    @Query(value = "INSERT INTO leaderboard_snapshots "
        + "(snapshot_date, leaderboard_type, scope_reference, game_filter, subject_type, subject_id, "
        + " player_id, team_id, rank, points, updated_at) "
        + "VALUES (:snapshotDate, :leaderboardType, :scopeReference, :gameFilter, :subjectType, :subjectId, "
        + " CAST(:playerId AS BIGINT), CAST(:teamId AS BIGINT), :rank, :points, :updatedAt) "
        + "ON CONFLICT (snapshot_date, leaderboard_type, scope_reference, game_filter, subject_type, subject_id) "
        + "DO UPDATE SET rank = EXCLUDED.rank, points = EXCLUDED.points, player_id = EXCLUDED.player_id, "
        + " team_id = EXCLUDED.team_id, updated_at = EXCLUDED.updated_at",
        nativeQuery = true)
    int upsert(@Param("snapshotDate") LocalDate snapshotDate,
               @Param("leaderboardType") String leaderboardType,
               @Param("scopeReference") String scopeReference,
               @Param("gameFilter") String gameFilter,
               @Param("subjectType") String subjectType,
               @Param("subjectId") Long subjectId,
               @Param("playerId") Long playerId,
               @Param("teamId") Long teamId,
               @Param("rank") int rank,
               @Param("points") int points,
               @Param("updatedAt") Instant updatedAt);

    @Modifying
    @Query("delete from LeaderboardSnapshot s where s.snapshotDate < :cutoff")
    int deleteBySnapshotDateBefore(@Param("cutoff") LocalDate cutoff);
}
