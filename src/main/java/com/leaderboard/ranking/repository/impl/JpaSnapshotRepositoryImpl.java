package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import com.leaderboard.ranking.repository.SnapshotRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "leaderboards.snapshot.store", havingValue = "jpa", matchIfMissing = true)
public class JpaSnapshotRepositoryImpl implements SnapshotRepository {

    private final JpaLeaderboardSnapshotRepository jpaRepository;

    @Autowired
    public JpaSnapshotRepositoryImpl(JpaLeaderboardSnapshotRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    @Transactional
    public UpsertOutcome upsert(LeaderboardSnapshot snapshot) {
        // The existence probe only classifies the write; ON CONFLICT decides the stored row
        boolean existed = findByNaturalKey(snapshot).isPresent();
        jpaRepository.upsert(
            snapshot.getSnapshotDate(),
            snapshot.getLeaderboardType(),
            snapshot.getScopeReference(),
            snapshot.getGameFilter(),
            snapshot.getSubjectType().name(),
            snapshot.getSubjectId(),
            snapshot.getPlayerId(),
            snapshot.getTeamId(),
            snapshot.getRank(),
            snapshot.getPoints(),
            snapshot.getUpdatedAt());
        return existed ? UpsertOutcome.UPDATED : UpsertOutcome.INSERTED;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LeaderboardSnapshot> findByNaturalKey(LeaderboardSnapshot probe) {
        return jpaRepository.findBySnapshotDateAndLeaderboardTypeAndScopeReferenceAndGameFilterAndSubjectTypeAndSubjectId(
            probe.getSnapshotDate(), probe.getLeaderboardType(), probe.getScopeReference(), probe.getGameFilter(),
            probe.getSubjectType(), probe.getSubjectId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeaderboardSnapshot> findHistory(SubjectType subjectType, long subjectId, String leaderboardType,
                                                 String scopeReference, String gameFilter, LocalDate fromDate) {
        if (fromDate == null) {
            return jpaRepository
                .findBySubjectTypeAndSubjectIdAndLeaderboardTypeAndScopeReferenceAndGameFilterOrderBySnapshotDateAsc(
                    subjectType, subjectId, leaderboardType, scopeReference, gameFilter);
        }
        return jpaRepository
            .findBySubjectTypeAndSubjectIdAndLeaderboardTypeAndScopeReferenceAndGameFilterAndSnapshotDateGreaterThanEqualOrderBySnapshotDateAsc(
                subjectType, subjectId, leaderboardType, scopeReference, gameFilter, fromDate);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LocalDate> findLatestDate(String leaderboardType, String scopeReference, String gameFilter) {
        return Optional.ofNullable(jpaRepository.findLatestSnapshotDate(leaderboardType, scopeReference, gameFilter));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeaderboardSnapshot> findLatestBefore(String leaderboardType, String scopeReference,
                                                      String gameFilter, LocalDate before) {
        LocalDate latest = jpaRepository.findLatestSnapshotDateBefore(leaderboardType, scopeReference, gameFilter, before);
        if (latest == null) {
            return new ArrayList<>();
        }
        return jpaRepository.findByLeaderboardTypeAndScopeReferenceAndGameFilterAndSnapshotDateOrderByRankAsc(
            leaderboardType, scopeReference, gameFilter, latest);
    }

    @Override
    @Transactional
    public int deleteOlderThan(LocalDate cutoff) {
        return jpaRepository.deleteBySnapshotDateBefore(cutoff);
    }
}
