package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.TournamentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface JpaTournamentRecordRepository extends JpaRepository<TournamentRecord, Long> {
    List<TournamentRecord> findByStatusIn(Collection<String> statuses);
}
