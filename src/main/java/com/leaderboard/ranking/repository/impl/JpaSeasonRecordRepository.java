package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.SeasonRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface JpaSeasonRecordRepository extends JpaRepository<SeasonRecord, String> {
    List<SeasonRecord> findByStartsOnLessThanEqualAndEndsOnGreaterThanEqual(LocalDate startsBy, LocalDate endsOnOrAfter);
}
