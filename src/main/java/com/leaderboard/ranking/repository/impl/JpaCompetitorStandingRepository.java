package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.CompetitorStanding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaCompetitorStandingRepository extends JpaRepository<CompetitorStanding, Long> {
    List<CompetitorStanding> findBySeasonId(String seasonId);
    List<CompetitorStanding> findBySeasonIdAndGameCode(String seasonId, String gameCode);
    List<CompetitorStanding> findByGameCode(String gameCode);
}
