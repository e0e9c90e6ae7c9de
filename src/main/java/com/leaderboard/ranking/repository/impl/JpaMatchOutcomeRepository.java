package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.MatchOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaMatchOutcomeRepository extends JpaRepository<MatchOutcome, Long> {
    List<MatchOutcome> findByTournamentIdAndState(Long tournamentId, String state);
}
