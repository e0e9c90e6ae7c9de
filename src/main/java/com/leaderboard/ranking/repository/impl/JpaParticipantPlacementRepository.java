package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.ParticipantPlacement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaParticipantPlacementRepository extends JpaRepository<ParticipantPlacement, Long> {
    List<ParticipantPlacement> findByTournamentIdAndPlacementIsNotNull(Long tournamentId);
}
