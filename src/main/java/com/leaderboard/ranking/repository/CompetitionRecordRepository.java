package com.leaderboard.ranking.repository;

import com.leaderboard.ranking.model.CompetitorStanding;
import com.leaderboard.ranking.model.MatchOutcome;
import com.leaderboard.ranking.model.ParticipantPlacement;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only window into the tournament, match, registration and standings
 * records owned by other services. The ranking engine never writes through it.
 */
public interface CompetitionRecordRepository {
    /** Registrations of a tournament that have a placement. */
    List<ParticipantPlacement> fetchPlacements(long tournamentId);

    List<MatchOutcome> fetchCompletedMatches(long tournamentId);

    Optional<String> fetchScoringFormat(long tournamentId);

    /**
     * Per-season, per-game standing rows. A null season id means every season,
     * a null game code means every game.
     */
    List<CompetitorStanding> fetchStandings(String seasonId, String gameCode);

    List<Long> fetchActiveTournamentIds();

    List<String> fetchActiveSeasonIds(LocalDate date);
}
