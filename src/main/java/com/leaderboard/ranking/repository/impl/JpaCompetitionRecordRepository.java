package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.model.CompetitorStanding;
import com.leaderboard.ranking.model.MatchOutcome;
import com.leaderboard.ranking.model.ParticipantPlacement;
import com.leaderboard.ranking.model.SeasonRecord;
import com.leaderboard.ranking.model.TournamentRecord;
import com.leaderboard.ranking.repository.CompetitionRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaCompetitionRecordRepository implements CompetitionRecordRepository {

    private final JpaParticipantPlacementRepository placementRepository;
    private final JpaMatchOutcomeRepository matchRepository;
    private final JpaCompetitorStandingRepository standingRepository;
    private final JpaTournamentRecordRepository tournamentRepository;
    private final JpaSeasonRecordRepository seasonRepository;

    @Autowired
    public JpaCompetitionRecordRepository(
            JpaParticipantPlacementRepository placementRepository,
            JpaMatchOutcomeRepository matchRepository,
            JpaCompetitorStandingRepository standingRepository,
            JpaTournamentRecordRepository tournamentRepository,
            JpaSeasonRecordRepository seasonRepository) {
        this.placementRepository = placementRepository;
        this.matchRepository = matchRepository;
        this.standingRepository = standingRepository;
        this.tournamentRepository = tournamentRepository;
        this.seasonRepository = seasonRepository;
    }

    @Override
    public List<ParticipantPlacement> fetchPlacements(long tournamentId) {
        return placementRepository.findByTournamentIdAndPlacementIsNotNull(tournamentId);
    }

    @Override
    public List<MatchOutcome> fetchCompletedMatches(long tournamentId) {
        return matchRepository.findByTournamentIdAndState(tournamentId, MatchOutcome.STATE_COMPLETED);
    }

    @Override
    public Optional<String> fetchScoringFormat(long tournamentId) {
        return tournamentRepository.findById(tournamentId).map(TournamentRecord::getScoringFormat);
    }

    @Override
    public List<CompetitorStanding> fetchStandings(String seasonId, String gameCode) {
        if (seasonId != null && gameCode != null) {
            return standingRepository.findBySeasonIdAndGameCode(seasonId, gameCode);
        }
        if (seasonId != null) {
            return standingRepository.findBySeasonId(seasonId);
        }
        if (gameCode != null) {
            return standingRepository.findByGameCode(gameCode);
        }
        return standingRepository.findAll();
    }

    @Override
    public List<Long> fetchActiveTournamentIds() {
        return tournamentRepository.findByStatusIn(TournamentRecord.ACTIVE_STATUSES).stream()
            .map(TournamentRecord::getTournamentId)
            .sorted()
            .toList();
    }

    @Override
    public List<String> fetchActiveSeasonIds(LocalDate date) {
        return seasonRepository.findByStartsOnLessThanEqualAndEndsOnGreaterThanEqual(date, date).stream()
            .map(SeasonRecord::getSeasonId)
            .sorted()
            .toList();
    }
}
