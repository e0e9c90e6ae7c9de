package com.leaderboard.ranking.service;

import com.leaderboard.ranking.exception.LeaderboardException;
import com.leaderboard.ranking.exception.RecordStoreException;
import com.leaderboard.ranking.model.CompetitorStanding;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.model.MatchOutcome;
import com.leaderboard.ranking.model.ParticipantPlacement;
import com.leaderboard.ranking.model.RankCandidate;
import com.leaderboard.ranking.model.ScopeType;
import com.leaderboard.ranking.model.ScoringTable;
import com.leaderboard.ranking.repository.CompetitionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Builds the full ranked entry list of a scope from the record store.
 * Output depends only on the records read: the same records always give the
 * same order, ranks and points.
 */
@Service
public class LeaderboardComputer {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardComputer.class);

    private final CompetitionRecordRepository recordRepository;
    private final ScoringEngine scoringEngine;
    private final ScoringTableRegistry scoringTableRegistry;
    private final TimeBoundedExecutor timeBoundedExecutor;
    private final Clock clock;

    @Autowired
    public LeaderboardComputer(
            CompetitionRecordRepository recordRepository,
            ScoringEngine scoringEngine,
            ScoringTableRegistry scoringTableRegistry,
            TimeBoundedExecutor timeBoundedExecutor,
            Clock clock) {
        this.recordRepository = recordRepository;
        this.scoringEngine = scoringEngine;
        this.scoringTableRegistry = scoringTableRegistry;
        this.timeBoundedExecutor = timeBoundedExecutor;
        this.clock = clock;
    }

    public List<LeaderboardEntry> compute(LeaderboardScope scope) {
        return compute(scope, null);
    }

    /**
     * @param timeout overall budget for the record-store reads; null for none
     * @throws RecordStoreException the store failed or ran past the budget
     */
    public List<LeaderboardEntry> compute(LeaderboardScope scope, Duration timeout) {
        long started = System.nanoTime();
        List<LeaderboardEntry> entries = scope.getType() == ScopeType.TOURNAMENT
            ? computeTournament(scope, deadline(timeout))
            : computeAggregate(scope, deadline(timeout));
        logger.debug("Computed {} entries for {} in {}ms", entries.size(), scope.cacheKey(),
            (System.nanoTime() - started) / 1_000_000);
        return entries;
    }

    private List<LeaderboardEntry> computeTournament(LeaderboardScope scope, Long deadlineNanos) {
        long tournamentId = scope.getTournamentId();

        List<ParticipantPlacement> placements = fetch("placements of tournament " + tournamentId,
            () -> recordRepository.fetchPlacements(tournamentId), deadlineNanos);
        if (placements.isEmpty()) {
            logger.debug("Tournament {} has no placed participants", tournamentId);
            return new ArrayList<>();
        }

        List<MatchOutcome> matches = fetch("matches of tournament " + tournamentId,
            () -> recordRepository.fetchCompletedMatches(tournamentId), deadlineNanos);
        Optional<String> format = fetch("scoring format of tournament " + tournamentId,
            () -> recordRepository.fetchScoringFormat(tournamentId), deadlineNanos);
        ScoringTable table = scoringTableRegistry.resolve(format.orElse(null));

        Map<Long, int[]> results = tallyResults(matches);
        Instant now = clock.instant();

        Map<Long, RankCandidate> candidates = new LinkedHashMap<>();
        for (ParticipantPlacement participant : placements) {
            Long competitorId = participant.competitorId();
            if (participant.isSubjectDeleted() || competitorId == null) {
                logger.debug("Skipping registration {} of tournament {}: team or player no longer exists",
                    participant.getRegistrationId(), tournamentId);
                continue;
            }
            if (participant.getPlacement() == null || participant.getPlacement() < 1) {
                logger.warn("Skipping registration {} of tournament {}: invalid placement {}",
                    participant.getRegistrationId(), tournamentId, participant.getPlacement());
                continue;
            }
            RankCandidate previous = candidates.get(competitorId);
            if (previous != null && !isEarlier(participant.getRegisteredAt(), previous.getRegisteredAt())) {
                logger.warn("Duplicate registration {} for competitor {} in tournament {}, keeping the earliest",
                    participant.getRegistrationId(), competitorId, tournamentId);
                continue;
            }

            int[] record = results.getOrDefault(competitorId, new int[2]);
            int wins = record[0];
            candidates.put(competitorId, RankCandidate.builder()
                .playerId(participant.getPlayerId())
                .teamId(participant.getTeamId())
                .placement(participant.getPlacement())
                .wins(wins)
                .losses(record[1])
                .points(scoringEngine.tournamentPoints(participant.getPlacement(), wins, table))
                .registeredAt(participant.getRegisteredAt())
                .active(true)
                .lastUpdated(now)
                .build());
        }

        return assignRanks(scope, new ArrayList<>(candidates.values()), true);
    }

    private List<LeaderboardEntry> computeAggregate(LeaderboardScope scope, Long deadlineNanos) {
        String seasonId = scope.getType() == ScopeType.SEASON ? scope.getSeasonId() : null;
        List<CompetitorStanding> standings = fetch("standings of " + scope.cacheKey(),
            () -> recordRepository.fetchStandings(seasonId, scope.getGameCode()), deadlineNanos);

        Instant now = clock.instant();
        Map<String, RankCandidate> merged = new LinkedHashMap<>();
        for (CompetitorStanding standing : standings) {
            if (standing.getPlayerId() == null && standing.getTeamId() == null) {
                continue;
            }
            // Keyed like snapshot subjects: the player, or the team for team-only rows
            String subjectKey = standing.getPlayerId() != null
                ? "player:" + standing.getPlayerId()
                : "team:" + standing.getTeamId();
            RankCandidate candidate = merged.get(subjectKey);
            Instant updated = standing.getUpdatedAt() != null ? standing.getUpdatedAt() : now;
            if (candidate == null) {
                merged.put(subjectKey, RankCandidate.builder()
                    .playerId(standing.getPlayerId())
                    .teamId(standing.getTeamId())
                    .points(standing.getPoints())
                    .wins(standing.getWins())
                    .losses(standing.getLosses())
                    .registeredAt(standing.getRegisteredAt())
                    .active(standing.isActive())
                    .lastUpdated(updated)
                    .build());
                continue;
            }
            // Same subject in several games, seasons or teams: one aggregate row
            candidate.setPoints(candidate.getPoints() + standing.getPoints());
            candidate.setWins(candidate.getWins() + standing.getWins());
            candidate.setLosses(candidate.getLosses() + standing.getLosses());
            candidate.setActive(candidate.isActive() || standing.isActive());
            if (isEarlier(standing.getRegisteredAt(), candidate.getRegisteredAt())) {
                candidate.setRegisteredAt(standing.getRegisteredAt());
            }
            if (updated.isAfter(candidate.getLastUpdated())) {
                candidate.setLastUpdated(updated);
                candidate.setTeamId(standing.getTeamId());
            }
        }

        return assignRanks(scope, new ArrayList<>(merged.values()), false);
    }

    private List<LeaderboardEntry> assignRanks(LeaderboardScope scope, List<RankCandidate> candidates,
                                               boolean tournamentOrder) {
        List<RankCandidate> ordered = candidates.stream()
            .filter(RankCandidate::isActive)
            .sorted(tournamentOrder ? RankingComparators.TOURNAMENT : RankingComparators.AGGREGATE)
            .toList();

        List<LeaderboardEntry> entries = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            RankCandidate candidate = ordered.get(i);
            entries.add(LeaderboardEntry.builder()
                .scopeType(scope.getType())
                .scopeReference(scope.scopeReference())
                .gameFilter(scope.gameFilter())
                .playerId(candidate.getPlayerId())
                .teamId(candidate.getTeamId())
                .rank(i + 1)
                .points(candidate.getPoints())
                .wins(candidate.getWins())
                .losses(candidate.getLosses())
                .winRate(LeaderboardEntry.winRate(candidate.getWins(), candidate.getLosses()))
                .active(true)
                .lastUpdated(candidate.getLastUpdated())
                .build());
        }
        return entries;
    }

    /** competitor id -> {wins, losses} */
    private Map<Long, int[]> tallyResults(List<MatchOutcome> matches) {
        Map<Long, int[]> results = new HashMap<>();
        for (MatchOutcome match : matches) {
            if (match.getWinnerId() != null) {
                results.computeIfAbsent(match.getWinnerId(), k -> new int[2])[0]++;
            }
            if (match.getLoserId() != null) {
                results.computeIfAbsent(match.getLoserId(), k -> new int[2])[1]++;
            }
        }
        return results;
    }

    private <T> T fetch(String what, Callable<T> call, Long deadlineNanos) {
        Duration remaining = null;
        if (deadlineNanos != null) {
            long left = deadlineNanos - System.nanoTime();
            if (left <= 0) {
                throw new RecordStoreException("Timed out before fetching " + what, null);
            }
            remaining = Duration.ofNanos(left);
        }
        try {
            return timeBoundedExecutor.call(call, remaining);
        } catch (TimeoutException e) {
            throw new RecordStoreException("Record store did not return " + what + " within "
                + remaining.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LeaderboardException) {
                throw (LeaderboardException) cause;
            }
            throw new RecordStoreException("Failed to fetch " + what + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecordStoreException("Interrupted while fetching " + what, e);
        }
    }

    private static Long deadline(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return null;
        }
        return System.nanoTime() + timeout.toNanos();
    }

    private static boolean isEarlier(Instant candidate, Instant current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isBefore(current);
    }
}
