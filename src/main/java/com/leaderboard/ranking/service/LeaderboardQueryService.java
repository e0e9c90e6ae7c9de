package com.leaderboard.ranking.service;

import com.leaderboard.ranking.dto.LeaderboardEntryView;
import com.leaderboard.ranking.dto.LeaderboardMetadata;
import com.leaderboard.ranking.dto.LeaderboardResponse;
import com.leaderboard.ranking.dto.LeaderboardResult;
import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
public class LeaderboardQueryService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardQueryService.class);

    public static final int MAX_LIMIT = 500;

    private final LeaderboardCacheService cacheService;
    private final RankDeltaService rankDeltaService;

    @Autowired
    public LeaderboardQueryService(LeaderboardCacheService cacheService, RankDeltaService rankDeltaService) {
        this.cacheService = cacheService;
        this.rankDeltaService = rankDeltaService;
    }

    /**
     * One page of a leaderboard. {@code metadata.count} is the total number of
     * ranked entries in the scope, not the page size.
     */
    public LeaderboardResponse list(LeaderboardScope scope, int limit, int offset, Duration timeout) {
        validatePage(limit, offset);

        LeaderboardResult result = cacheService.getOrCompute(scope, timeout);
        List<LeaderboardEntry> ranked = rankedEntries(result);

        int from = Math.min(offset, ranked.size());
        int to = Math.min(from + limit, ranked.size());
        List<LeaderboardEntry> slice = ranked.subList(from, to);
        Map<String, Integer> previousRanks = slice.isEmpty()
            ? new HashMap<>()
            : rankDeltaService.previousRanks(scope, timeout);
        List<LeaderboardEntryView> page = slice.stream()
            .map(entry -> LeaderboardEntryView.from(entry, RankDeltaService.previousRankOf(entry, previousRanks)))
            .toList();

        LeaderboardMetadata metadata = result.getMetadata().toBuilder()
            .count(ranked.size())
            .limit(limit)
            .offset(offset)
            .build();

        logger.debug("Served {} of {} entries for {} (offset {}, cacheHit {})",
            page.size(), ranked.size(), scope.cacheKey(), offset, metadata.isCacheHit());

        return LeaderboardResponse.builder()
            .scope(scope.getType())
            .entries(page)
            .metadata(metadata)
            .build();
    }

    /**
     * Entry of one player in a scope; empty when the player is not ranked there.
     */
    public Optional<LeaderboardEntryView> findPlayerRank(LeaderboardScope scope, long playerId, Duration timeout) {
        LeaderboardResult result = cacheService.getOrCompute(scope, timeout);
        Optional<LeaderboardEntry> found = rankedEntries(result).stream()
            .filter(entry -> Objects.equals(entry.getPlayerId(), playerId))
            .findFirst();
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Integer> previousRanks = rankDeltaService.previousRanks(scope, timeout);
        return Optional.of(LeaderboardEntryView.from(found.get(),
            RankDeltaService.previousRankOf(found.get(), previousRanks)));
    }

    private List<LeaderboardEntry> rankedEntries(LeaderboardResult result) {
        // cached documents may come from an older writer, so order is re-established here
        return result.getEntries().stream()
            .filter(LeaderboardEntry::isActive)
            .sorted(Comparator.comparingInt(LeaderboardEntry::getRank))
            .toList();
    }

    private void validatePage(int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new InvalidRequestException("offset must not be negative");
        }
    }
}
