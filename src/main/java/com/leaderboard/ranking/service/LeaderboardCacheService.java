package com.leaderboard.ranking.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.dto.HistoryPoint;
import com.leaderboard.ranking.dto.LeaderboardMetadata;
import com.leaderboard.ranking.dto.LeaderboardResult;
import com.leaderboard.ranking.model.CachedHistory;
import com.leaderboard.ranking.model.CachedLeaderboard;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.model.ScopeType;
import com.leaderboard.ranking.repository.LeaderboardCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Read-through cache in front of {@link LeaderboardComputer}.
 * Cache problems are never surfaced to callers: any failure to read or write
 * the cache is logged and the leaderboard is computed directly.
 */
@Service
public class LeaderboardCacheService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardCacheService.class);

    static final String PLAYER_HISTORY_PREFIX = "lb:player_history:";

    private final LeaderboardCacheRepository cacheRepository;
    private final LeaderboardComputer leaderboardComputer;
    private final LeaderboardProperties properties;
    private final TimeBoundedExecutor timeBoundedExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public LeaderboardCacheService(
            LeaderboardCacheRepository cacheRepository,
            LeaderboardComputer leaderboardComputer,
            LeaderboardProperties properties,
            TimeBoundedExecutor timeBoundedExecutor,
            ObjectMapper objectMapper,
            Clock clock) {
        this.cacheRepository = cacheRepository;
        this.leaderboardComputer = leaderboardComputer;
        this.properties = properties;
        this.timeBoundedExecutor = timeBoundedExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Full ranked list for a scope, from cache when possible.
     * Results are never paged here; an empty list is a valid answer.
     */
    public LeaderboardResult getOrCompute(LeaderboardScope scope, Duration timeout) {
        LeaderboardMetadata metadata = scopeMetadata(scope);

        if (!properties.isComputeEnabled()) {
            logger.debug("Computation disabled, returning empty leaderboard for {}", scope.cacheKey());
            return LeaderboardResult.builder()
                .scope(scope)
                .entries(new ArrayList<>())
                .metadata(metadata.toBuilder().computationEnabled(false).build())
                .build();
        }

        if (properties.isCacheEnabled()) {
            Optional<CachedLeaderboard> cached = readCache(scope.cacheKey(), CachedLeaderboard.class, timeout);
            if (cached.isPresent() && cached.get().getEntries() != null) {
                List<LeaderboardEntry> entries = cached.get().getEntries();
                logger.debug("Cache hit for {} ({} entries)", scope.cacheKey(), entries.size());
                return LeaderboardResult.builder()
                    .scope(scope)
                    .entries(entries)
                    .metadata(metadata.toBuilder()
                        .count(entries.size())
                        .cacheHit(true)
                        .cachedAt(cached.get().getCachedAt())
                        .build())
                    .build();
            }
        }

        List<LeaderboardEntry> entries = leaderboardComputer.compute(scope, timeout);
        Instant computedAt = clock.instant();

        if (properties.isCacheEnabled() && !entries.isEmpty()) {
            writeCache(scope.cacheKey(), new CachedLeaderboard(entries, computedAt), ttlFor(scope.getType()), timeout);
        }

        return LeaderboardResult.builder()
            .scope(scope)
            .entries(entries)
            .metadata(metadata.toBuilder()
                .count(entries.size())
                .cacheHit(false)
                .computedAt(computedAt)
                .build())
            .build();
    }

    /**
     * Drop the cached list of exactly this scope.
     *
     * @return true when a cached document was removed; false when caching is
     *         disabled, nothing was cached, or the cache could not be reached
     */
    public boolean invalidate(LeaderboardScope scope) {
        if (!properties.isCacheEnabled()) {
            return false;
        }
        boolean removed = deleteKey(scope.cacheKey());
        logger.info("Invalidated leaderboard cache {} (removed: {})", scope.cacheKey(), removed);
        return removed;
    }

    /**
     * Same as {@link #invalidate(LeaderboardScope)} for a scope given as request parameters.
     *
     * @throws com.leaderboard.ranking.exception.InvalidRequestException unknown scope,
     *         or a season scope without a season id
     */
    public boolean invalidate(String scope, Long tournamentId, String seasonId, String gameCode) {
        return invalidate(LeaderboardScope.parse(scope, tournamentId, seasonId, gameCode));
    }

    public Optional<CachedHistory> getCachedHistory(long playerId, LeaderboardScope scope, Duration timeout) {
        if (!properties.isCacheEnabled()) {
            return Optional.empty();
        }
        return readCache(historyKey(playerId, scope), CachedHistory.class, timeout);
    }

    public void cacheHistory(long playerId, LeaderboardScope scope, List<HistoryPoint> history, Duration timeout) {
        if (!properties.isCacheEnabled() || history.isEmpty()) {
            return;
        }
        writeCache(historyKey(playerId, scope), new CachedHistory(history, clock.instant()),
            properties.getCache().getPlayerHistoryTtl(), timeout);
    }

    public boolean invalidatePlayerHistory(long playerId, LeaderboardScope scope) {
        if (!properties.isCacheEnabled()) {
            return false;
        }
        return deleteKey(historyKey(playerId, scope));
    }

    static String historyKey(long playerId, LeaderboardScope scope) {
        // scope keys already carry the "lb:" prefix
        return PLAYER_HISTORY_PREFIX + playerId + ":" + scope.cacheKey().substring("lb:".length());
    }

    Duration ttlFor(ScopeType type) {
        switch (type) {
            case TOURNAMENT:
                return properties.getCache().getTournamentTtl();
            case SEASON:
                return properties.getCache().getSeasonTtl();
            default:
                return properties.getCache().getAllTimeTtl();
        }
    }

    private LeaderboardMetadata scopeMetadata(LeaderboardScope scope) {
        return LeaderboardMetadata.builder()
            .tournamentId(scope.getTournamentId())
            .seasonId(scope.getSeasonId())
            .gameCode(scope.getType() == ScopeType.TOURNAMENT ? null : scope.gameFilter())
            .build();
    }

    private <T> Optional<T> readCache(String key, Class<T> type, Duration timeout) {
        String raw;
        try {
            raw = timeBoundedExecutor.call(() -> {
                if (!cacheRepository.isAvailable()) {
                    throw new IllegalStateException("cache backend is not available");
                }
                return cacheRepository.get(key).orElse(null);
            }, timeout);
        } catch (TimeoutException e) {
            logger.warn("Cache read for {} timed out, computing directly", key);
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("Cache read for {} failed, computing directly: {}", key, causeMessage(e));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Cache read for {} interrupted, computing directly", key);
            return Optional.empty();
        }

        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, type));
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring undecodable cache document under {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, Object document, Duration ttl, Duration timeout) {
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            logger.warn("Could not encode cache document for {}: {}", key, e.getOriginalMessage());
            return;
        }
        try {
            timeBoundedExecutor.call(() -> {
                if (!cacheRepository.isAvailable()) {
                    throw new IllegalStateException("cache backend is not available");
                }
                cacheRepository.put(key, json, ttl);
                return null;
            }, timeout);
        } catch (TimeoutException e) {
            logger.warn("Cache write for {} timed out", key);
        } catch (ExecutionException e) {
            logger.warn("Cache write for {} failed: {}", key, causeMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Cache write for {} interrupted", key);
        }
    }

    private boolean deleteKey(String key) {
        try {
            Boolean removed = timeBoundedExecutor.call(() -> cacheRepository.delete(key),
                properties.getRequestTimeout());
            return Boolean.TRUE.equals(removed);
        } catch (TimeoutException e) {
            logger.warn("Cache delete for {} timed out", key);
        } catch (ExecutionException e) {
            logger.warn("Cache delete for {} failed: {}", key, causeMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Cache delete for {} interrupted", key);
        }
        return false;
    }

    private static String causeMessage(ExecutionException e) {
        return e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
    }
}
