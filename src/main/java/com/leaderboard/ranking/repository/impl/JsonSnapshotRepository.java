package com.leaderboard.ranking.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import com.leaderboard.ranking.repository.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * File-backed snapshot store for local runs without PostgreSQL. One JSON file
 * per scope instance holds that scope's rows keyed by natural key; writes to a
 * file are serialized by a per-file lock, so the last upsert for a key wins.
 */
@Repository
@ConditionalOnProperty(name = "leaderboards.snapshot.store", havingValue = "json")
public class JsonSnapshotRepository implements SnapshotRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotRepository.class);

    private final String dataDirectory;
    private final ObjectMapper objectMapper;
    private final Map<String, Map<String, LeaderboardSnapshot>> cache = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> fileLocks = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    @Autowired
    public JsonSnapshotRepository(LeaderboardProperties properties) {
        this(properties.getSnapshot().getDirectory());
    }

    public JsonSnapshotRepository(String dataDirectory) {
        this.dataDirectory = dataDirectory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        initializeDirectory();
        loadAllSnapshots();
    }

    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create snapshot directory: " + dataDirectory, e);
        }
    }

    private void loadAllSnapshots() {
        try (Stream<Path> files = Files.list(Paths.get(dataDirectory))) {
            files.filter(p -> p.toString().endsWith(".json")).forEach(this::loadScopeFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load snapshots from " + dataDirectory, e);
        }
    }

    private void loadScopeFile(Path filePath) {
        String fileName = filePath.getFileName().toString();
        try {
            List<LeaderboardSnapshot> rows = objectMapper.readValue(filePath.toFile(),
                new TypeReference<List<LeaderboardSnapshot>>() {});
            Map<String, LeaderboardSnapshot> byKey = new ConcurrentHashMap<>();
            for (LeaderboardSnapshot row : rows) {
                byKey.put(row.naturalKey(), row);
                if (row.getId() != null) {
                    idSequence.accumulateAndGet(row.getId(), Math::max);
                }
            }
            cache.put(fileName.substring(0, fileName.length() - ".json".length()), byKey);
        } catch (IOException e) {
            logger.warn("Skipping unreadable snapshot file {}: {}", filePath, e.getMessage());
        }
    }

    @Override
    public UpsertOutcome upsert(LeaderboardSnapshot snapshot) {
        validate(snapshot);
        String scopeFile = scopeFileName(snapshot.getLeaderboardType(), snapshot.getScopeReference(),
            snapshot.getGameFilter());
        ReentrantLock lock = fileLocks.computeIfAbsent(scopeFile, k -> new ReentrantLock());

        lock.lock();
        try {
            Map<String, LeaderboardSnapshot> rows = cache.computeIfAbsent(scopeFile, k -> new ConcurrentHashMap<>());
            LeaderboardSnapshot existing = rows.get(snapshot.naturalKey());
            LeaderboardSnapshot stored;
            if (existing == null) {
                stored = snapshot.toBuilder().id(idSequence.incrementAndGet()).build();
            } else {
                stored = existing.toBuilder()
                    .rank(snapshot.getRank())
                    .points(snapshot.getPoints())
                    .playerId(snapshot.getPlayerId())
                    .teamId(snapshot.getTeamId())
                    .updatedAt(snapshot.getUpdatedAt())
                    .build();
            }
            rows.put(stored.naturalKey(), stored);
            persist(scopeFile, rows);
            return existing == null ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LeaderboardSnapshot> findByNaturalKey(LeaderboardSnapshot probe) {
        Map<String, LeaderboardSnapshot> rows = cache.get(
            scopeFileName(probe.getLeaderboardType(), probe.getScopeReference(), probe.getGameFilter()));
        if (rows == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(probe.naturalKey()));
    }

    @Override
    public List<LeaderboardSnapshot> findHistory(SubjectType subjectType, long subjectId, String leaderboardType,
                                                 String scopeReference, String gameFilter, LocalDate fromDate) {
        Map<String, LeaderboardSnapshot> rows = cache.get(scopeFileName(leaderboardType, scopeReference, gameFilter));
        if (rows == null) {
            return new ArrayList<>();
        }
        return rows.values().stream()
            .filter(row -> row.getSubjectType() == subjectType && row.getSubjectId() == subjectId)
            .filter(row -> fromDate == null || !row.getSnapshotDate().isBefore(fromDate))
            .sorted(Comparator.comparing(LeaderboardSnapshot::getSnapshotDate))
            .toList();
    }

    @Override
    public Optional<LocalDate> findLatestDate(String leaderboardType, String scopeReference, String gameFilter) {
        Map<String, LeaderboardSnapshot> rows = cache.get(scopeFileName(leaderboardType, scopeReference, gameFilter));
        if (rows == null) {
            return Optional.empty();
        }
        return rows.values().stream()
            .map(LeaderboardSnapshot::getSnapshotDate)
            .max(Comparator.naturalOrder());
    }

    @Override
    public List<LeaderboardSnapshot> findLatestBefore(String leaderboardType, String scopeReference,
                                                      String gameFilter, LocalDate before) {
        Map<String, LeaderboardSnapshot> rows = cache.get(scopeFileName(leaderboardType, scopeReference, gameFilter));
        if (rows == null) {
            return new ArrayList<>();
        }
        Optional<LocalDate> latest = rows.values().stream()
            .map(LeaderboardSnapshot::getSnapshotDate)
            .filter(date -> date.isBefore(before))
            .max(Comparator.naturalOrder());
        if (latest.isEmpty()) {
            return new ArrayList<>();
        }
        return rows.values().stream()
            .filter(row -> row.getSnapshotDate().equals(latest.get()))
            .sorted(Comparator.comparingInt(LeaderboardSnapshot::getRank))
            .toList();
    }

    @Override
    public int deleteOlderThan(LocalDate cutoff) {
        int deleted = 0;
        for (Map.Entry<String, Map<String, LeaderboardSnapshot>> scope : cache.entrySet()) {
            ReentrantLock lock = fileLocks.computeIfAbsent(scope.getKey(), k -> new ReentrantLock());
            lock.lock();
            try {
                Map<String, LeaderboardSnapshot> rows = scope.getValue();
                int before = rows.size();
                rows.values().removeIf(row -> row.getSnapshotDate().isBefore(cutoff));
                if (rows.size() != before) {
                    deleted += before - rows.size();
                    persist(scope.getKey(), rows);
                }
            } finally {
                lock.unlock();
            }
        }
        return deleted;
    }

    private void persist(String scopeFile, Map<String, LeaderboardSnapshot> rows) {
        List<LeaderboardSnapshot> ordered = rows.values().stream()
            .sorted(Comparator.comparing(LeaderboardSnapshot::getSnapshotDate)
                .thenComparing(LeaderboardSnapshot::getRank))
            .toList();
        File file = new File(dataDirectory, scopeFile + ".json");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, ordered);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot file " + file, e);
        }
    }

    private void validate(LeaderboardSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot cannot be null");
        }
        if (snapshot.getSnapshotDate() == null) {
            throw new IllegalArgumentException("Snapshot date cannot be null");
        }
        if (snapshot.getLeaderboardType() == null || snapshot.getSubjectType() == null
                || snapshot.getSubjectId() == null) {
            throw new IllegalArgumentException("Snapshot type and subject cannot be null");
        }
    }

    private static String scopeFileName(String leaderboardType, String scopeReference, String gameFilter) {
        String reference = scopeReference == null || scopeReference.isEmpty() ? "_" : scopeReference;
        return sanitize(leaderboardType) + "__" + sanitize(reference) + "__" + sanitize(gameFilter);
    }

    private static String sanitize(String part) {
        return part == null ? "_" : part.replaceAll("[^A-Za-z0-9_.-]", "-");
    }
}
