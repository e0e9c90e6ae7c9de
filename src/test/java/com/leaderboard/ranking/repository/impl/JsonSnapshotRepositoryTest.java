package com.leaderboard.ranking.repository.impl;

import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import com.leaderboard.ranking.repository.SnapshotRepository.UpsertOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonSnapshotRepositoryTest {

    private static final Instant UPDATED_AT = Instant.parse("2026-03-01T00:05:00Z");

    @TempDir
    Path dataDir;

    @Test
    void testUpsert_InsertThenUpdateSameNaturalKey() {
        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());

        UpsertOutcome first = repository.upsert(row(LocalDate.of(2026, 3, 1), 7L, 3, 400));
        UpsertOutcome second = repository.upsert(row(LocalDate.of(2026, 3, 1), 7L, 2, 450));

        assertEquals(UpsertOutcome.INSERTED, first);
        assertEquals(UpsertOutcome.UPDATED, second);
        assertEquals(1, history(repository, 7L).size());

        LeaderboardSnapshot stored = repository.findByNaturalKey(row(LocalDate.of(2026, 3, 1), 7L, 0, 0)).orElseThrow();
        assertEquals(2, stored.getRank());
        assertEquals(450, stored.getPoints());
    }

    @Test
    void testRowsSurviveReload() {
        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());
        repository.upsert(row(LocalDate.of(2026, 2, 28), 7L, 4, 380));
        repository.upsert(row(LocalDate.of(2026, 3, 1), 7L, 3, 400));

        JsonSnapshotRepository reloaded = new JsonSnapshotRepository(dataDir.toString());

        assertEquals(2, history(reloaded, 7L).size());
        assertEquals(Optional.of(LocalDate.of(2026, 3, 1)), reloaded.findLatestDate("season", "2026_S1", "cs2"));

        // new rows continue the id sequence
        reloaded.upsert(row(LocalDate.of(2026, 3, 1), 8L, 5, 300));
        LeaderboardSnapshot added = reloaded.findByNaturalKey(row(LocalDate.of(2026, 3, 1), 8L, 0, 0)).orElseThrow();
        assertEquals(Long.valueOf(3L), added.getId());
    }

    @Test
    void testFindHistory_AscendingAndBoundedByFromDate() {
        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());
        repository.upsert(row(LocalDate.of(2026, 3, 1), 7L, 3, 400));
        repository.upsert(row(LocalDate.of(2026, 2, 20), 7L, 9, 150));
        repository.upsert(row(LocalDate.of(2026, 2, 25), 7L, 6, 260));
        repository.upsert(row(LocalDate.of(2026, 2, 25), 8L, 1, 900));

        List<LeaderboardSnapshot> all = repository.findHistory(SubjectType.PLAYER, 7L, "season", "2026_S1", "cs2", null);
        List<LeaderboardSnapshot> recent = repository.findHistory(SubjectType.PLAYER, 7L, "season", "2026_S1", "cs2",
            LocalDate.of(2026, 2, 25));

        assertEquals(List.of(LocalDate.of(2026, 2, 20), LocalDate.of(2026, 2, 25), LocalDate.of(2026, 3, 1)),
            all.stream().map(LeaderboardSnapshot::getSnapshotDate).toList());
        assertEquals(2, recent.size());
        assertTrue(repository.findHistory(SubjectType.TEAM, 7L, "season", "2026_S1", "cs2", null).isEmpty());
        assertTrue(repository.findHistory(SubjectType.PLAYER, 7L, "all_time", "", "ALL", null).isEmpty());
    }

    @Test
    void testDeleteOlderThan() {
        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());
        repository.upsert(row(LocalDate.of(2025, 1, 1), 7L, 3, 400));
        repository.upsert(row(LocalDate.of(2026, 3, 1), 7L, 3, 400));

        int deleted = repository.deleteOlderThan(LocalDate.of(2026, 1, 1));

        assertEquals(1, deleted);
        assertEquals(1, history(repository, 7L).size());
        assertEquals(1, history(new JsonSnapshotRepository(dataDir.toString()), 7L).size());
    }

    @Test
    void testDirectoryFromProperties() {
        LeaderboardProperties properties = new LeaderboardProperties();
        properties.getSnapshot().setDirectory(dataDir.resolve("configured").toString());

        new JsonSnapshotRepository(properties).upsert(row(LocalDate.of(2026, 3, 1), 7L, 3, 400));

        assertTrue(Files.isDirectory(dataDir.resolve("configured")));
        assertEquals(1, history(new JsonSnapshotRepository(dataDir.resolve("configured").toString()), 7L).size());
    }

    @Test
    void testUnreadableFileSkipped() throws Exception {
        Files.writeString(dataDir.resolve("season__broken__ALL.json"), "{ not an array");

        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());

        assertEquals(Optional.empty(), repository.findLatestDate("season", "broken", "ALL"));
        assertTrue(repository.findLatestBefore("season", "broken", "ALL", LocalDate.of(2026, 3, 1)).isEmpty());
    }

    @Test
    void testFindLatestBefore_ReturnsMostRecentEarlierDateInRankOrder() {
        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());
        repository.upsert(row(LocalDate.of(2026, 2, 20), 7L, 1, 500));
        repository.upsert(row(LocalDate.of(2026, 2, 27), 8L, 2, 410));
        repository.upsert(row(LocalDate.of(2026, 2, 27), 7L, 1, 450));
        repository.upsert(row(LocalDate.of(2026, 3, 1), 7L, 2, 470));

        List<LeaderboardSnapshot> previous = repository.findLatestBefore("season", "2026_S1", "cs2",
            LocalDate.of(2026, 3, 1));

        assertEquals(List.of(7L, 8L), previous.stream().map(LeaderboardSnapshot::getSubjectId).toList());
        assertTrue(previous.stream().allMatch(r -> r.getSnapshotDate().equals(LocalDate.of(2026, 2, 27))));
        assertTrue(repository.findLatestBefore("season", "2026_S1", "cs2", LocalDate.of(2026, 2, 20)).isEmpty());
        assertTrue(repository.findLatestBefore("season", "2026_S2", "cs2", LocalDate.of(2026, 3, 1)).isEmpty());
    }

    @Test
    void testUpsert_RejectsIncompleteRow() {
        JsonSnapshotRepository repository = new JsonSnapshotRepository(dataDir.toString());
        LeaderboardSnapshot missingSubject = row(LocalDate.of(2026, 3, 1), 7L, 1, 1).toBuilder().subjectId(null).build();

        assertThrows(IllegalArgumentException.class, () -> repository.upsert(missingSubject));
        assertThrows(IllegalArgumentException.class, () -> repository.upsert(null));
    }

    private List<LeaderboardSnapshot> history(JsonSnapshotRepository repository, long playerId) {
        return repository.findHistory(SubjectType.PLAYER, playerId, "season", "2026_S1", "cs2", null);
    }

    private LeaderboardSnapshot row(LocalDate date, long playerId, int rank, int points) {
        return LeaderboardSnapshot.builder()
            .snapshotDate(date)
            .leaderboardType("season")
            .scopeReference("2026_S1")
            .gameFilter("cs2")
            .subjectType(SubjectType.PLAYER)
            .subjectId(playerId)
            .playerId(playerId)
            .rank(rank)
            .points(points)
            .updatedAt(UPDATED_AT)
            .build();
    }
}
