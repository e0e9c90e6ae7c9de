package com.leaderboard.ranking.service;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.model.LeaderboardSnapshot;
import com.leaderboard.ranking.model.SubjectType;
import com.leaderboard.ranking.repository.SnapshotRepository;
import com.leaderboard.ranking.repository.impl.JsonSnapshotRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RankDeltaServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private static final LeaderboardScope SEASON = LeaderboardScope.season("2026_S1", "cs2");

    @TempDir
    Path snapshotDir;

    private TimeBoundedExecutor executor;
    private JsonSnapshotRepository snapshotRepository;
    private RankDeltaService rankDeltaService;

    @BeforeEach
    void setUp() {
        executor = new TimeBoundedExecutor();
        snapshotRepository = new JsonSnapshotRepository(snapshotDir.toString());
        rankDeltaService = new RankDeltaService(snapshotRepository, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void testPreviousRanks_LatestSnapshotBeforeToday() {
        // Arrange
        snapshotRepository.upsert(row(TODAY.minusDays(5), SubjectType.PLAYER, 7L, 9));
        snapshotRepository.upsert(row(TODAY.minusDays(1), SubjectType.PLAYER, 7L, 4));
        snapshotRepository.upsert(row(TODAY.minusDays(1), SubjectType.TEAM, 900L, 2));
        snapshotRepository.upsert(row(TODAY, SubjectType.PLAYER, 7L, 1));

        // Act
        Map<String, Integer> ranks = rankDeltaService.previousRanks(SEASON, Duration.ofSeconds(5));

        // Assert
        assertEquals(Map.of("PLAYER:7", 4, "TEAM:900", 2), ranks);
    }

    @Test
    void testPreviousRanks_NoEarlierSnapshot() {
        // Arrange
        snapshotRepository.upsert(row(TODAY, SubjectType.PLAYER, 7L, 1));

        // Act
        Map<String, Integer> ranks = rankDeltaService.previousRanks(SEASON, null);

        // Assert
        assertTrue(ranks.isEmpty());
        assertTrue(rankDeltaService.previousRanks(LeaderboardScope.season("2026_S1", null), null).isEmpty());
    }

    @Test
    void testPreviousRanks_StoreFailureServesWithoutChanges() {
        // Arrange
        SnapshotRepository failing = mock(SnapshotRepository.class);
        when(failing.findLatestBefore(any(), any(), any(), any())).thenThrow(new IllegalStateException("disk gone"));
        RankDeltaService service = new RankDeltaService(failing, executor, Clock.fixed(NOW, ZoneOffset.UTC));

        // Act
        Map<String, Integer> ranks = service.previousRanks(SEASON, Duration.ofSeconds(5));

        // Assert
        assertTrue(ranks.isEmpty());
        verify(failing).findLatestBefore("season", "2026_S1", "cs2", TODAY);
    }

    @Test
    void testPreviousRankOf_MatchesPlayerBeforeTeam() {
        // Arrange
        Map<String, Integer> previous = Map.of("PLAYER:7", 3, "TEAM:900", 8);
        LeaderboardEntry playerOnTeam = LeaderboardEntry.builder().playerId(7L).teamId(900L).rank(1).build();
        LeaderboardEntry team = LeaderboardEntry.builder().teamId(900L).rank(2).build();
        LeaderboardEntry newcomer = LeaderboardEntry.builder().playerId(8L).rank(3).build();

        // Act & Assert
        assertEquals(Integer.valueOf(3), RankDeltaService.previousRankOf(playerOnTeam, previous));
        assertEquals(Integer.valueOf(8), RankDeltaService.previousRankOf(team, previous));
        assertNull(RankDeltaService.previousRankOf(newcomer, previous));
        assertNull(RankDeltaService.previousRankOf(LeaderboardEntry.builder().rank(4).build(), previous));
    }

    private LeaderboardSnapshot row(LocalDate date, SubjectType subjectType, long subjectId, int rank) {
        return LeaderboardSnapshot.builder()
            .snapshotDate(date)
            .leaderboardType("season")
            .scopeReference("2026_S1")
            .gameFilter("cs2")
            .subjectType(subjectType)
            .subjectId(subjectId)
            .playerId(subjectType == SubjectType.PLAYER ? subjectId : null)
            .teamId(subjectType == SubjectType.TEAM ? subjectId : null)
            .rank(rank)
            .points(1000 - rank)
            .updatedAt(NOW)
            .build();
    }
}
