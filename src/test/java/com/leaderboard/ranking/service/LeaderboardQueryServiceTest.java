package com.leaderboard.ranking.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.leaderboard.ranking.dto.LeaderboardEntryView;
import com.leaderboard.ranking.dto.LeaderboardMetadata;
import com.leaderboard.ranking.dto.LeaderboardResponse;
import com.leaderboard.ranking.dto.LeaderboardResult;
import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.model.ScopeType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardQueryServiceTest {

    private static final LeaderboardScope SCOPE = LeaderboardScope.tournament(42);
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private LeaderboardCacheService cacheService;

    @Mock
    private RankDeltaService rankDeltaService;

    @InjectMocks
    private LeaderboardQueryService queryService;

    @Test
    void testList_SecondPageOfThree() {
        // Arrange
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(result(entries(8), false));

        // Act
        LeaderboardResponse response = queryService.list(SCOPE, 3, 3, null);

        // Assert
        assertEquals(List.of(4, 5, 6), ranks(response));
        assertEquals(8, response.getMetadata().getCount());
        assertEquals(Integer.valueOf(3), response.getMetadata().getLimit());
        assertEquals(Integer.valueOf(3), response.getMetadata().getOffset());
        assertEquals(ScopeType.TOURNAMENT, response.getScope());
    }

    @Test
    void testList_LastPageCappedByTotal() {
        // Arrange
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(result(entries(8), false));

        // Act
        LeaderboardResponse lastPage = queryService.list(SCOPE, 3, 6, null);
        LeaderboardResponse pastEnd = queryService.list(SCOPE, 3, 20, null);

        // Assert
        assertEquals(List.of(7, 8), ranks(lastPage));
        assertTrue(pastEnd.getEntries().isEmpty());
        assertEquals(8, pastEnd.getMetadata().getCount());
        verify(rankDeltaService, times(1)).previousRanks(SCOPE, null);
    }

    @Test
    void testList_RankChangeAgainstPreviousSnapshot() {
        // Arrange
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(result(entries(3), false));
        when(rankDeltaService.previousRanks(SCOPE, null)).thenReturn(Map.of("TEAM:902", 5, "TEAM:901", 1));

        // Act
        LeaderboardResponse response = queryService.list(SCOPE, 10, 0, null);

        // Assert
        LeaderboardEntryView first = response.getEntries().get(0);
        LeaderboardEntryView second = response.getEntries().get(1);
        LeaderboardEntryView third = response.getEntries().get(2);
        assertEquals(Integer.valueOf(1), first.getPreviousRank());
        assertEquals(Integer.valueOf(0), first.getRankChange());
        assertEquals(Integer.valueOf(5), second.getPreviousRank());
        assertEquals(Integer.valueOf(-3), second.getRankChange());
        assertNull(third.getPreviousRank());
        assertNull(third.getRankChange());
    }

    @Test
    void testList_ReordersByRankAndDropsInactive() {
        // Arrange
        List<LeaderboardEntry> entries = entries(6);
        entries.get(2).setActive(false);
        Collections.shuffle(entries);
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(result(entries, true));

        // Act
        LeaderboardResponse response = queryService.list(SCOPE, 10, 0, null);

        // Assert
        assertEquals(List.of(1, 2, 4, 5, 6), ranks(response));
        assertEquals(5, response.getMetadata().getCount());
        assertTrue(response.getMetadata().isCacheHit());
    }

    @Test
    void testList_InvalidPaging() {
        assertThrows(InvalidRequestException.class, () -> queryService.list(SCOPE, 0, 0, null));
        assertThrows(InvalidRequestException.class, () -> queryService.list(SCOPE, 501, 0, null));
        assertThrows(InvalidRequestException.class, () -> queryService.list(SCOPE, 10, -1, null));
        verifyNoInteractions(cacheService);
    }

    @Test
    void testList_ComputationDisabledFlagPassedThrough() {
        // Arrange
        LeaderboardResult disabled = LeaderboardResult.builder()
            .scope(SCOPE)
            .entries(new ArrayList<>())
            .metadata(LeaderboardMetadata.builder().tournamentId(42L).computationEnabled(false).build())
            .build();
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(disabled);

        // Act
        LeaderboardResponse response = queryService.list(SCOPE, 10, 0, null);

        // Assert
        assertTrue(response.getEntries().isEmpty());
        assertEquals(Boolean.FALSE, response.getMetadata().getComputationEnabled());
        verifyNoInteractions(rankDeltaService);
    }

    @Test
    void testList_EntriesExposeOnlyPublicFields() throws Exception {
        // Arrange
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(result(entries(2), false));
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());

        // Act
        JsonNode json = objectMapper.valueToTree(queryService.list(SCOPE, 10, 0, null));

        // Assert
        Set<String> fields = new TreeSet<>();
        Iterator<String> names = json.get("entries").get(0).fieldNames();
        names.forEachRemaining(fields::add);
        assertEquals(new TreeSet<>(List.of("rank", "playerId", "teamId", "points", "wins", "losses", "winRate",
            "lastUpdated", "previousRank", "rankChange")), fields);
        assertEquals("tournament", json.get("scope").asText());
        assertEquals("2026-03-01T12:00:00.000Z", json.get("entries").get(0).get("lastUpdated").asText());
    }

    @Test
    void testFindPlayerRank() {
        // Arrange
        List<LeaderboardEntry> entries = entries(4);
        entries.get(2).setPlayerId(77L);
        when(cacheService.getOrCompute(SCOPE, null)).thenReturn(result(entries, false));
        when(rankDeltaService.previousRanks(SCOPE, null)).thenReturn(Map.of("PLAYER:77", 1, "TEAM:903", 4));

        // Act
        Optional<LeaderboardEntryView> found = queryService.findPlayerRank(SCOPE, 77L, null);
        Optional<LeaderboardEntryView> missing = queryService.findPlayerRank(SCOPE, 78L, null);

        // Assert
        assertTrue(found.isPresent());
        assertEquals(3, found.get().getRank());
        assertEquals(Integer.valueOf(1), found.get().getPreviousRank());
        assertEquals(Integer.valueOf(2), found.get().getRankChange());
        assertFalse(missing.isPresent());
        verify(rankDeltaService, times(1)).previousRanks(SCOPE, null);
    }

    private LeaderboardResult result(List<LeaderboardEntry> entries, boolean cacheHit) {
        return LeaderboardResult.builder()
            .scope(SCOPE)
            .entries(entries)
            .metadata(LeaderboardMetadata.builder()
                .tournamentId(42L)
                .count(entries.size())
                .cacheHit(cacheHit)
                .build())
            .build();
    }

    private List<LeaderboardEntry> entries(int count) {
        List<LeaderboardEntry> entries = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            entries.add(LeaderboardEntry.builder()
                .scopeType(ScopeType.TOURNAMENT)
                .scopeReference("42")
                .gameFilter(LeaderboardScope.ALL_GAMES)
                .teamId(900L + i)
                .rank(i)
                .points(1000 - i)
                .active(true)
                .lastUpdated(NOW)
                .build());
        }
        return entries;
    }

    private List<Integer> ranks(LeaderboardResponse response) {
        return response.getEntries().stream().map(LeaderboardEntryView::getRank).toList();
    }
}
