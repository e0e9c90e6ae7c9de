package com.leaderboard.ranking.service;

import com.leaderboard.ranking.exception.InvalidRequestException;
import com.leaderboard.ranking.model.ScoringTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScoringEngineTest {

    @Mock
    private ScoringTableRegistry scoringTableRegistry;

    @InjectMocks
    private ScoringEngine scoringEngine;

    @Test
    void testPlacementPoints_UsesDefaultTable() {
        // Arrange
        when(scoringTableRegistry.getDefaultTable()).thenReturn(ScoringTable.standard());

        // Act
        int first = scoringEngine.placementPoints(1);

        // Assert
        assertEquals(1000, first);
        verify(scoringTableRegistry).getDefaultTable();
    }

    @Test
    void testPlacementPoints_MonotonicForCheckedPlacements() {
        // Arrange
        when(scoringTableRegistry.getDefaultTable()).thenReturn(ScoringTable.standard());
        int[] placements = {1, 2, 3, 4, 8, 9, 16, 17, 100};

        // Act & Assert
        int previous = Integer.MAX_VALUE;
        for (int placement : placements) {
            int points = scoringEngine.placementPoints(placement);
            assertTrue(points <= previous, "Points rose at placement " + placement);
            previous = points;
        }
    }

    @Test
    void testWinBonus() {
        assertEquals(0, scoringEngine.winBonus(0));
        assertEquals(50, scoringEngine.winBonus(5));
        assertThrows(InvalidRequestException.class, () -> scoringEngine.winBonus(-1));
    }

    @Test
    void testTournamentPoints_PlacementPlusWinBonus() {
        assertEquals(1050, scoringEngine.tournamentPoints(1, 5, ScoringTable.standard()));
        assertEquals(770, scoringEngine.tournamentPoints(2, 2, ScoringTable.standard()));
        assertEquals(32, scoringEngine.tournamentPoints(1, 2, ScoringTable.battleRoyale()));
        verifyNoInteractions(scoringTableRegistry);
    }
}
