package com.leaderboard.ranking.event;

import com.leaderboard.ranking.model.LeaderboardScope;
import com.leaderboard.ranking.service.LeaderboardCacheService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StandingsChangedListenerTest {

    @Mock
    private LeaderboardCacheService cacheService;

    @InjectMocks
    private StandingsChangedListener listener;

    @Test
    void testInvalidatesChangedScope() {
        LeaderboardScope scope = LeaderboardScope.tournament(42);

        listener.onStandingsChanged(new StandingsChangedEvent(scope, "match 9 completed"));

        verify(cacheService).invalidate(scope);
    }

    @Test
    void testIgnoresEventWithoutScope() {
        listener.onStandingsChanged(new StandingsChangedEvent(null));

        verifyNoInteractions(cacheService);
    }
}
