package com.leaderboard.ranking.event;

import com.leaderboard.ranking.service.LeaderboardCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class StandingsChangedListener {

    private static final Logger logger = LoggerFactory.getLogger(StandingsChangedListener.class);

    private final LeaderboardCacheService cacheService;

    @Autowired
    public StandingsChangedListener(LeaderboardCacheService cacheService) {
        this.cacheService = cacheService;
    }

    @EventListener
    public void onStandingsChanged(StandingsChangedEvent event) {
        if (event.getScope() == null) {
            logger.warn("Ignoring standings change without a scope: {}", event);
            return;
        }
        logger.debug("Standings changed for {} ({})", event.getScope().cacheKey(), event.getReason());
        cacheService.invalidate(event.getScope());
    }
}
