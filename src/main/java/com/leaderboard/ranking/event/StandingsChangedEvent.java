package com.leaderboard.ranking.event;

import com.leaderboard.ranking.model.LeaderboardScope;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Published by collaborators when results affecting a scope change,
 * for example when a match is completed or a placement is corrected.
 */
@Getter
@ToString
@AllArgsConstructor
public class StandingsChangedEvent {
    private final LeaderboardScope scope;
    private final String reason;

    public StandingsChangedEvent(LeaderboardScope scope) {
        this(scope, null);
    }
}
