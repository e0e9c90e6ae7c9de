package com.leaderboard.ranking.dto;

import com.leaderboard.ranking.model.LeaderboardEntry;
import com.leaderboard.ranking.model.LeaderboardScope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full ranked entry list for a scope as returned by the cache layer, before paging.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResult {
    private LeaderboardScope scope;
    private List<LeaderboardEntry> entries;
    private LeaderboardMetadata metadata;
}
