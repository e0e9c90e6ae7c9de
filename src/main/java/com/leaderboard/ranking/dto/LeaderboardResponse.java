package com.leaderboard.ranking.dto;

import com.leaderboard.ranking.model.ScopeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private ScopeType scope;
    private List<LeaderboardEntryView> entries;
    private LeaderboardMetadata metadata;
}
