package com.leaderboard.ranking.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInvalidationResponse {
    private String scope;
    private Long tournamentId;
    private String seasonId;
    private String gameCode;
    private boolean invalidated;
}
