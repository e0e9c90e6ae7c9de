package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlayerHistoryResponse {
    private long playerId;
    private List<HistoryPoint> history;
    private int count;
    private Boolean computationEnabled;
    private Boolean cacheHit;
}
