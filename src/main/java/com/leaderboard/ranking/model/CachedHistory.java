package com.leaderboard.ranking.model;

import com.leaderboard.ranking.dto.HistoryPoint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CachedHistory {
    private List<HistoryPoint> history;
    private Instant cachedAt;
}
