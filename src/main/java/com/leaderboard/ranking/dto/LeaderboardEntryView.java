package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.leaderboard.ranking.model.LeaderboardEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Public shape of a leaderboard row: numeric ids and aggregates only.
 * Names, emails and other identifying fields never appear here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntryView {
    private int rank;
    private Long playerId;
    private Long teamId;
    private int points;
    private int wins;
    private int losses;
    private double winRate;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastUpdated;

    // Rank in the latest snapshot before today; null for subjects new to the scope
    private Integer previousRank;

    // rank - previousRank: negative moved up, positive moved down
    private Integer rankChange;

    /**
     * @param previousRank the subject's earlier rank, or null when it has none
     */
    public static LeaderboardEntryView from(LeaderboardEntry entry, Integer previousRank) {
        return LeaderboardEntryView.builder()
            .rank(entry.getRank())
            .playerId(entry.getPlayerId())
            .teamId(entry.getTeamId())
            .points(entry.getPoints())
            .wins(entry.getWins())
            .losses(entry.getLosses())
            .winRate(entry.getWinRate())
            .lastUpdated(entry.getLastUpdated())
            .previousRank(previousRank)
            .rankChange(previousRank != null ? entry.getRank() - previousRank : null)
            .build();
    }
}
