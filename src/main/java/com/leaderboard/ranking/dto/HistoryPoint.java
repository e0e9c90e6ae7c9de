package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.leaderboard.ranking.model.LeaderboardSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryPoint {
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;
    private int rank;
    private int points;
    private String leaderboardType;

    public static HistoryPoint from(LeaderboardSnapshot snapshot) {
        return new HistoryPoint(snapshot.getSnapshotDate(), snapshot.getRank(), snapshot.getPoints(),
            snapshot.getLeaderboardType());
    }
}
