package com.leaderboard.ranking.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotRunSummary {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_SKIPPED = "skipped";

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;
    private String status;
    private int scopesProcessed;
    private int scopesSkipped;
    private int scopesFailed;
    private int rowsInserted;
    private int rowsUpdated;
    private long durationMs;
}
