package com.leaderboard.ranking.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One day's rank and points for a subject within a scope. At most one row
 * exists per (date, type, scope reference, game filter, subject).
 */
@Entity
@Table(name = "leaderboard_snapshots",
    uniqueConstraints = @UniqueConstraint(name = "uq_snapshot_natural_key",
        columnNames = {"snapshot_date", "leaderboard_type", "scope_reference", "game_filter", "subject_type", "subject_id"}),
    indexes = {
        @Index(name = "idx_snapshot_subject_date", columnList = "subject_type,subject_id,snapshot_date"),
        @Index(name = "idx_snapshot_scope_date", columnList = "leaderboard_type,scope_reference,game_filter,snapshot_date")
    })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardSnapshot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_date", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate snapshotDate;

    // Wire name of the scope type: tournament, season, all_time
    @Column(name = "leaderboard_type", nullable = false, length = 32)
    private String leaderboardType;

    @Column(name = "scope_reference", nullable = false, length = 64)
    private String scopeReference;

    @Column(name = "game_filter", nullable = false, length = 64)
    private String gameFilter;

    @Enumerated(EnumType.STRING)
    @Column(name = "subject_type", nullable = false, length = 16)
    private SubjectType subjectType;

    @Column(name = "subject_id", nullable = false)
    private Long subjectId;

    @Column(name = "player_id")
    private Long playerId;

    @Column(name = "team_id")
    private Long teamId;

    @Column(name = "rank", nullable = false)
    private int rank;

    @Column(name = "points", nullable = false)
    private int points;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @JsonIgnore
    public String naturalKey() {
        return snapshotDate + "|" + leaderboardType + "|" + scopeReference + "|" + gameFilter
            + "|" + subjectType + "|" + subjectId;
    }

    @JsonIgnore
    public String subjectKey() {
        return subjectType.key(subjectId);
    }
}
