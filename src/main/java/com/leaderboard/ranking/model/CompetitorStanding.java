package com.leaderboard.ranking.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Running per-season, per-game aggregate maintained by the record store.
 * Season and all-time leaderboards are ranked from these rows.
 */
@Entity
@Immutable
@Table(name = "competitor_standings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetitorStanding {
    @Id
    @Column(name = "standing_id")
    private Long standingId;

    @Column(name = "season_id", nullable = false)
    private String seasonId;

    @Column(name = "game_code", nullable = false)
    private String gameCode;

    @Column(name = "player_id")
    private Long playerId;

    @Column(name = "team_id")
    private Long teamId;

    @Column(name = "points", nullable = false)
    private int points;

    @Column(name = "wins", nullable = false)
    private int wins;

    @Column(name = "losses", nullable = false)
    private int losses;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
