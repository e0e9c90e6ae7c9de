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

import java.util.List;

@Entity
@Immutable
@Table(name = "tournaments")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentRecord {
    public static final List<String> ACTIVE_STATUSES = List.of("registration_open", "ongoing", "in_progress");

    @Id
    @Column(name = "tournament_id")
    private Long tournamentId;

    @Column(name = "scoring_format")
    private String scoringFormat;

    @Column(name = "game_code")
    private String gameCode;

    @Column(name = "status", nullable = false)
    private String status;
}
