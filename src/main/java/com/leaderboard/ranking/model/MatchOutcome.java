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

@Entity
@Immutable
@Table(name = "tournament_matches")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchOutcome {
    public static final String STATE_COMPLETED = "completed";

    @Id
    @Column(name = "match_id")
    private Long matchId;

    @Column(name = "tournament_id", nullable = false)
    private Long tournamentId;

    @Column(name = "winner_id")
    private Long winnerId;

    @Column(name = "loser_id")
    private Long loserId;

    @Column(name = "state", nullable = false)
    private String state;
}
