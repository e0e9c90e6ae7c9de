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
 * Read-only view of a tournament registration owned by the tournament record store.
 */
@Entity
@Immutable
@Table(name = "tournament_registrations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantPlacement {
    @Id
    @Column(name = "registration_id")
    private Long registrationId;

    @Column(name = "tournament_id", nullable = false)
    private Long tournamentId;

    @Column(name = "player_id")
    private Long playerId;

    @Column(name = "team_id")
    private Long teamId;

    @Column(name = "placement")
    private Integer placement;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    // Set by the identity store when the team or player has been deleted
    @Column(name = "subject_deleted", nullable = false)
    private boolean subjectDeleted;

    /**
     * Id used to match this participant against match outcomes: the team for
     * team events, the player otherwise.
     */
    public Long competitorId() {
        return teamId != null ? teamId : playerId;
    }
}
