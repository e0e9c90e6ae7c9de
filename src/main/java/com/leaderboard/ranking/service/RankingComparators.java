package com.leaderboard.ranking.service;

import com.leaderboard.ranking.model.RankCandidate;

import java.time.Instant;
import java.util.Comparator;

/**
 * Tie-break chains. Both end on the team and player ids so that no two candidates
 * ever compare equal and ranks never repeat.
 */
public final class RankingComparators {

    /** Placement asc, wins desc, registration asc, team id asc, player id asc. */
    public static final Comparator<RankCandidate> TOURNAMENT =
        Comparator.comparing(RankCandidate::getPlacement, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(RankCandidate::getWins, Comparator.<Integer>reverseOrder())
            .thenComparing(RankCandidate::getRegisteredAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(RankCandidate::getTeamId, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
            .thenComparing(RankCandidate::getPlayerId, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    /** Points desc, wins desc, registration asc, team id asc, player id asc. */
    public static final Comparator<RankCandidate> AGGREGATE =
        Comparator.comparing(RankCandidate::getPoints, Comparator.<Integer>reverseOrder())
            .thenComparing(RankCandidate::getWins, Comparator.<Integer>reverseOrder())
            .thenComparing(RankCandidate::getRegisteredAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(RankCandidate::getTeamId, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
            .thenComparing(RankCandidate::getPlayerId, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private RankingComparators() {
    }
}
