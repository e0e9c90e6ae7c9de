package com.leaderboard.ranking.config;

import com.leaderboard.ranking.model.ScoringTable;
import com.leaderboard.ranking.model.ScoringTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature flags, cache TTLs, scoring tables and snapshot job settings,
 * bound from {@code leaderboards.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "leaderboards")
public class LeaderboardProperties {

    /** Compute leaderboards at all. When off every read returns an empty, flagged result. */
    private boolean computeEnabled = true;

    /** Serve reads through the cache. When off every read recomputes and nothing is written. */
    private boolean cacheEnabled = true;

    /** Expose the read API. When off every endpoint answers 404. */
    private boolean apiEnabled = true;

    /** Upper bound on cache and record-store calls made for one API request. */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(2);

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Data
    public static class Cache {
        @NotNull
        private Duration tournamentTtl = Duration.ofMinutes(5);
        @NotNull
        private Duration seasonTtl = Duration.ofHours(1);
        @NotNull
        private Duration allTimeTtl = Duration.ofHours(24);
        @NotNull
        private Duration playerHistoryTtl = Duration.ofHours(1);
    }

    @Data
    public static class Scoring {
        /** Table used when a tournament names no format, or an unknown one. */
        @NotBlank
        private String defaultFormat = ScoringTable.STANDARD;

        /** Extra or overriding tables keyed by format name. */
        private Map<String, List<ScoringTier>> tables = new LinkedHashMap<>();
    }

    @Data
    public static class Snapshot {
        // cron, compaction-cron and store are read by @Scheduled and @ConditionalOnProperty

        @Min(1)
        private int retentionDays = 365;

        /** Budget for the record-store reads of one scope during a snapshot run. */
        @NotNull
        private Duration scopeTimeout = Duration.ofSeconds(60);

        /** Game codes that get their own season and all-time snapshots besides the cross-game one. */
        private List<String> gameCodes = new ArrayList<>();

        /** Directory used by the json store. */
        @NotBlank
        private String directory = "./data/snapshots";
    }
}
