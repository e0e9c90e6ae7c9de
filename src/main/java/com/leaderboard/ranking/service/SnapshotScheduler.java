package com.leaderboard.ranking.service;

import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.dto.SnapshotRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SnapshotScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotScheduler.class);

    private final SnapshotService snapshotService;
    private final LeaderboardProperties properties;

    @Autowired
    public SnapshotScheduler(SnapshotService snapshotService, LeaderboardProperties properties) {
        this.snapshotService = snapshotService;
        this.properties = properties;
    }

    /**
     * Snapshot all tracked leaderboards once a day, shortly after midnight UTC.
     */
    @Scheduled(cron = "${leaderboards.snapshot.cron:0 5 0 * * *}", zone = "UTC")
    public void takeDailySnapshot() {
        try {
            SnapshotRunSummary summary = snapshotService.runDailySnapshot();
            if (summary.getScopesFailed() > 0) {
                logger.warn("Daily snapshot for {} had {} failed scopes", summary.getDate(), summary.getScopesFailed());
            }
        } catch (Exception e) {
            logger.error("Error running daily leaderboard snapshot", e);
        }
    }

    @Scheduled(cron = "${leaderboards.snapshot.compaction-cron:0 0 3 * * SUN}", zone = "UTC")
    public void purgeExpiredSnapshots() {
        try {
            snapshotService.purgeSnapshotsOlderThan(properties.getSnapshot().getRetentionDays());
        } catch (Exception e) {
            logger.error("Error purging expired leaderboard snapshots", e);
        }
    }
}
