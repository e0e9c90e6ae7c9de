package com.leaderboard.ranking.service;

import com.leaderboard.ranking.config.LeaderboardProperties;
import com.leaderboard.ranking.exception.InvalidScoringTableException;
import com.leaderboard.ranking.model.ScoringTable;
import com.leaderboard.ranking.model.ScoringTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring tables keyed by tournament format. The built-in standard and
 * battle royale tables can be overridden, and new formats added, through
 * {@code leaderboards.scoring.tables}. Every table is validated when the
 * registry is built, so a bad configuration fails at startup.
 */
@Component
public class ScoringTableRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ScoringTableRegistry.class);

    private final Map<String, ScoringTable> tables;
    private final ScoringTable defaultTable;

    @Autowired
    public ScoringTableRegistry(LeaderboardProperties properties) {
        Map<String, ScoringTable> loaded = new LinkedHashMap<>();
        register(loaded, ScoringTable.standard());
        register(loaded, ScoringTable.battleRoyale());

        for (Map.Entry<String, List<ScoringTier>> configured : properties.getScoring().getTables().entrySet()) {
            ScoringTable table = ScoringTable.of(normalize(configured.getKey()), configured.getValue());
            register(loaded, table);
            logger.info("Loaded scoring table '{}' with {} tiers", table.getFormat(), table.getTiers().size());
        }

        String defaultFormat = normalize(properties.getScoring().getDefaultFormat());
        ScoringTable fallback = loaded.get(defaultFormat);
        if (fallback == null) {
            throw new InvalidScoringTableException("Default scoring format '" + defaultFormat + "' is not defined");
        }
        this.tables = Collections.unmodifiableMap(loaded);
        this.defaultTable = fallback;
    }

    public ScoringTable getDefaultTable() {
        return defaultTable;
    }

    /**
     * Table for a tournament format. A missing or unknown format resolves to the default table.
     */
    public ScoringTable resolve(String format) {
        if (format == null || format.trim().isEmpty()) {
            return defaultTable;
        }
        ScoringTable table = tables.get(normalize(format));
        if (table == null) {
            logger.warn("Unknown scoring format '{}', using '{}'", format, defaultTable.getFormat());
            return defaultTable;
        }
        return table;
    }

    public Map<String, ScoringTable> getTables() {
        return tables;
    }

    private static void register(Map<String, ScoringTable> tables, ScoringTable table) {
        tables.put(table.getFormat(), table);
    }

    private static String normalize(String format) {
        return format == null ? null : format.trim().toLowerCase().replace('-', '_');
    }
}
