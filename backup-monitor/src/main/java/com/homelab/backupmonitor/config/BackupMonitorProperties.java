package com.homelab.backupmonitor.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the importer, the store and the query defaults.
 *
 * The import interval and retention window are bound as raw strings and parsed
 * leniently: an unparseable or out-of-range value falls back to a documented
 * default with a warning instead of failing startup.
 */
@Component
@ConfigurationProperties(prefix = "backup-monitor")
@Data
@Slf4j
public class BackupMonitorProperties {

    public static final double DEFAULT_INTERVAL_HOURS = 12;
    public static final long MIN_INTERVAL_SECONDS = 60;
    public static final int DEFAULT_RETENTION_DAYS = 90;

    private Storage storage = new Storage();
    private Source source = new Source();
    private Importing importing = new Importing();
    private Retention retention = new Retention();
    private Query query = new Query();

    @Data
    public static class Storage {
        private String dbPath = "/data/backups.db";
    }

    @Data
    public static class Source {
        private String metricsFile = "/data/metrics.jsonl";
    }

    @Data
    public static class Importing {
        /** Hours between scheduled imports, may be fractional. */
        private String intervalHours = String.valueOf(DEFAULT_INTERVAL_HOURS);
    }

    @Data
    public static class Retention {
        private String days = String.valueOf(DEFAULT_RETENTION_DAYS);
    }

    @Data
    public static class Query {
        private int summaryDays = 30;
        private int recentLimit = 30;
        private int failureLimit = 10;
    }

    /**
     * Effective delay between scheduled imports, never below one minute.
     */
    public Duration importInterval() {
        String raw = importing.getIntervalHours();
        double hours;
        try {
            hours = Double.parseDouble(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid import interval '{}' hours, using default {}h", raw, DEFAULT_INTERVAL_HOURS);
            return Duration.ofSeconds((long) (DEFAULT_INTERVAL_HOURS * 3600));
        }
        if (Double.isNaN(hours) || Double.isInfinite(hours)) {
            log.warn("Invalid import interval '{}' hours, using default {}h", raw, DEFAULT_INTERVAL_HOURS);
            return Duration.ofSeconds((long) (DEFAULT_INTERVAL_HOURS * 3600));
        }

        long seconds = (long) (hours * 3600);
        if (seconds < MIN_INTERVAL_SECONDS) {
            log.warn("Import interval too small ({}h), using minimum {} seconds", raw, MIN_INTERVAL_SECONDS);
            return Duration.ofSeconds(MIN_INTERVAL_SECONDS);
        }
        return Duration.ofSeconds(seconds);
    }

    /**
     * Effective retention window in days, at least 1.
     */
    public int retentionDays() {
        String raw = retention.getDays();
        int days;
        try {
            days = Integer.parseInt(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid retention '{}' days, using default {}", raw, DEFAULT_RETENTION_DAYS);
            return DEFAULT_RETENTION_DAYS;
        }
        if (days < 1) {
            log.warn("Retention must be positive (got {}), using default {}", days, DEFAULT_RETENTION_DAYS);
            return DEFAULT_RETENTION_DAYS;
        }
        return days;
    }
}
