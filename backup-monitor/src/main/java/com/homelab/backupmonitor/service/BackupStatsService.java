package com.homelab.backupmonitor.service;

import com.homelab.backupmonitor.model.BackupRecord;
import com.homelab.backupmonitor.model.BackupSummary;
import com.homelab.backupmonitor.model.FailureDetail;
import com.homelab.backupmonitor.model.FailureTrend;
import com.homelab.backupmonitor.model.Timestamps;
import com.homelab.backupmonitor.store.BackupRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derived statistics over the stored backup runs.
 *
 * Rate averages are the mean of per-run ratios, not total bytes over total
 * seconds. A run only contributes to a rate when that rate's duration is
 * positive, and only to duration/size/rate figures when duration_total is
 * positive; it always counts toward the totals.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackupStatsService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Summary of the trailing {@code windowDays}. An empty window yields
     * {@link BackupSummary#empty()}.
     */
    public BackupSummary summarize(int windowDays) {
        String since = Timestamps.daysAgo(clock, windowDays);

        String sql = """
            SELECT
                COUNT(*) AS total_backups,
                SUM(CASE WHEN success = 1 THEN 1 ELSE 0 END) AS successful,

                AVG(CASE WHEN duration_total > 0 THEN duration_total END) AS avg_duration,
                MIN(CASE WHEN duration_total > 0 THEN duration_total END) AS min_duration,
                MAX(CASE WHEN duration_total > 0 THEN duration_total END) AS max_duration,
                AVG(CASE WHEN duration_total > 0 THEN size_bytes END)     AS avg_size,

                -- overall throughput: size_bytes / duration_total
                AVG(CASE WHEN duration_total > 0
                    THEN CAST(size_bytes AS REAL) / duration_total
                END) AS avg_overall_bps,

                -- archive rate: size_bytes / duration_archive
                AVG(CASE WHEN duration_total > 0 AND duration_archive > 0
                    THEN CAST(size_bytes AS REAL) / duration_archive
                END) AS avg_archive_bps,

                -- upload rate: size_bytes / duration_upload
                AVG(CASE WHEN duration_total > 0 AND duration_upload > 0
                    THEN CAST(size_bytes AS REAL) / duration_upload
                END) AS avg_upload_bps,

                -- volumes rate: volume_bytes / duration_volumes
                AVG(CASE WHEN duration_total > 0 AND duration_volumes > 0
                    THEN CAST(COALESCE(volume_bytes, 0) AS REAL) / duration_volumes
                END) AS avg_volumes_bps

            FROM backups
            WHERE timestamp >= ?
            """;

        BackupSummary summary = jdbcTemplate.queryForObject(sql, (rs, rowNum) -> toSummary(rs), since);
        log.debug("Summary since {}: {}", since, summary);
        return summary == null ? BackupSummary.empty() : summary;
    }

    /**
     * Failed runs in the trailing {@code windowDays}, counted per ISO week and
     * error category, ordered by week then category.
     */
    public List<FailureTrend> failureTrends(int windowDays) {
        String since = Timestamps.daysAgo(clock, windowDays);

        List<Map<String, Object>> rows = jdbcTemplate.queryForList("""
            SELECT timestamp, error_category
            FROM backups
            WHERE success = 0 AND timestamp >= ?
            """, since);

        // week -> category -> count, both sorted
        Map<String, Map<String, Long>> grouped = new TreeMap<>();
        for (Map<String, Object> row : rows) {
            String timestamp = (String) row.get("timestamp");
            String week;
            try {
                week = Timestamps.isoWeekOf(timestamp);
            } catch (DateTimeParseException e) {
                log.warn("Skipping failure with unparseable timestamp '{}' in trends", timestamp);
                continue;
            }
            String category = categoryOrUnknown((String) row.get("error_category"));
            grouped.computeIfAbsent(week, k -> new TreeMap<>()).merge(category, 1L, Long::sum);
        }

        List<FailureTrend> trends = new ArrayList<>();
        grouped.forEach((week, byCategory) ->
                byCategory.forEach((category, count) -> trends.add(new FailureTrend(week, category, count))));
        return trends;
    }

    /**
     * The {@code limit} most recent failed runs, newest first.
     */
    public List<FailureDetail> recentFailures(int limit) {
        BackupRecordStore.requirePositiveLimit(limit);
        return jdbcTemplate.query("""
            SELECT timestamp, backup_id, error_category, error_message
            FROM backups
            WHERE success = 0
            ORDER BY timestamp DESC, id DESC
            LIMIT ?
            """,
                (rs, rowNum) -> new FailureDetail(
                        rs.getString("timestamp"),
                        rs.getString("backup_id"),
                        categoryOrUnknown(rs.getString("error_category")),
                        rs.getString("error_message")),
                limit);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private BackupSummary toSummary(ResultSet rs) throws SQLException {
        long total = rs.getLong("total_backups");
        if (total == 0) {
            return BackupSummary.empty();
        }
        long successful = rs.getLong("successful");

        return BackupSummary.builder()
                .totalBackups(total)
                .successfulBackups(successful)
                .failedBackups(total - successful)
                .successRate((int) (successful * 100 / total))
                .avgDurationSeconds(rs.getDouble("avg_duration"))
                .minDurationSeconds(rs.getLong("min_duration"))
                .maxDurationSeconds(rs.getLong("max_duration"))
                .avgSizeBytes(rs.getDouble("avg_size"))
                .avgOverallBytesPerSec(rs.getDouble("avg_overall_bps"))
                .avgArchiveBytesPerSec(rs.getDouble("avg_archive_bps"))
                .avgUploadBytesPerSec(rs.getDouble("avg_upload_bps"))
                .avgVolumesBytesPerSec(rs.getDouble("avg_volumes_bps"))
                .build();
    }

    private static String categoryOrUnknown(String category) {
        return category == null || category.isBlank() ? BackupRecord.UNKNOWN_CATEGORY : category;
    }
}
