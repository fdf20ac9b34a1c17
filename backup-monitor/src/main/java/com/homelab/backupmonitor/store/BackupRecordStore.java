package com.homelab.backupmonitor.store;

import com.homelab.backupmonitor.model.BackupRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * SQLite table of backup runs, one row per backup_id.
 *
 * Rows are ordered by timestamp (ISO-8601 strings sort chronologically) with
 * ties broken by insertion order. Schema changes are additive only: columns are
 * added with defaults and never dropped or renamed, so databases written by
 * older versions stay readable.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BackupRecordStore {

    static final String TABLE = "backups";

    /** Columns added after the first release, with the defaults existing rows receive. */
    static final List<ColumnMigration> MIGRATIONS = List.of(
            new ColumnMigration("volume_bytes", "INTEGER DEFAULT 0"),
            new ColumnMigration("error_category", "TEXT"),
            new ColumnMigration("error_message", "TEXT")
    );

    private static final String SELECT_COLUMNS = """
            SELECT timestamp, backup_id, success, duration_total,
                   COALESCE(duration_snapshot, 0) AS duration_snapshot,
                   COALESCE(duration_archive, 0)  AS duration_archive,
                   COALESCE(duration_volumes, 0)  AS duration_volumes,
                   COALESCE(duration_upload, 0)   AS duration_upload,
                   size_bytes,
                   COALESCE(volume_bytes, 0)      AS volume_bytes,
                   error_category, error_message
            FROM backups
            """;

    private static final RowMapper<BackupRecord> ROW_MAPPER = (rs, rowNum) -> BackupRecord.builder()
            .timestamp(rs.getString("timestamp"))
            .backupId(rs.getString("backup_id"))
            .success(rs.getInt("success") == 1)
            .durationTotal(rs.getLong("duration_total"))
            .durationSnapshot(rs.getLong("duration_snapshot"))
            .durationArchive(rs.getLong("duration_archive"))
            .durationVolumes(rs.getLong("duration_volumes"))
            .durationUpload(rs.getLong("duration_upload"))
            .sizeBytes(rs.getLong("size_bytes"))
            .volumeBytes(rs.getLong("volume_bytes"))
            .errorCategory(rs.getString("error_category"))
            .errorMessage(rs.getString("error_message"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    record ColumnMigration(String name, String definition) {}

    /**
     * Create the table if needed and add any columns missing from an older
     * database. Safe to run on every startup; a current schema is left untouched.
     */
    public void ensureSchema() {
        log.debug("Ensuring SQLite schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS backups (
                id                INTEGER PRIMARY KEY AUTOINCREMENT,
                timestamp         TEXT    NOT NULL,
                backup_id         TEXT    NOT NULL UNIQUE,
                success           INTEGER NOT NULL,
                duration_total    INTEGER NOT NULL,
                duration_snapshot INTEGER,
                duration_archive  INTEGER,
                duration_volumes  INTEGER,
                duration_upload   INTEGER,
                size_bytes        INTEGER NOT NULL,
                volume_bytes      INTEGER DEFAULT 0,
                error_category    TEXT,
                error_message     TEXT,
                created_at        TEXT    DEFAULT CURRENT_TIMESTAMP
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_timestamp ON backups(timestamp)");

        Set<String> present = existingColumns();
        for (ColumnMigration migration : MIGRATIONS) {
            if (!present.contains(migration.name())) {
                log.info("Migrating DB: adding column {}.{}", TABLE, migration.name());
                jdbcTemplate.execute("ALTER TABLE " + TABLE + " ADD COLUMN "
                        + migration.name() + " " + migration.definition());
            }
        }

        log.debug("SQLite schema ready.");
    }

    /**
     * Insert the record unless its backup_id is already stored.
     *
     * @return true if a new row was written, false for a duplicate
     */
    public boolean upsertIfAbsent(BackupRecord r) {
        int changed = jdbcTemplate.update("""
            INSERT OR IGNORE INTO backups
            (timestamp, backup_id, success, duration_total, duration_snapshot,
             duration_archive, duration_volumes, duration_upload, size_bytes,
             volume_bytes, error_category, error_message)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
                r.getTimestamp(),
                r.getBackupId(),
                r.isSuccess() ? 1 : 0,
                r.getDurationTotal(),
                r.getDurationSnapshot(),
                r.getDurationArchive(),
                r.getDurationVolumes(),
                r.getDurationUpload(),
                r.getSizeBytes(),
                r.getVolumeBytes(),
                r.isSuccess() ? null : r.getErrorCategory(),
                r.isSuccess() ? null : r.getErrorMessage());
        return changed == 1;
    }

    /**
     * The newest {@code limit} records, returned oldest first.
     */
    public List<BackupRecord> queryRecent(int limit) {
        requirePositiveLimit(limit);
        List<BackupRecord> newestFirst = new ArrayList<>(jdbcTemplate.query(
                SELECT_COLUMNS + " ORDER BY timestamp DESC, id DESC LIMIT ?", ROW_MAPPER, limit));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    /**
     * All records with timestamp >= since, oldest first.
     */
    public List<BackupRecord> queryWindow(String since) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + " WHERE timestamp >= ? ORDER BY timestamp ASC, id ASC", ROW_MAPPER, since);
    }

    /**
     * Delete every record with timestamp strictly before the cutoff.
     *
     * @return number of rows removed
     */
    public int evictOlderThan(String cutoff) {
        int deleted = jdbcTemplate.update("DELETE FROM backups WHERE timestamp < ?", cutoff);
        if (deleted > 0) {
            log.info("Retention removed {} records older than {}", deleted, cutoff);
        }
        return deleted;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM backups", Long.class);
        return count == null ? 0 : count;
    }

    private Set<String> existingColumns() {
        return new HashSet<>(jdbcTemplate.query(
                "PRAGMA table_info(" + TABLE + ")", (rs, rowNum) -> rs.getString("name")));
    }

    /** SQLite reads a negative LIMIT as "no limit". */
    public static void requirePositiveLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, was " + limit);
        }
    }
}
