package com.homelab.backupmonitor.store;

import com.homelab.backupmonitor.model.BackupRecord;
import com.homelab.backupmonitor.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackupRecordStore")
class BackupRecordStoreTest {

    @TempDir
    Path dir;

    private JdbcTemplate jdbcTemplate;
    private BackupRecordStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = TestDatabase.jdbcTemplate(dir);
        store = new BackupRecordStore(jdbcTemplate);
    }

    @Nested
    @DisplayName("with a current schema")
    class CurrentSchema {

        @BeforeEach
        void createSchema() {
            store.ensureSchema();
        }

        @Test
        @DisplayName("inserts a new backup_id once and ignores later copies")
        void insertIfAbsent() {
            BackupRecord first = TestDatabase.run("b1", "2026-10-15T03:00:00Z").sizeBytes(100).build();
            BackupRecord conflicting = TestDatabase.run("b1", "2026-10-16T03:00:00Z").sizeBytes(999).build();

            assertThat(store.upsertIfAbsent(first)).isTrue();
            assertThat(store.upsertIfAbsent(conflicting)).isFalse();
            assertThat(store.upsertIfAbsent(first)).isFalse();

            assertThat(store.count()).isEqualTo(1);
            assertThat(store.queryRecent(10)).containsExactly(first);
        }

        @Test
        @DisplayName("round-trips failure details and never stores them for successful runs")
        void storesErrorFieldsOnlyForFailures() {
            BackupRecord failed = TestDatabase.failure("f1", "2026-10-15T03:00:00Z", "upload").build();
            BackupRecord ok = TestDatabase.run("s1", "2026-10-15T04:00:00Z")
                    .errorCategory("upload").errorMessage("ignored").build();

            store.upsertIfAbsent(failed);
            store.upsertIfAbsent(ok);

            List<BackupRecord> stored = store.queryRecent(10);
            assertThat(stored.get(0).getErrorCategory()).isEqualTo("upload");
            assertThat(stored.get(0).getErrorMessage()).isEqualTo("upload during backup");
            assertThat(stored.get(1).getErrorCategory()).isNull();
            assertThat(stored.get(1).getErrorMessage()).isNull();
        }

        @Test
        @DisplayName("queryRecent returns the newest records in ascending order")
        void queryRecentOrdering() {
            store.upsertIfAbsent(TestDatabase.run("c", "2026-10-03T03:00:00Z").build());
            store.upsertIfAbsent(TestDatabase.run("a", "2026-10-01T03:00:00Z").build());
            store.upsertIfAbsent(TestDatabase.run("d", "2026-10-04T03:00:00Z").build());
            store.upsertIfAbsent(TestDatabase.run("b", "2026-10-02T03:00:00Z").build());

            assertThat(store.queryRecent(3))
                    .extracting(BackupRecord::getBackupId)
                    .containsExactly("b", "c", "d");
        }

        @Test
        @DisplayName("queryRecent refuses a limit below one")
        void queryRecentRejectsNonPositiveLimit() {
            store.upsertIfAbsent(TestDatabase.run("a", "2026-10-01T03:00:00Z").build());

            assertThatThrownBy(() -> store.queryRecent(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.queryRecent(-1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("equal timestamps keep insertion order")
        void tiesBrokenByInsertionOrder() {
            store.upsertIfAbsent(TestDatabase.run("second-written-first", "2026-10-05T03:00:00Z").build());
            store.upsertIfAbsent(TestDatabase.run("another", "2026-10-05T03:00:00Z").build());

            assertThat(store.queryRecent(2))
                    .extracting(BackupRecord::getBackupId)
                    .containsExactly("second-written-first", "another");
            assertThat(store.queryWindow("2026-10-01"))
                    .extracting(BackupRecord::getBackupId)
                    .containsExactly("second-written-first", "another");
        }

        @Test
        @DisplayName("queryWindow includes the boundary and excludes older records")
        void queryWindow() {
            store.upsertIfAbsent(TestDatabase.run("old", "2026-10-01T23:59:59Z").build());
            store.upsertIfAbsent(TestDatabase.run("edge", "2026-10-02T00:00:00").build());
            store.upsertIfAbsent(TestDatabase.run("new", "2026-10-03T08:00:00Z").build());

            assertThat(store.queryWindow("2026-10-02T00:00:00"))
                    .extracting(BackupRecord::getBackupId)
                    .containsExactly("edge", "new");
        }

        @Test
        @DisplayName("evictOlderThan deletes strictly older rows and is idempotent")
        void eviction() {
            store.upsertIfAbsent(TestDatabase.run("expired", "2026-07-18T11:59:59+00:00").build());
            store.upsertIfAbsent(TestDatabase.run("inside", "2026-07-18T12:00:01+00:00").build());

            assertThat(store.evictOlderThan("2026-07-18T12:00:00")).isEqualTo(1);
            assertThat(store.evictOlderThan("2026-07-18T12:00:00")).isZero();

            assertThat(store.queryWindow("2000-01-01"))
                    .extracting(BackupRecord::getBackupId)
                    .containsExactly("inside");
        }

        @Test
        @DisplayName("an evicted backup_id can be imported again as a new record")
        void evictedIdIsNoLongerReserved() {
            BackupRecord expired = TestDatabase.run("x", "2026-01-01T00:00:00Z").build();
            store.upsertIfAbsent(expired);
            store.evictOlderThan("2026-06-01");

            assertThat(store.queryRecent(10)).isEmpty();
            assertThat(store.upsertIfAbsent(expired)).isTrue();
        }

        @Test
        @DisplayName("ensureSchema is a no-op on a current database")
        void ensureSchemaIsIdempotent() {
            store.upsertIfAbsent(TestDatabase.run("keep", "2026-10-15T03:00:00Z").build());

            store.ensureSchema();
            store.ensureSchema();

            assertThat(store.count()).isEqualTo(1);
            assertThat(columns()).contains("volume_bytes", "error_category", "error_message");
        }
    }

    @Nested
    @DisplayName("migrating an older database")
    class LegacySchema {

        @BeforeEach
        void createLegacyTable() {
            jdbcTemplate.execute("""
                CREATE TABLE backups (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    timestamp TEXT NOT NULL,
                    backup_id TEXT NOT NULL UNIQUE,
                    success INTEGER NOT NULL,
                    duration_total INTEGER NOT NULL,
                    duration_snapshot INTEGER,
                    duration_archive INTEGER,
                    duration_volumes INTEGER,
                    duration_upload INTEGER,
                    size_bytes INTEGER NOT NULL,
                    created_at TEXT DEFAULT CURRENT_TIMESTAMP
                )
            """);
            jdbcTemplate.update("""
                INSERT INTO backups (timestamp, backup_id, success, duration_total, duration_snapshot,
                                     duration_archive, duration_volumes, duration_upload, size_bytes)
                VALUES ('2026-10-10T03:00:00+00:00', 'legacy-1', 0, 420, NULL, 200, 100, 100, 5000)
                """);
        }

        @Test
        @DisplayName("adds the missing columns with defaults and keeps existing rows")
        void addsColumnsWithDefaults() {
            store.ensureSchema();

            assertThat(columns()).contains("volume_bytes", "error_category", "error_message");

            Map<String, Object> row = jdbcTemplate.queryForMap(
                    "SELECT volume_bytes, error_category, error_message FROM backups WHERE backup_id = 'legacy-1'");
            assertThat(((Number) row.get("volume_bytes")).longValue()).isZero();
            assertThat(row.get("error_category")).isNull();
            assertThat(row.get("error_message")).isNull();

            BackupRecord legacy = store.queryRecent(1).get(0);
            assertThat(legacy.getBackupId()).isEqualTo("legacy-1");
            assertThat(legacy.getTimestamp()).isEqualTo("2026-10-10T03:00:00+00:00");
            assertThat(legacy.getDurationTotal()).isEqualTo(420);
            assertThat(legacy.getSizeBytes()).isEqualTo(5000);
            assertThat(legacy.getDurationSnapshot()).isZero();
            assertThat(legacy.getVolumeBytes()).isZero();
        }

        @Test
        @DisplayName("keeps accepting inserts and deduplicating after migration")
        void insertsAfterMigration() {
            store.ensureSchema();

            assertThat(store.upsertIfAbsent(TestDatabase.run("legacy-1", "2026-10-15T03:00:00Z").build())).isFalse();
            assertThat(store.upsertIfAbsent(TestDatabase.run("fresh", "2026-10-15T03:00:00Z")
                    .volumeBytes(77).build())).isTrue();

            assertThat(store.queryRecent(1).get(0).getVolumeBytes()).isEqualTo(77);
        }
    }

    private List<String> columns() {
        return jdbcTemplate.query("PRAGMA table_info(backups)", (rs, rowNum) -> rs.getString("name"));
    }
}
