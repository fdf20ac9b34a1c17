package com.homelab.backupmonitor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * SQLite-backed DataSource for the backups table.
 *
 * Every JDBC operation acquires its own connection. Write transactions begin
 * IMMEDIATE so concurrent import passes queue on the database write lock, and
 * WAL journalling lets readers see the last committed state while a pass runs.
 */
@Configuration
@Slf4j
public class StorageConfig {

    static final int BUSY_TIMEOUT_MS = 30_000;

    @Bean
    public DataSource dataSource(BackupMonitorProperties properties) {
        Path dbPath = Paths.get(properties.getStorage().getDbPath());
        log.info("Using SQLite database at {}", dbPath.toAbsolutePath());
        return sqliteDataSource(dbPath);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    public static DataSource sqliteDataSource(Path dbPath) {
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create database directory: " + parent, e);
            }
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        return dataSource;
    }
}
