package com.homelab.backupmonitor.scheduler;

import com.homelab.backupmonitor.config.BackupMonitorProperties;
import com.homelab.backupmonitor.model.ImportRun;
import com.homelab.backupmonitor.service.MetricsImportService;
import com.homelab.backupmonitor.store.BackupRecordStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the metrics import in the background.
 *
 * The first pass runs as soon as the scheduler starts, later passes follow at
 * a fixed delay (IMPORT_INTERVAL_HOURS, minimum one minute). A failed pass is
 * logged and the next one runs on schedule. On shutdown no new pass starts;
 * one already running is allowed to finish.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportScheduler implements SchedulingConfigurer {

    private final MetricsImportService importService;
    private final BackupRecordStore store;
    private final BackupMonitorProperties properties;

    private final AtomicBoolean firstPass = new AtomicBoolean(true);

    /**
     * Bring the database schema up to date before any import or query.
     */
    @PostConstruct
    public void onStartup() {
        try {
            store.ensureSchema();
        } catch (Exception e) {
            log.error("Could not initialise SQLite schema, the next import pass will retry: {}",
                    e.getMessage(), e);
        }
        log.info("Backup monitor configuration: database={}, metrics file={}, retention={} days",
                properties.getStorage().getDbPath(),
                properties.getSource().getMetricsFile(),
                properties.retentionDays());
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = properties.importInterval();
        log.info("Scheduling metrics import every {} (first run immediately)", interval);
        registrar.addFixedDelayTask(new FixedDelayTask(this::runScheduledImport, interval, Duration.ZERO));
    }

    /**
     * One scheduled pass. Never throws, so the schedule keeps running.
     */
    public void runScheduledImport() {
        ImportRun.Trigger trigger = firstPass.getAndSet(false)
                ? ImportRun.Trigger.STARTUP
                : ImportRun.Trigger.SCHEDULED;
        log.info("Running periodic metrics import ({})", trigger);
        try {
            ImportRun run = importService.importFromSource(trigger);
            log.info("Metrics import completed (inserted={})", run.getRecordsInserted());
        } catch (Exception e) {
            log.error("Periodic metrics import failed: {}", e.getMessage(), e);
        }
    }
}
