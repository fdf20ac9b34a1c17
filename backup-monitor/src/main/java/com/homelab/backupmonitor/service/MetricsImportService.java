package com.homelab.backupmonitor.service;

import com.homelab.backupmonitor.config.BackupMonitorProperties;
import com.homelab.backupmonitor.model.BackupRecord;
import com.homelab.backupmonitor.model.ImportRun;
import com.homelab.backupmonitor.model.ParseOutcome;
import com.homelab.backupmonitor.model.Timestamps;
import com.homelab.backupmonitor.store.BackupRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Imports the append-only metrics log into the store.
 *
 * Every pass re-reads the whole file and relies on the store's backup_id
 * uniqueness for deduplication, so re-importing an unchanged log inserts
 * nothing. Retention eviction runs at the end of every pass, in the same
 * transaction as the inserts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsImportService {

    private final BackupRecordParser parser;
    private final BackupRecordStore store;
    private final TransactionTemplate transactionTemplate;
    private final BackupMonitorProperties properties;
    private final Clock clock;

    private final AtomicReference<ImportRun> lastRun = new AtomicReference<>();

    /**
     * Bring the schema up to date, then read the configured metrics file and
     * import it. A missing file means no backups have reported yet and is not an error.
     *
     * @throws UncheckedIOException if the file exists but cannot be read
     * @throws org.springframework.dao.DataAccessException on storage failure
     */
    public ImportRun importFromSource(ImportRun.Trigger trigger) {
        Path source = Paths.get(properties.getSource().getMetricsFile());

        ImportRun run = ImportRun.builder()
                .runId(UUID.randomUUID().toString())
                .trigger(trigger)
                .startedAt(LocalDateTime.now(clock))
                .status(ImportRun.Status.RUNNING)
                .build();

        try {
            store.ensureSchema();
            List<String> lines = readLines(source);
            if (lines == null) {
                log.info("Metrics file {} not found yet, nothing to import", source);
                run.setStatus(ImportRun.Status.NO_SOURCE);
                run.setRecordsEvicted(transactionTemplate.execute(status -> evictExpired()));
            } else {
                importInto(run, lines);
                run.setStatus(ImportRun.Status.SUCCESS);
            }
            return run;

        } catch (RuntimeException e) {
            run.setStatus(ImportRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
            throw e;

        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            lastRun.set(run);
            log.info("Import {} ({}) finished: status={}, inserted={}, duplicates={}, rejected={}, evicted={}",
                    run.getRunId(), run.getTrigger(), run.getStatus(), run.getRecordsInserted(),
                    run.getDuplicatesIgnored(), run.getLinesRejected(), run.getRecordsEvicted());
        }
    }

    /**
     * Import the given log lines, then evict records past retention.
     *
     * @return number of records that were newly stored
     */
    public int importBatch(List<String> lines) {
        ImportRun run = ImportRun.builder()
                .runId(UUID.randomUUID().toString())
                .trigger(ImportRun.Trigger.MANUAL)
                .startedAt(LocalDateTime.now(clock))
                .build();
        importInto(run, lines);
        return run.getRecordsInserted();
    }

    public Optional<ImportRun> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void importInto(ImportRun run, List<String> lines) {
        transactionTemplate.executeWithoutResult(status -> {
            int lineNumber = 0;
            for (String line : lines) {
                lineNumber++;
                if (line.isBlank()) continue;
                run.setLinesRead(run.getLinesRead() + 1);

                ParseOutcome outcome = parser.parse(line);
                if (!outcome.isAccepted()) {
                    log.warn("Skipping invalid line {}: {}", lineNumber, outcome.rejection());
                    run.setLinesRejected(run.getLinesRejected() + 1);
                    continue;
                }

                BackupRecord record = outcome.record();
                if (store.upsertIfAbsent(record)) {
                    run.setRecordsInserted(run.getRecordsInserted() + 1);
                } else {
                    log.debug("Backup {} already stored, ignoring line {}", record.getBackupId(), lineNumber);
                    run.setDuplicatesIgnored(run.getDuplicatesIgnored() + 1);
                }
            }
            run.setRecordsEvicted(evictExpired());
        });
    }

    private int evictExpired() {
        return store.evictOlderThan(Timestamps.daysAgo(clock, properties.retentionDays()));
    }

    /**
     * @return all lines of the file, or null if it does not exist. Bytes that
     * are not valid UTF-8 are replaced, so a corrupt line fails parsing on its own.
     */
    private List<String> readLines(Path source) {
        try {
            return new String(Files.readAllBytes(source), StandardCharsets.UTF_8).lines().toList();
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metrics file " + source, e);
        }
    }
}
