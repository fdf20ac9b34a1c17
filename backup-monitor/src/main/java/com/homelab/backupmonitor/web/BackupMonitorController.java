package com.homelab.backupmonitor.web;

import com.homelab.backupmonitor.config.BackupMonitorProperties;
import com.homelab.backupmonitor.model.BackupRecord;
import com.homelab.backupmonitor.model.BackupSummary;
import com.homelab.backupmonitor.model.FailureDetail;
import com.homelab.backupmonitor.model.FailureTrend;
import com.homelab.backupmonitor.model.ImportRun;
import com.homelab.backupmonitor.service.BackupStatsService;
import com.homelab.backupmonitor.service.MetricsImportService;
import com.homelab.backupmonitor.store.BackupRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON endpoints over the import, store and statistics services.
 * All computation lives in the services; this class only converts units and shapes responses.
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class BackupMonitorController {

    static final int MAX_LIMIT = 1000;

    private final BackupRecordStore store;
    private final BackupStatsService statsService;
    private final MetricsImportService importService;
    private final BackupMonitorProperties properties;
    private final Clock clock;

    // ── Queries ──────────────────────────────────────────────────────────────

    /**
     * Most recent backups, oldest first, with per-run throughput.
     *
     * GET /api/metrics?limit=30
     */
    @GetMapping("/metrics")
    public ResponseEntity<?> metrics(@RequestParam(required = false) Integer limit) {
        return respond("metrics", () -> {
            int n = checkLimit(limit, properties.getQuery().getRecentLimit());
            return store.queryRecent(n).stream().map(this::recordView).toList();
        });
    }

    /**
     * Summary over the trailing window.
     *
     * GET /api/stats?days=30
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats(@RequestParam(required = false) Integer days) {
        return respond("stats", () -> summaryView(statsService.summarize(checkDays(days))));
    }

    /**
     * GET /api/failures?limit=10
     */
    @GetMapping("/failures")
    public ResponseEntity<?> failures(@RequestParam(required = false) Integer limit) {
        return respond("failures", () -> {
            int n = checkLimit(limit, properties.getQuery().getFailureLimit());
            return statsService.recentFailures(n).stream().map(this::failureView).toList();
        });
    }

    /**
     * Failure counts per ISO week and error category.
     *
     * GET /api/failure-trends?days=30
     */
    @GetMapping("/failure-trends")
    public ResponseEntity<?> failureTrends(@RequestParam(required = false) Integer days) {
        return respond("failure-trends", () ->
                statsService.failureTrends(checkDays(days)).stream().map(this::trendView).toList());
    }

    // ── Import ───────────────────────────────────────────────────────────────

    /**
     * Import the metrics log now and report how many new runs were stored.
     */
    @PostMapping("/import")
    public ResponseEntity<?> triggerImport() {
        return respond("import", () -> {
            ImportRun run = importService.importFromSource(ImportRun.Trigger.MANUAL);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("imported_at", LocalDateTime.now(clock).toString());
            body.put("inserted", run.getRecordsInserted());
            return body;
        });
    }

    @GetMapping("/import/status")
    public ResponseEntity<?> importStatus() {
        return importService.lastRun()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of("status", "no import has run yet")));
    }

    // ── Views ────────────────────────────────────────────────────────────────

    private Map<String, Object> recordView(BackupRecord r) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("timestamp", r.getTimestamp());
        view.put("backup_id", r.getBackupId());
        view.put("success", r.isSuccess());
        view.put("duration_total", r.getDurationTotal());
        view.put("duration_snapshot", r.getDurationSnapshot());
        view.put("duration_archive", r.getDurationArchive());
        view.put("duration_volumes", r.getDurationVolumes());
        view.put("duration_upload", r.getDurationUpload());
        view.put("size_bytes", r.getSizeBytes());
        view.put("volume_bytes", r.getVolumeBytes());
        view.put("throughput_mb_per_sec", RateUnits.toMegabytesPerSecond(r.overallBytesPerSecond()));
        view.put("archive_mb_per_sec", RateUnits.toMegabytesPerSecond(r.archiveBytesPerSecond()));
        view.put("upload_mb_per_sec", RateUnits.toMegabytesPerSecond(r.uploadBytesPerSecond()));
        view.put("volumes_mb_per_sec", RateUnits.toMegabytesPerSecond(r.volumesBytesPerSecond()));
        view.put("error_category", r.getErrorCategory());
        view.put("error_message", r.getErrorMessage());
        return view;
    }

    static Map<String, Object> summaryView(BackupSummary s) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("total_backups", s.getTotalBackups());
        view.put("avg_duration", (long) s.getAvgDurationSeconds());
        view.put("max_duration", s.getMaxDurationSeconds());
        view.put("min_duration", s.getMinDurationSeconds());
        view.put("avg_size_mb", RateUnits.toWholeMegabytes(s.getAvgSizeBytes()));
        view.put("success_rate", s.getSuccessRate());
        view.put("failed_backups", s.getFailedBackups());
        view.put("avg_throughput_mb_per_sec", RateUnits.toMegabytesPerSecond(s.getAvgOverallBytesPerSec()));
        view.put("avg_overall_mb_per_sec", RateUnits.toMegabytesPerSecond(s.getAvgOverallBytesPerSec()));
        view.put("avg_archive_mb_per_sec", RateUnits.toMegabytesPerSecond(s.getAvgArchiveBytesPerSec()));
        view.put("avg_upload_mb_per_sec", RateUnits.toMegabytesPerSecond(s.getAvgUploadBytesPerSec()));
        view.put("avg_volumes_mb_per_sec", RateUnits.toMegabytesPerSecond(s.getAvgVolumesBytesPerSec()));
        return view;
    }

    private Map<String, Object> failureView(FailureDetail f) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("timestamp", f.timestamp());
        view.put("backup_id", f.backupId());
        view.put("error_category", f.errorCategory());
        view.put("error_message", f.errorMessage());
        return view;
    }

    private Map<String, Object> trendView(FailureTrend t) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("week", t.period());
        view.put("error_category", t.category());
        view.put("count", t.count());
        return view;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private int checkLimit(Integer limit, int fallback) {
        int n = limit == null ? fallback : limit;
        if (n < 1 || n > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return n;
    }

    private int checkDays(Integer days) {
        int n = days == null ? properties.getQuery().getSummaryDays() : days;
        if (n < 1) {
            throw new IllegalArgumentException("days must be at least 1");
        }
        return n;
    }

    private ResponseEntity<?> respond(String endpoint, Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("{} request failed: {}", endpoint, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
