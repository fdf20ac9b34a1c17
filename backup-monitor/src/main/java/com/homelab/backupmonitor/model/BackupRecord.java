package com.homelab.backupmonitor.model;

import lombok.Builder;
import lombok.Value;

/**
 * One completed backup run, as read from a single line of the metrics log.
 *
 * Created once at import time and never modified afterwards; removed only by
 * retention eviction.
 */
@Value
@Builder
public class BackupRecord {

    public static final String UNKNOWN_CATEGORY = "unknown";

    // ── Identity & time ─────────────────────────────────────────────────────
    /** ISO-8601 event time, stored verbatim. Orders records and drives retention. */
    String timestamp;

    /** Unique id of the run; a second record with the same id is ignored. */
    String backupId;

    boolean success;

    // ── Durations (seconds) ─────────────────────────────────────────────────
    long durationTotal;

    /**
     * Phase breakdown of durationTotal. Phases may overlap or be skipped, so
     * they are not required to add up. 0 when the producer did not report one.
     */
    long durationSnapshot;
    long durationArchive;
    long durationVolumes;
    long durationUpload;

    // ── Sizes (bytes) ───────────────────────────────────────────────────────
    long sizeBytes;

    /** Part of sizeBytes that came from volume data. */
    long volumeBytes;

    // ── Failure details, null on successful runs ────────────────────────────
    String errorCategory;
    String errorMessage;

    public Double overallBytesPerSecond() {
        return Rates.bytesPerSecond(sizeBytes, durationTotal);
    }

    public Double archiveBytesPerSecond() {
        return Rates.bytesPerSecond(sizeBytes, durationArchive);
    }

    public Double uploadBytesPerSecond() {
        return Rates.bytesPerSecond(sizeBytes, durationUpload);
    }

    public Double volumesBytesPerSecond() {
        return Rates.bytesPerSecond(volumeBytes, durationVolumes);
    }
}
