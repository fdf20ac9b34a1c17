package com.homelab.backupmonitor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Summary statistics over a trailing window of backup runs.
 *
 * Counts cover every run in the window. Duration, size and rate figures only
 * cover runs with a positive duration_total, and each rate average only covers
 * runs whose own phase duration is positive. Rates are in bytes per second;
 * any figure with no qualifying run is 0.
 */
@Value
@Builder
public class BackupSummary {

    long totalBackups;
    long successfulBackups;
    long failedBackups;

    /** Percentage of successful runs, rounded down. */
    int successRate;

    double avgDurationSeconds;
    long minDurationSeconds;
    long maxDurationSeconds;
    double avgSizeBytes;

    double avgOverallBytesPerSec;
    double avgArchiveBytesPerSec;
    double avgUploadBytesPerSec;
    double avgVolumesBytesPerSec;

    public static BackupSummary empty() {
        return BackupSummary.builder().build();
    }
}
