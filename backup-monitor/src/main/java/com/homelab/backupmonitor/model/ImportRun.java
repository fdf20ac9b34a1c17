package com.homelab.backupmonitor.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Outcome of one import pass over the metrics log, kept for observability.
 */
@Data
@Builder
public class ImportRun {

    public enum Trigger { STARTUP, SCHEDULED, MANUAL }

    public enum Status { RUNNING, SUCCESS, NO_SOURCE, FAILED }

    private String runId;           // UUID
    private Trigger trigger;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;
    private int linesRead;          // non-blank lines only
    private int recordsInserted;
    private int duplicatesIgnored;
    private int linesRejected;
    private int recordsEvicted;
    private String errorMessage;    // null unless FAILED
}
