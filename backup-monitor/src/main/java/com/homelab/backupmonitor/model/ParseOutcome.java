package com.homelab.backupmonitor.model;

/**
 * Result of decoding one metrics log line: either a record or the reason it was rejected.
 */
public record ParseOutcome(BackupRecord record, String rejection) {

    public static ParseOutcome accepted(BackupRecord record) {
        return new ParseOutcome(record, null);
    }

    public static ParseOutcome rejected(String reason) {
        return new ParseOutcome(null, reason);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
