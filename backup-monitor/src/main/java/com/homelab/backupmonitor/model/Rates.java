package com.homelab.backupmonitor.model;

/**
 * Throughput arithmetic shared by per-record views and the aggregator.
 */
public final class Rates {

    private Rates() {
    }

    /**
     * @return bytes / seconds, or null when seconds is not positive
     */
    public static Double bytesPerSecond(long bytes, long seconds) {
        if (seconds <= 0) return null;
        return (double) bytes / seconds;
    }
}
