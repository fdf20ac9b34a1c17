package com.homelab.backupmonitor.web;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Presentation conversions. The core works in bytes and bytes per second;
 * responses show MiB and MiB/s.
 */
final class RateUnits {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private RateUnits() {
    }

    /** Bytes per second to MB/s, rounded half-up to 2 decimals. Null rates become 0. */
    static double toMegabytesPerSecond(Double bytesPerSecond) {
        if (bytesPerSecond == null || bytesPerSecond <= 0) return 0.0;
        return BigDecimal.valueOf(bytesPerSecond / BYTES_PER_MB)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /** Bytes to whole megabytes, rounded down. */
    static long toWholeMegabytes(double bytes) {
        return (long) (bytes / BYTES_PER_MB);
    }
}
