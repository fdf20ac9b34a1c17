package com.homelab.backupmonitor.model;

/**
 * Number of failed runs for one error category within one ISO week.
 *
 * @param period   ISO week key, e.g. "2026-W07"
 * @param category error category, "unknown" when the run did not report one
 */
public record FailureTrend(String period, String category, long count) {}
