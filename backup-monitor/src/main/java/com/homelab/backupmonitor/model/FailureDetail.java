package com.homelab.backupmonitor.model;

public record FailureDetail(String timestamp, String backupId, String errorCategory, String errorMessage) {}
