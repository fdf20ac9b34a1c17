package com.homelab.backupmonitor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.homelab.backupmonitor.model.BackupRecord;
import com.homelab.backupmonitor.model.ParseOutcome;
import com.homelab.backupmonitor.model.Timestamps;
import org.springframework.stereotype.Component;

/**
 * Decodes one metrics log line into a BackupRecord.
 *
 * Expected line shape (one JSON object per line):
 *   {"timestamp":"2026-01-15T03:00:12+00:00","backup_id":"2026-01-15_030000",
 *    "success":true,"duration_total":812,"duration_snapshot":4,"duration_archive":510,
 *    "duration_volumes":120,"duration_upload":178,"size_bytes":2147483648}
 *
 * Required: timestamp, backup_id, success, duration_total, size_bytes. A value
 * that cannot be converted counts as missing. Optional numbers default to 0
 * when absent or null. Error fields are kept only for failed runs.
 */
@Component
public class BackupRecordParser {

    private final ObjectReader reader;

    public BackupRecordParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ParseOutcome parse(String line) {
        JsonNode json;
        try {
            json = reader.readTree(line);
        } catch (JsonProcessingException e) {
            return ParseOutcome.rejected("not valid JSON: " + e.getOriginalMessage());
        }
        if (json == null || !json.isObject()) {
            return ParseOutcome.rejected("not a JSON object");
        }

        // ── Required ────────────────────────────────────────────────────────
        String timestamp = asTimestamp(json.get("timestamp"));
        if (timestamp == null) return ParseOutcome.rejected("timestamp missing or not ISO-8601");

        String backupId = asIdentifier(json.get("backup_id"));
        if (backupId == null) return ParseOutcome.rejected("backup_id missing or blank");

        Boolean success = asBoolean(json.get("success"));
        if (success == null) return ParseOutcome.rejected("success missing or not a boolean");

        Long durationTotal = asNonNegativeLong(json.get("duration_total"));
        if (durationTotal == null) return ParseOutcome.rejected("duration_total missing or not a non-negative integer");

        Long sizeBytes = asNonNegativeLong(json.get("size_bytes"));
        if (sizeBytes == null) return ParseOutcome.rejected("size_bytes missing or not a non-negative integer");

        // ── Optional ────────────────────────────────────────────────────────
        BackupRecord.BackupRecordBuilder builder = BackupRecord.builder()
                .timestamp(timestamp)
                .backupId(backupId)
                .success(success)
                .durationTotal(durationTotal)
                .sizeBytes(sizeBytes);

        Long snapshot = optionalLong(json, "duration_snapshot");
        Long archive = optionalLong(json, "duration_archive");
        Long volumes = optionalLong(json, "duration_volumes");
        Long upload = optionalLong(json, "duration_upload");
        Long volumeBytes = optionalLong(json, "volume_bytes");
        if (snapshot == null || archive == null || volumes == null || upload == null || volumeBytes == null) {
            return ParseOutcome.rejected("optional duration or volume_bytes is not a non-negative integer");
        }
        builder.durationSnapshot(snapshot)
                .durationArchive(archive)
                .durationVolumes(volumes)
                .durationUpload(upload)
                .volumeBytes(volumeBytes);

        if (!success) {
            String category = asText(json.get("error_category"));
            builder.errorCategory(category == null ? BackupRecord.UNKNOWN_CATEGORY : category)
                    .errorMessage(asText(json.get("error_message")));
        }

        return ParseOutcome.accepted(builder.build());
    }

    // ── Coercion helpers ─────────────────────────────────────────────────────

    private Long optionalLong(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) return 0L;
        return asNonNegativeLong(node);
    }

    private Long asNonNegativeLong(JsonNode node) {
        if (node == null || node.isNull()) return null;

        long value;
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) return null;
            value = node.longValue();
        } else if (node.isFloatingPointNumber()) {
            double d = node.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            value = (long) d;
        } else if (node.isTextual()) {
            try {
                value = Long.parseLong(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value < 0 ? null : value;
    }

    private Boolean asBoolean(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber()) return node.doubleValue() != 0;
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (text.equalsIgnoreCase("true")) return true;
            if (text.equalsIgnoreCase("false")) return false;
        }
        return null;
    }

    private String asIdentifier(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual() || node.isIntegralNumber()) {
            String text = node.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private String asTimestamp(JsonNode node) {
        if (node == null || !node.isTextual()) return null;
        String text = node.textValue().trim();
        return Timestamps.isValid(text) ? text : null;
    }

    private String asText(JsonNode node) {
        if (node == null || node.isNull()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
