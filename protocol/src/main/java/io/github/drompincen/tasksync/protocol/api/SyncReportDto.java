package io.github.drompincen.tasksync.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Machine-readable run summary, written for CI jobs.
 */
public record SyncReportDto(
        boolean dryRun,
        int created,
        int updated,
        int archived,
        int unarchived,
        int unchanged,
        List<String> errors,
        List<String> warnings,
        @JsonProperty("created_ids") Map<String, String> createdIds,
        @JsonProperty("matched_ids") Map<String, String> matchedIds
) {}
