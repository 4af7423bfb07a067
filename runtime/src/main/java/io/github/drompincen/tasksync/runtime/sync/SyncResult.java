package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.protocol.api.SyncReportDto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run. The run failed iff {@link #getErrors()} is non-empty.
 */
public class SyncResult {

    private final boolean dryRun;
    private int created;
    private int updated;
    private int archived;
    private int unarchived;
    private int unchanged;
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, String> createdIds = new LinkedHashMap<>();
    private final Map<String, String> matchedIds = new LinkedHashMap<>();

    public SyncResult(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isDryRun() { return dryRun; }
    public int getCreated() { return created; }
    public int getUpdated() { return updated; }
    public int getArchived() { return archived; }
    public int getUnarchived() { return unarchived; }
    public int getUnchanged() { return unchanged; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
    public Map<String, String> getCreatedIds() { return Collections.unmodifiableMap(createdIds); }
    public Map<String, String> getMatchedIds() { return Collections.unmodifiableMap(matchedIds); }

    void incrementCreated() { created++; }
    void incrementUpdated() { updated++; }
    void incrementArchived() { archived++; }
    void incrementUnarchived() { unarchived++; }

    void setCreated(int created) { this.created = created; }
    void setUpdated(int updated) { this.updated = updated; }
    void setArchived(int archived) { this.archived = archived; }
    void setUnarchived(int unarchived) { this.unarchived = unarchived; }
    void setUnchanged(int unchanged) { this.unchanged = unchanged; }

    void addError(String error) { errors.add(error); }
    void addWarnings(List<String> more) { warnings.addAll(more); }
    void recordCreatedId(String title, String itemId) { createdIds.put(title, itemId); }
    void recordMatchedIds(Map<String, String> ids) { matchedIds.putAll(ids); }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Every title to item id mapping the run knows of; a created id wins over a matched one. */
    public Map<String, String> allIds() {
        Map<String, String> all = new LinkedHashMap<>(matchedIds);
        all.putAll(createdIds);
        return all;
    }

    public String summary() {
        return String.format("%d created, %d updated, %d archived, %d unarchived, %d unchanged, %d errors",
                created, updated, archived, unarchived, unchanged, errors.size());
    }

    public SyncReportDto toReport() {
        return new SyncReportDto(dryRun, created, updated, archived, unarchived, unchanged,
                List.copyOf(errors), List.copyOf(warnings),
                new LinkedHashMap<>(createdIds), new LinkedHashMap<>(matchedIds));
    }
}
