package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.persistence.document.TaskDocument;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a run will do, computed without side effects. Every task sits in exactly one of
 * create / update / unarchive / unchanged; every board item id appears at most once across
 * update / unchanged / archive.
 */
public class SyncPlan {

    /** A task paired with the board item it was matched to. */
    public record Match(TaskDocument task, BoardItemDto item) {}

    private final List<TaskDocument> create = new ArrayList<>();
    private final List<Match> update = new ArrayList<>();
    private final List<TaskDocument> unarchive = new ArrayList<>();
    private final List<BoardItemDto> archive = new ArrayList<>();
    private final List<Match> unchanged = new ArrayList<>();
    private final Set<String> titleMatched = new LinkedHashSet<>();
    private final List<String> warnings = new ArrayList<>();

    public List<TaskDocument> getCreate() { return Collections.unmodifiableList(create); }
    public List<Match> getUpdate() { return Collections.unmodifiableList(update); }
    public List<TaskDocument> getUnarchive() { return Collections.unmodifiableList(unarchive); }
    public List<BoardItemDto> getArchive() { return Collections.unmodifiableList(archive); }
    public List<Match> getUnchanged() { return Collections.unmodifiableList(unchanged); }
    public Set<String> getTitleMatched() { return Collections.unmodifiableSet(titleMatched); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    void addCreate(TaskDocument task) { create.add(task); }
    void addUpdate(TaskDocument task, BoardItemDto item) { update.add(new Match(task, item)); }
    void addUnarchive(TaskDocument task) { unarchive.add(task); }
    void addArchive(BoardItemDto item) { archive.add(item); }
    void addUnchanged(TaskDocument task, BoardItemDto item) { unchanged.add(new Match(task, item)); }
    void addTitleMatched(String title) { titleMatched.add(title); }
    void addWarning(String warning) { warnings.add(warning); }

    /** Title to board item id for every matched task, update and unchanged alike. */
    public Map<String, String> matchedIds() {
        Map<String, String> ids = new LinkedHashMap<>();
        for (Match m : update) {
            ids.put(m.task().getTitle(), m.item().itemId());
        }
        for (Match m : unchanged) {
            ids.put(m.task().getTitle(), m.item().itemId());
        }
        return ids;
    }

    public boolean hasMutations() {
        return !create.isEmpty() || !update.isEmpty() || !unarchive.isEmpty() || !archive.isEmpty();
    }

    public String summary() {
        return String.format("%d create, %d update, %d unarchive, %d archive, %d unchanged",
                create.size(), update.size(), unarchive.size(), archive.size(), unchanged.size());
    }
}
