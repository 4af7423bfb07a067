package io.github.drompincen.tasksync.persistence.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed tasks file. Task order is file order, which decides who wins a contested title match.
 */
public class TasksFileDocument {

    private final List<TaskDocument> tasks;
    private final String sourcePath;

    public TasksFileDocument(List<TaskDocument> tasks, String sourcePath) {
        this.tasks = tasks != null ? new ArrayList<>(tasks) : new ArrayList<>();
        this.sourcePath = sourcePath != null ? sourcePath : "";
    }

    public List<TaskDocument> getTasks() { return tasks; }

    public String getSourcePath() { return sourcePath; }

    public Map<String, List<TaskDocument>> byStatus() {
        Map<String, List<TaskDocument>> groups = new LinkedHashMap<>();
        for (TaskDocument task : tasks) {
            groups.computeIfAbsent(task.getStatus(), k -> new ArrayList<>()).add(task);
        }
        return groups;
    }

    public Map<String, TaskDocument> byBoardItemId() {
        Map<String, TaskDocument> index = new LinkedHashMap<>();
        for (TaskDocument task : tasks) {
            if (task.hasBoardItemId()) {
                index.put(task.getBoardItemId(), task);
            }
        }
        return index;
    }

    public List<TaskDocument> unlinkedTasks() {
        return tasks.stream().filter(t -> !t.hasBoardItemId()).toList();
    }
}
