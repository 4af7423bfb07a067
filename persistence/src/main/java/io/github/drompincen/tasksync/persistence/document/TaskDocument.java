package io.github.drompincen.tasksync.persistence.document;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One task block of a tasks file: the desired state of a board item.
 */
public class TaskDocument {

    private String title;
    private String status;
    private String description = "";
    private String boardItemId;
    private String assignee;
    private List<String> labels = new ArrayList<>();
    private LocalDate dueDate;

    public TaskDocument() {}

    public TaskDocument(String title, String status) {
        this.title = title;
        this.status = status;
    }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description != null ? description : ""; }

    public String getBoardItemId() { return boardItemId; }
    public void setBoardItemId(String boardItemId) { this.boardItemId = boardItemId; }

    public String getAssignee() { return assignee; }
    public void setAssignee(String assignee) { this.assignee = assignee; }

    public List<String> getLabels() { return labels; }
    public void setLabels(List<String> labels) { this.labels = labels != null ? new ArrayList<>(labels) : new ArrayList<>(); }

    public LocalDate getDueDate() { return dueDate; }
    public void setDueDate(LocalDate dueDate) { this.dueDate = dueDate; }

    public boolean hasBoardItemId() {
        return boardItemId != null && !boardItemId.isBlank();
    }

    public boolean hasStatus() {
        return status != null && !status.isBlank();
    }

    public boolean hasAssignee() {
        return assignee != null && !assignee.isBlank();
    }

    public List<String> sortedLabels() {
        List<String> sorted = new ArrayList<>(labels);
        Collections.sort(sorted);
        return sorted;
    }

    @Override
    public String toString() {
        return "TaskDocument{title='" + title + "', status='" + status + "', boardItemId=" + boardItemId + "}";
    }
}
