package io.github.drompincen.tasksync.protocol.api;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Observed state of one board item. Assignee and labels are only meaningful when
 * {@code contentKind} is {@link ContentKind#ISSUE}; {@code repository} is only set for issues.
 */
public record BoardItemDto(
        String itemId,
        String contentId,
        ContentKind contentKind,
        String title,
        String status,
        String assignee,
        List<String> labels,
        LocalDate dueDate,
        String description,
        RepositoryRef repository
) {
    public BoardItemDto {
        contentKind = contentKind != null ? contentKind : ContentKind.NONE;
        title = title != null ? title : "";
        status = status != null ? status : "";
        description = description != null ? description : "";
        labels = labels != null ? List.copyOf(labels) : List.of();
    }

    public static BoardItemDto draft(String itemId, String contentId, String title, String status, String description) {
        return new BoardItemDto(itemId, contentId, ContentKind.DRAFT_ISSUE, title, status,
                null, List.of(), null, description, null);
    }

    public static BoardItemDto issue(String itemId, String contentId, String title, String status,
                                     String description, RepositoryRef repository) {
        return new BoardItemDto(itemId, contentId, ContentKind.ISSUE, title, status,
                null, List.of(), null, description, repository);
    }

    public boolean isIssue() {
        return contentKind == ContentKind.ISSUE;
    }

    public boolean isDraft() {
        return contentKind == ContentKind.DRAFT_ISSUE;
    }

    public List<String> sortedLabels() {
        List<String> sorted = new ArrayList<>(labels);
        Collections.sort(sorted);
        return sorted;
    }
}
