package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.persistence.document.TaskDocument;
import io.github.drompincen.tasksync.protocol.api.BoardFieldDto;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.runtime.board.BoardClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pushes a task's status, due date, assignee and labels onto a board item. Unresolvable
 * references never fail the item: they become warnings and the field is skipped.
 */
@Component
public class FieldApplier {

    private static final Logger log = LoggerFactory.getLogger(FieldApplier.class);

    static final String STATUS_FIELD = "Status";
    static final List<String> DUE_FIELDS = List.of("End date", "Due");

    private final BoardClient client;

    public FieldApplier(BoardClient client) {
        this.client = client;
    }

    /**
     * @param itemId board item to update
     * @param target what the item currently holds; assignee and labels are only applied when
     *               it is an issue with a content id. May be null.
     * @return warnings raised while applying
     */
    public List<String> apply(String itemId, TaskDocument task, Map<String, BoardFieldDto> fields, BoardItemDto target) {
        List<String> warnings = new ArrayList<>();

        if (task.hasStatus()) {
            applyStatus(itemId, task, fields, warnings);
        }
        if (task.getDueDate() != null) {
            dueDateField(fields).ifPresent(field -> {
                client.updateFieldDate(itemId, field.fieldId(), task.getDueDate());
                log.debug("Set due date of '{}' to {}", task.getTitle(), task.getDueDate());
            });
        }
        if (target != null && target.contentKind().supportsAssigneesAndLabels() && target.contentId() != null) {
            if (task.hasAssignee() && !task.getAssignee().equals(target.assignee())) {
                applyAssignee(task, target, warnings);
            }
            if (!task.getLabels().isEmpty() && !task.sortedLabels().equals(target.sortedLabels())) {
                applyLabels(task, target, warnings);
            }
        }

        warnings.forEach(log::warn);
        return warnings;
    }

    /** Option id for a status name: exact match first, then case-insensitive. */
    static Optional<String> matchStatusOption(String status, Map<String, String> options) {
        String exact = options.get(status);
        if (exact != null) {
            return Optional.of(exact);
        }
        return options.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(status))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    static Optional<BoardFieldDto> dueDateField(Map<String, BoardFieldDto> fields) {
        for (String name : DUE_FIELDS) {
            BoardFieldDto field = fields.get(name);
            if (field != null && field.isDate()) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    private void applyStatus(String itemId, TaskDocument task, Map<String, BoardFieldDto> fields, List<String> warnings) {
        BoardFieldDto statusField = fields.get(STATUS_FIELD);
        if (statusField == null) {
            warnings.add("Board has no '" + STATUS_FIELD + "' field; status of '" + task.getTitle() + "' not set");
            return;
        }
        Optional<String> optionId = matchStatusOption(task.getStatus(), statusField.options());
        if (optionId.isEmpty()) {
            warnings.add("Status '" + task.getStatus() + "' of '" + task.getTitle()
                    + "' matches no option of the board (available: " + statusField.options().keySet() + ")");
            return;
        }
        client.updateFieldSingleSelect(itemId, statusField.fieldId(), optionId.get());
        log.debug("Set status of '{}' to {}", task.getTitle(), task.getStatus());
    }

    private void applyAssignee(TaskDocument task, BoardItemDto target, List<String> warnings) {
        Optional<String> userId = client.resolveUserId(task.getAssignee());
        if (userId.isEmpty()) {
            warnings.add("Unknown GitHub user '" + task.getAssignee() + "' for '" + task.getTitle() + "'; assignee not set");
            return;
        }
        client.setIssueAssignees(target.contentId(), List.of(userId.get()));
        log.debug("Assigned '{}' to {}", task.getTitle(), task.getAssignee());
    }

    private void applyLabels(TaskDocument task, BoardItemDto target, List<String> warnings) {
        if (target.repository() == null) {
            warnings.add("Issue for '" + task.getTitle() + "' has no known repository; labels not set");
            return;
        }
        List<String> labelIds = client.resolveLabelIds(target.repository(), task.getLabels());
        if (labelIds.isEmpty()) {
            warnings.add("None of the labels " + task.getLabels() + " exist in " + target.repository()
                    + "; labels of '" + task.getTitle() + "' not set");
            return;
        }
        if (labelIds.size() < task.getLabels().size()) {
            warnings.add("Some labels of '" + task.getTitle() + "' do not exist in " + target.repository()
                    + " and were dropped");
        }
        client.setIssueLabels(target.contentId(), labelIds);
        log.debug("Labelled '{}' with {}", task.getTitle(), task.getLabels());
    }
}
