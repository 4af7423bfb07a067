package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.persistence.document.TaskDocument;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matches tasks to board items and decides, per task, whether to create, update, unarchive or
 * leave it alone; unmatched items owned by the scope are archived. Pure computation: the only
 * mutation is rewriting a task's board item id when a stale id is superseded by a title match.
 */
@Service
public class SyncPlanner {

    private static final Logger log = LoggerFactory.getLogger(SyncPlanner.class);

    public SyncPlan plan(List<TaskDocument> tasks, List<BoardItemDto> items, SyncScope scope) {
        SyncPlan plan = new SyncPlan();

        Map<String, BoardItemDto> byId = new HashMap<>();
        for (BoardItemDto item : items) {
            byId.putIfAbsent(item.itemId(), item);
        }
        Set<String> claimed = new HashSet<>();

        for (TaskDocument task : tasks) {
            if (task.hasBoardItemId()) {
                String id = task.getBoardItemId();
                BoardItemDto byIdMatch = byId.get(id);
                if (byIdMatch != null && claimed.add(id)) {
                    route(plan, task, byIdMatch, scope);
                    continue;
                }

                BoardItemDto byTitle = matchTitle(plan, task, items, claimed);
                if (byTitle != null) {
                    claimed.add(byTitle.itemId());
                    plan.addTitleMatched(task.getTitle());
                    log.info("Task '{}' had stale id '{}'; matched by title to {}",
                            task.getTitle(), id, byTitle.itemId());
                    task.setBoardItemId(byTitle.itemId());
                    // the identity changed, so the item gets the task's fields even when none differ
                    plan.addUpdate(task, byTitle);
                } else if (byIdMatch != null) {
                    // listed, but already taken by an earlier task in the file
                    plan.addWarning("Task '" + task.getTitle() + "' references " + id
                            + " which an earlier task already claimed; creating a new item");
                    log.warn("Task '{}' references {} which an earlier task already claimed; will create",
                            task.getTitle(), id);
                    plan.addCreate(task);
                } else {
                    log.info("Task '{}' references board id '{}' which is not listed; will unarchive",
                            task.getTitle(), id);
                    plan.addUnarchive(task);
                }
                continue;
            }

            BoardItemDto byTitle = matchTitle(plan, task, items, claimed);
            if (byTitle != null) {
                claimed.add(byTitle.itemId());
                plan.addTitleMatched(task.getTitle());
                log.info("Task '{}' matched by title to existing board item {}", task.getTitle(), byTitle.itemId());
                task.setBoardItemId(byTitle.itemId());
                route(plan, task, byTitle, scope);
            } else {
                plan.addCreate(task);
            }
        }

        for (BoardItemDto item : items) {
            if (claimed.contains(item.itemId()) || !scope.owns(item)) {
                continue;
            }
            // duplicate ids in a listing would otherwise be archived twice
            if (claimed.add(item.itemId())) {
                plan.addArchive(item);
            }
        }
        return plan;
    }

    /**
     * Fields that differ between the task and the item, in a fixed order. Assignee and labels
     * are compared only for issue content: nothing else can carry them, so any difference on a
     * draft or pull request would never converge.
     */
    public List<String> diff(TaskDocument task, BoardItemDto item) {
        List<String> changed = new ArrayList<>();
        if (!Objects.equals(task.getTitle(), item.title())) {
            changed.add("title");
        }
        if (task.hasStatus() && !task.getStatus().equalsIgnoreCase(item.status())) {
            changed.add("status");
        }
        if (!task.getDescription().strip().equals(item.description().strip())) {
            changed.add("description");
        }
        if (task.getDueDate() != null && !task.getDueDate().equals(item.dueDate())) {
            changed.add("due date");
        }
        if (item.contentKind().supportsAssigneesAndLabels()) {
            if (task.hasAssignee() && !task.getAssignee().equals(item.assignee())) {
                changed.add("assignee");
            }
            if (!task.getLabels().isEmpty() && !task.sortedLabels().equals(item.sortedLabels())) {
                changed.add("labels");
            }
        }
        return changed;
    }

    public boolean needsUpdate(TaskDocument task, BoardItemDto item) {
        return !diff(task, item).isEmpty();
    }

    private void route(SyncPlan plan, TaskDocument task, BoardItemDto item, SyncScope scope) {
        if (scope.hasRepository() && item.isDraft()) {
            log.debug("Draft '{}' ({}) will be converted to an issue in {}",
                    task.getTitle(), item.itemId(), scope.repository());
            plan.addUpdate(task, item);
            return;
        }
        List<String> changed = diff(task, item);
        if (changed.isEmpty()) {
            plan.addUnchanged(task, item);
        } else {
            log.debug("Task '{}' ({}) differs in {}", task.getTitle(), item.itemId(), changed);
            plan.addUpdate(task, item);
        }
    }

    /** First unclaimed item, in listing order, whose title equals the task's exactly. */
    private BoardItemDto matchTitle(SyncPlan plan, TaskDocument task, List<BoardItemDto> items, Set<String> claimed) {
        BoardItemDto first = null;
        int candidates = 0;
        for (BoardItemDto item : items) {
            if (claimed.contains(item.itemId()) || item.title().isEmpty() || !item.title().equals(task.getTitle())) {
                continue;
            }
            if (first == null) {
                first = item;
            }
            candidates++;
        }
        if (candidates > 1) {
            String warning = "Board has " + candidates + " unclaimed items titled '" + task.getTitle()
                    + "'; matched the first listed (" + first.itemId() + ")";
            plan.addWarning(warning);
            log.warn(warning);
        }
        return first;
    }
}
