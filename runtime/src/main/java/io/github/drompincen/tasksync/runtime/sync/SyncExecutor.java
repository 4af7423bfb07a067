package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.persistence.document.TaskDocument;
import io.github.drompincen.tasksync.protocol.api.BoardFieldDto;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import io.github.drompincen.tasksync.runtime.board.BoardClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Carries out a {@link SyncPlan} against the board: unarchive, create, update, then archive,
 * one call at a time. A failing item is recorded as an error and the run moves on.
 */
@Service
public class SyncExecutor {

    private static final Logger log = LoggerFactory.getLogger(SyncExecutor.class);

    private final BoardClient client;
    private final FieldApplier fieldApplier;

    public SyncExecutor(BoardClient client, FieldApplier fieldApplier) {
        this.client = client;
        this.fieldApplier = fieldApplier;
    }

    public SyncResult execute(SyncPlan plan, SyncScope scope, boolean dryRun) {
        SyncResult result = new SyncResult(dryRun);
        result.recordMatchedIds(plan.matchedIds());
        result.addWarnings(plan.getWarnings());
        result.setUnchanged(plan.getUnchanged().size());

        if (dryRun) {
            logDryRun(plan, scope);
            result.setCreated(plan.getCreate().size());
            result.setUpdated(plan.getUpdate().size());
            result.setUnarchived(plan.getUnarchive().size());
            result.setArchived(plan.getArchive().size());
            return result;
        }

        Map<String, BoardFieldDto> fields = plan.hasMutations() ? client.getFields() : Map.of();

        for (TaskDocument task : plan.getUnarchive()) {
            try {
                unarchive(task, scope, fields, result);
                result.incrementUnarchived();
            } catch (Exception e) {
                fail(result, "unarchive", task.getTitle(), e);
            }
        }
        for (TaskDocument task : plan.getCreate()) {
            try {
                create(task, scope, fields, result);
                result.incrementCreated();
            } catch (Exception e) {
                fail(result, "create", task.getTitle(), e);
            }
        }
        for (SyncPlan.Match match : plan.getUpdate()) {
            try {
                if (scope.hasRepository() && match.item().isDraft()) {
                    convert(match, scope.repository(), fields, result);
                } else {
                    update(match, fields, result);
                }
                result.incrementUpdated();
            } catch (Exception e) {
                fail(result, "update", match.task().getTitle(), e);
            }
        }
        for (BoardItemDto item : plan.getArchive()) {
            try {
                client.archiveItem(item.itemId());
                log.info("[Sync] Archived '{}' ({})", item.title(), item.itemId());
                result.incrementArchived();
            } catch (Exception e) {
                fail(result, "archive", item.title(), e);
            }
        }

        log.info("[Sync] {}", result.summary());
        return result;
    }

    // -----------------------------------------------------------------------
    // Unarchive
    // -----------------------------------------------------------------------

    private void unarchive(TaskDocument task, SyncScope scope, Map<String, BoardFieldDto> fields, SyncResult result) {
        String itemId = task.getBoardItemId();
        client.unarchiveItem(itemId);
        BoardItemDto restored = client.getItem(itemId).orElse(null);
        if (restored != null && restored.isDraft() && scope.hasRepository()) {
            log.info("[Sync] Unarchived draft '{}' ({})", task.getTitle(), itemId);
            convert(new SyncPlan.Match(task, restored), scope.repository(), fields, result);
            return;
        }
        if (restored != null && restored.isIssue() && restored.contentId() != null) {
            try {
                client.reopenIssue(restored.contentId());
            } catch (Exception e) {
                String warning = "Could not reopen issue for '" + task.getTitle() + "': " + e.getMessage();
                log.warn(warning);
                result.addWarnings(List.of(warning));
            }
        }
        result.addWarnings(fieldApplier.apply(itemId, task, fields, restored));
        log.info("[Sync] Unarchived '{}' ({})", task.getTitle(), itemId);
    }

    // -----------------------------------------------------------------------
    // Create
    // -----------------------------------------------------------------------

    private void create(TaskDocument task, SyncScope scope, Map<String, BoardFieldDto> fields, SyncResult result) {
        String itemId;
        BoardItemDto target;
        if (scope.hasRepository()) {
            String issueId = client.createIssue(scope.repository(), task.getTitle(), task.getDescription());
            itemId = client.addItemToProject(issueId);
            target = BoardItemDto.issue(itemId, issueId, task.getTitle(), null, task.getDescription(), scope.repository());
        } else {
            itemId = client.addDraftIssue(task.getTitle(), task.getDescription());
            target = null;
        }
        result.recordCreatedId(task.getTitle(), itemId);
        result.addWarnings(fieldApplier.apply(itemId, task, fields, target));
        log.info("[Sync] Created '{}' ({})", task.getTitle(), itemId);
    }

    // -----------------------------------------------------------------------
    // Update
    // -----------------------------------------------------------------------

    private void convert(SyncPlan.Match match, RepositoryRef repository, Map<String, BoardFieldDto> fields, SyncResult result) {
        TaskDocument task = match.task();
        String issueId = client.createIssue(repository, task.getTitle(), task.getDescription());
        String itemId = client.addItemToProject(issueId);
        // recorded before the draft is archived so a failed archive still writes back the issue
        result.recordCreatedId(task.getTitle(), itemId);
        client.archiveItem(match.item().itemId());

        BoardItemDto target = BoardItemDto.issue(itemId, issueId, task.getTitle(), null, task.getDescription(), repository);
        result.addWarnings(fieldApplier.apply(itemId, task, fields, target));
        log.info("[Sync] Converted draft '{}' ({}) to an issue in {} ({})",
                task.getTitle(), match.item().itemId(), repository, itemId);
    }

    private void update(SyncPlan.Match match, Map<String, BoardFieldDto> fields, SyncResult result) {
        TaskDocument task = match.task();
        BoardItemDto item = match.item();
        result.addWarnings(fieldApplier.apply(item.itemId(), task, fields, item));

        boolean contentChanged = !task.getTitle().equals(item.title())
                || !task.getDescription().strip().equals(item.description().strip());
        if (contentChanged) {
            String skipped = switch (item.contentKind()) {
                case DRAFT_ISSUE -> {
                    client.updateDraftIssue(requireContentId(item), task.getTitle(), task.getDescription());
                    yield null;
                }
                case ISSUE -> {
                    client.updateIssue(requireContentId(item), task.getTitle(), task.getDescription());
                    yield null;
                }
                case PULL_REQUEST -> "pull request title and body are not synced";
                case NONE -> "item content is not accessible";
            };
            if (skipped != null) {
                String warning = "Title/description of '" + task.getTitle() + "' not updated: " + skipped;
                log.warn(warning);
                result.addWarnings(List.of(warning));
            }
        }
        log.info("[Sync] Updated '{}' ({})", task.getTitle(), item.itemId());
    }

    private static String requireContentId(BoardItemDto item) {
        if (item.contentId() == null) {
            throw new IllegalStateException("item " + item.itemId() + " has no content id");
        }
        return item.contentId();
    }

    // -----------------------------------------------------------------------
    // Reporting
    // -----------------------------------------------------------------------

    private static void fail(SyncResult result, String operation, String title, Exception e) {
        String error = "Failed to " + operation + " '" + title + "': " + e.getMessage();
        log.error(error);
        result.addError(error);
    }

    private void logDryRun(SyncPlan plan, SyncScope scope) {
        log.info("[DRY RUN] {}", plan.summary());
        for (TaskDocument task : plan.getUnarchive()) {
            log.info("[DRY RUN] Would unarchive '{}' ({})", task.getTitle(), task.getBoardItemId());
        }
        for (TaskDocument task : plan.getCreate()) {
            log.info("[DRY RUN] Would create {} '{}' (status: {})",
                    scope.hasRepository() ? "issue" : "draft", task.getTitle(), task.getStatus());
        }
        for (SyncPlan.Match match : plan.getUpdate()) {
            if (scope.hasRepository() && match.item().isDraft()) {
                log.info("[DRY RUN] Would convert draft '{}' ({}) to an issue in {}",
                        match.task().getTitle(), match.item().itemId(), scope.repository());
            } else {
                log.info("[DRY RUN] Would update '{}' ({})", match.task().getTitle(), match.item().itemId());
            }
        }
        for (BoardItemDto item : plan.getArchive()) {
            log.info("[DRY RUN] Would archive '{}' ({})", item.title(), item.itemId());
        }
        for (String title : plan.getTitleMatched()) {
            log.info("[DRY RUN] Title-matched '{}'", title);
        }
        Map<String, String> ids = plan.matchedIds();
        if (!ids.isEmpty()) {
            log.info("[DRY RUN] Would write back {} id(s): {}", ids.size(), ids);
        }
    }
}
