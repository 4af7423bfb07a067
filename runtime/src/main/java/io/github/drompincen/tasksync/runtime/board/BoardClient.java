package io.github.drompincen.tasksync.runtime.board;

import io.github.drompincen.tasksync.protocol.api.BoardFieldDto;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read and mutation surface of one project board. Implementations own their transport,
 * pagination, authentication and any per-board lookup caches; every method either returns
 * or throws a {@link BoardClientException}.
 */
public interface BoardClient {

    /** All non-archived items of the board, every page. */
    List<BoardItemDto> listItems();

    /** A single item by board item id, including archived ones. */
    Optional<BoardItemDto> getItem(String itemId);

    /** Board fields keyed by field name. */
    Map<String, BoardFieldDto> getFields();

    /** @return the new board item id */
    String addDraftIssue(String title, String body);

    /** @return the content id of the new issue */
    String createIssue(RepositoryRef repository, String title, String body);

    /** @return the board item id wrapping the content */
    String addItemToProject(String contentId);

    void updateFieldText(String itemId, String fieldId, String value);

    void updateFieldSingleSelect(String itemId, String fieldId, String optionId);

    void updateFieldDate(String itemId, String fieldId, LocalDate value);

    void updateDraftIssue(String draftIssueId, String title, String body);

    void updateIssue(String issueId, String title, String body);

    void setIssueAssignees(String issueId, List<String> userIds);

    void setIssueLabels(String issueId, List<String> labelIds);

    Optional<String> resolveUserId(String login);

    /** Ids of the labels found by name in the repository; unknown names are left out. */
    List<String> resolveLabelIds(RepositoryRef repository, List<String> labelNames);

    void archiveItem(String itemId);

    void unarchiveItem(String itemId);

    void reopenIssue(String issueId);
}
