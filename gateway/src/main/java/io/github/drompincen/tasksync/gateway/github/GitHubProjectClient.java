package io.github.drompincen.tasksync.gateway.github;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.tasksync.protocol.api.BoardFieldDto;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import io.github.drompincen.tasksync.runtime.board.BoardClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BoardClient} for an organization-owned GitHub Projects v2 board. The project id,
 * field map, repository lookups and user ids are cached per instance.
 */
public class GitHubProjectClient implements BoardClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubProjectClient.class);

    private final GraphQlTransport transport;
    private final String org;
    private final int projectNumber;

    private String projectId;
    private Map<String, BoardFieldDto> fields;
    private final Map<RepositoryRef, RepositoryInfo> repositories = new HashMap<>();
    private final Map<String, Optional<String>> userIds = new HashMap<>();

    private record RepositoryInfo(String id, Map<String, String> labelIds) {}

    public GitHubProjectClient(GraphQlTransport transport, String org, int projectNumber) {
        this.transport = transport;
        this.org = org;
        this.projectNumber = projectNumber;
    }

    // -----------------------------------------------------------------------
    // Project discovery
    // -----------------------------------------------------------------------

    String projectId() {
        if (projectId == null) {
            JsonNode data = transport.execute(ProjectQueries.PROJECT_ID, Map.of("org", org, "number", projectNumber));
            JsonNode id = data.path("organization").path("projectV2").path("id");
            if (id.isMissingNode() || id.isNull()) {
                throw new GitHubApiException("Project #" + projectNumber + " not found in organization " + org,
                        0, List.of("NOT_FOUND"));
            }
            projectId = id.asText();
            log.debug("Resolved project {}#{} to {}", org, projectNumber, projectId);
        }
        return projectId;
    }

    @Override
    public Map<String, BoardFieldDto> getFields() {
        if (fields == null) {
            JsonNode data = transport.execute(ProjectQueries.FIELDS, Map.of("projectId", projectId()));
            fields = BoardItemNodeMapper.toFields(data.path("node").path("fields").path("nodes"));
            log.debug("Board fields: {}", fields.keySet());
        }
        return fields;
    }

    // -----------------------------------------------------------------------
    // Reads
    // -----------------------------------------------------------------------

    @Override
    public List<BoardItemDto> listItems() {
        String id = projectId();
        List<BoardItemDto> items = new ArrayList<>();
        String cursor = null;
        boolean hasNext = true;
        int pages = 0;
        while (hasNext) {
            Map<String, Object> variables = new HashMap<>();
            variables.put("projectId", id);
            variables.put("cursor", cursor);
            JsonNode page = transport.execute(ProjectQueries.ITEMS_PAGE, variables).path("node").path("items");
            for (JsonNode node : page.path("nodes")) {
                if (!BoardItemNodeMapper.isArchived(node)) {
                    items.add(BoardItemNodeMapper.toItem(node));
                }
            }
            JsonNode pageInfo = page.path("pageInfo");
            hasNext = pageInfo.path("hasNextPage").asBoolean(false);
            cursor = pageInfo.path("endCursor").asText(null);
            pages++;
        }
        log.debug("Listed {} item(s) in {} page(s)", items.size(), pages);
        return items;
    }

    @Override
    public Optional<BoardItemDto> getItem(String itemId) {
        JsonNode node = transport.execute(ProjectQueries.ITEM, Map.of("itemId", itemId)).path("node");
        if (!node.hasNonNull("id")) {
            return Optional.empty();
        }
        return Optional.of(BoardItemNodeMapper.toItem(node));
    }

    @Override
    public Optional<String> resolveUserId(String login) {
        Optional<String> cached = userIds.get(login);
        if (cached != null) {
            return cached;
        }
        Optional<String> resolved;
        try {
            JsonNode user = transport.execute(ProjectQueries.USER, Map.of("login", login)).path("user");
            resolved = user.hasNonNull("id") ? Optional.of(user.get("id").asText()) : Optional.empty();
        } catch (GitHubApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            resolved = Optional.empty();
        }
        userIds.put(login, resolved);
        return resolved;
    }

    @Override
    public List<String> resolveLabelIds(RepositoryRef repository, List<String> labelNames) {
        Map<String, String> known = repository(repository).labelIds();
        List<String> ids = new ArrayList<>();
        for (String name : labelNames) {
            String labelId = known.get(name);
            if (labelId != null) {
                ids.add(labelId);
            } else {
                log.debug("Label '{}' not found in {}", name, repository);
            }
        }
        return ids;
    }

    private RepositoryInfo repository(RepositoryRef ref) {
        RepositoryInfo info = repositories.get(ref);
        if (info == null) {
            JsonNode repo = transport.execute(ProjectQueries.REPOSITORY,
                    Map.of("owner", ref.owner(), "name", ref.name())).path("repository");
            if (!repo.hasNonNull("id")) {
                throw new GitHubApiException("Repository " + ref + " not found", 0, List.of("NOT_FOUND"));
            }
            Map<String, String> labelIds = new LinkedHashMap<>();
            for (JsonNode label : repo.path("labels").path("nodes")) {
                labelIds.put(label.path("name").asText(), label.path("id").asText());
            }
            info = new RepositoryInfo(repo.get("id").asText(), labelIds);
            repositories.put(ref, info);
        }
        return info;
    }

    // -----------------------------------------------------------------------
    // Item and content mutations
    // -----------------------------------------------------------------------

    @Override
    public String addDraftIssue(String title, String body) {
        JsonNode data = transport.execute(ProjectQueries.ADD_DRAFT_ISSUE,
                Map.of("projectId", projectId(), "title", title, "body", body));
        return requireId(data.path("addProjectV2DraftIssue").path("projectItem"), "addProjectV2DraftIssue");
    }

    @Override
    public String createIssue(RepositoryRef repository, String title, String body) {
        JsonNode data = transport.execute(ProjectQueries.CREATE_ISSUE,
                Map.of("repositoryId", repository(repository).id(), "title", title, "body", body));
        return requireId(data.path("createIssue").path("issue"), "createIssue");
    }

    @Override
    public String addItemToProject(String contentId) {
        JsonNode data = transport.execute(ProjectQueries.ADD_ITEM,
                Map.of("projectId", projectId(), "contentId", contentId));
        return requireId(data.path("addProjectV2ItemById").path("item"), "addProjectV2ItemById");
    }

    @Override
    public void updateDraftIssue(String draftIssueId, String title, String body) {
        transport.execute(ProjectQueries.UPDATE_DRAFT_ISSUE,
                Map.of("draftIssueId", draftIssueId, "title", title, "body", body));
    }

    @Override
    public void updateIssue(String issueId, String title, String body) {
        transport.execute(ProjectQueries.UPDATE_ISSUE, Map.of("issueId", issueId, "title", title, "body", body));
    }

    @Override
    public void setIssueAssignees(String issueId, List<String> userIds) {
        transport.execute(ProjectQueries.SET_ASSIGNEES, Map.of("issueId", issueId, "assigneeIds", userIds));
    }

    @Override
    public void setIssueLabels(String issueId, List<String> labelIds) {
        transport.execute(ProjectQueries.SET_LABELS, Map.of("issueId", issueId, "labelIds", labelIds));
    }

    @Override
    public void reopenIssue(String issueId) {
        transport.execute(ProjectQueries.REOPEN_ISSUE, Map.of("issueId", issueId));
    }

    @Override
    public void archiveItem(String itemId) {
        transport.execute(ProjectQueries.ARCHIVE_ITEM, Map.of("projectId", projectId(), "itemId", itemId));
    }

    @Override
    public void unarchiveItem(String itemId) {
        transport.execute(ProjectQueries.UNARCHIVE_ITEM, Map.of("projectId", projectId(), "itemId", itemId));
    }

    // -----------------------------------------------------------------------
    // Field values
    // -----------------------------------------------------------------------

    @Override
    public void updateFieldText(String itemId, String fieldId, String value) {
        transport.execute(ProjectQueries.UPDATE_TEXT, fieldVariables(itemId, fieldId, "value", value));
    }

    @Override
    public void updateFieldSingleSelect(String itemId, String fieldId, String optionId) {
        transport.execute(ProjectQueries.UPDATE_SINGLE_SELECT, fieldVariables(itemId, fieldId, "optionId", optionId));
    }

    @Override
    public void updateFieldDate(String itemId, String fieldId, LocalDate value) {
        transport.execute(ProjectQueries.UPDATE_DATE, fieldVariables(itemId, fieldId, "value", value.toString()));
    }

    private Map<String, Object> fieldVariables(String itemId, String fieldId, String valueName, String value) {
        return Map.of("projectId", projectId(), "itemId", itemId, "fieldId", fieldId, valueName, value);
    }

    private static String requireId(JsonNode node, String mutation) {
        if (!node.hasNonNull("id")) {
            throw new GitHubApiException(mutation + " returned no id", 0, List.of());
        }
        return node.get("id").asText();
    }
}
