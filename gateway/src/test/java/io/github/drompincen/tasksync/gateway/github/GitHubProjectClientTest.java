package io.github.drompincen.tasksync.gateway.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tasksync.gateway.config.JacksonConfig;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GitHubProjectClientTest {

    private final ObjectMapper mapper = JacksonConfig.createMapper();

    @Mock private GraphQlTransport transport;
    @Captor private ArgumentCaptor<Map<String, Object>> variables;

    private GitHubProjectClient client;

    @BeforeEach
    void setUp() throws Exception {
        client = new GitHubProjectClient(transport, "acme", 3);
        when(transport.execute(eq(ProjectQueries.PROJECT_ID), anyMap()))
                .thenReturn(json("{\"organization\":{\"projectV2\":{\"id\":\"PVT_1\"}}}"));
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    void projectIdIsResolvedOnceAndCached() throws Exception {
        when(transport.execute(eq(ProjectQueries.ARCHIVE_ITEM), anyMap())).thenReturn(json("{}"));

        client.archiveItem("PVTI_1");
        client.archiveItem("PVTI_2");

        verify(transport, times(1)).execute(eq(ProjectQueries.PROJECT_ID), anyMap());
        verify(transport, times(2)).execute(eq(ProjectQueries.ARCHIVE_ITEM), variables.capture());
        assertThat(variables.getAllValues().get(1)).containsEntry("projectId", "PVT_1").containsEntry("itemId", "PVTI_2");
    }

    @Test
    void missingProjectFailsWithNotFound() throws Exception {
        when(transport.execute(eq(ProjectQueries.PROJECT_ID), anyMap()))
                .thenReturn(json("{\"organization\":{\"projectV2\":null}}"));

        assertThatThrownBy(() -> client.listItems())
                .isInstanceOfSatisfying(GitHubApiException.class, e -> assertThat(e.isNotFound()).isTrue())
                .hasMessageContaining("#3");
    }

    @Test
    void listItemsFollowsCursorsAndSkipsArchived() throws Exception {
        JsonNode first = json("""
                {"node": {"items": {
                  "pageInfo": {"hasNextPage": true, "endCursor": "C1"},
                  "nodes": [
                    {"id": "PVTI_1", "content": {"__typename": "DraftIssue", "id": "DI_1", "title": "One"}},
                    {"id": "PVTI_X", "isArchived": true, "content": {"__typename": "DraftIssue", "id": "DI_X", "title": "Old"}}
                  ]}}}
                """);
        JsonNode second = json("""
                {"node": {"items": {
                  "pageInfo": {"hasNextPage": false, "endCursor": "C2"},
                  "nodes": [{"id": "PVTI_2", "content": {"__typename": "Issue", "id": "I_2", "title": "Two"}}]}}}
                """);
        when(transport.execute(eq(ProjectQueries.ITEMS_PAGE), anyMap())).thenReturn(first, second);

        List<BoardItemDto> items = client.listItems();

        assertThat(items).extracting(BoardItemDto::itemId).containsExactly("PVTI_1", "PVTI_2");
        verify(transport, times(2)).execute(eq(ProjectQueries.ITEMS_PAGE), variables.capture());
        assertThat(variables.getAllValues().get(0)).containsEntry("cursor", null);
        assertThat(variables.getAllValues().get(1)).containsEntry("cursor", "C1");
    }

    @Test
    void fieldsAreCached() throws Exception {
        when(transport.execute(eq(ProjectQueries.FIELDS), anyMap())).thenReturn(json("""
                {"node": {"fields": {"nodes": [
                  {"id": "F_S", "name": "Status", "dataType": "SINGLE_SELECT", "options": [{"id": "o1", "name": "Todo"}]}
                ]}}}
                """));

        assertThat(client.getFields()).containsOnlyKeys("Status");
        assertThat(client.getFields().get("Status").options()).containsEntry("Todo", "o1");
        verify(transport, times(1)).execute(eq(ProjectQueries.FIELDS), anyMap());
    }

    @Test
    void getItemReturnsEmptyForUnknownNode() throws Exception {
        when(transport.execute(eq(ProjectQueries.ITEM), anyMap())).thenReturn(json("{\"node\": null}"));

        assertThat(client.getItem("PVTI_missing")).isEmpty();
    }

    @Test
    void createIssueResolvesRepositoryIdOnce() throws Exception {
        when(transport.execute(eq(ProjectQueries.REPOSITORY), anyMap())).thenReturn(json("""
                {"repository": {"id": "R_1", "labels": {"nodes": [{"id": "L_bug", "name": "bug"}]}}}
                """));
        when(transport.execute(eq(ProjectQueries.CREATE_ISSUE), anyMap()))
                .thenReturn(json("{\"createIssue\": {\"issue\": {\"id\": \"I_9\"}}}"));
        RepositoryRef repo = RepositoryRef.parse("acme/widgets");

        String issueId = client.createIssue(repo, "Title", "Body");
        List<String> labelIds = client.resolveLabelIds(repo, List.of("bug", "missing"));

        assertThat(issueId).isEqualTo("I_9");
        assertThat(labelIds).containsExactly("L_bug");
        verify(transport, times(1)).execute(eq(ProjectQueries.REPOSITORY), anyMap());
        verify(transport).execute(eq(ProjectQueries.CREATE_ISSUE), variables.capture());
        assertThat(variables.getValue()).containsEntry("repositoryId", "R_1").containsEntry("title", "Title");
    }

    @Test
    void unknownUserResolvesToEmpty() throws Exception {
        when(transport.execute(eq(ProjectQueries.USER), anyMap()))
                .thenThrow(new GitHubApiException("GraphQL errors: Could not resolve", 200, List.of("NOT_FOUND")));

        assertThat(client.resolveUserId("ghost")).isEmpty();
        assertThat(client.resolveUserId("ghost")).isEmpty();
        verify(transport, times(1)).execute(eq(ProjectQueries.USER), anyMap());
    }

    @Test
    void otherUserLookupFailuresPropagate() {
        when(transport.execute(eq(ProjectQueries.USER), anyMap()))
                .thenThrow(new GitHubApiException("GitHub API returned HTTP 502", 502, List.of()));

        assertThatThrownBy(() -> client.resolveUserId("alice")).isInstanceOf(GitHubApiException.class);
    }

    @Test
    void knownUserResolvesToId() throws Exception {
        when(transport.execute(eq(ProjectQueries.USER), anyMap())).thenReturn(json("{\"user\": {\"id\": \"U_1\"}}"));

        assertThat(client.resolveUserId("alice")).isEqualTo(Optional.of("U_1"));
    }

    @Test
    void mutationWithoutIdFails() throws Exception {
        when(transport.execute(eq(ProjectQueries.ADD_DRAFT_ISSUE), anyMap()))
                .thenReturn(json("{\"addProjectV2DraftIssue\": null}"));

        assertThatThrownBy(() -> client.addDraftIssue("T", ""))
                .isInstanceOf(GitHubApiException.class)
                .hasMessageContaining("addProjectV2DraftIssue");
    }

    @Test
    void dateFieldIsSentAsIsoString() throws Exception {
        when(transport.execute(eq(ProjectQueries.UPDATE_DATE), anyMap())).thenReturn(json("{}"));

        client.updateFieldDate("PVTI_1", "F_END", LocalDate.of(2026, 7, 4));

        verify(transport).execute(eq(ProjectQueries.UPDATE_DATE), variables.capture());
        assertThat(variables.getValue()).containsEntry("value", "2026-07-04").containsEntry("fieldId", "F_END");
    }

    @Test
    void textFieldUsesTextValue() throws Exception {
        when(transport.execute(eq(ProjectQueries.UPDATE_TEXT), anyMap())).thenReturn(json("{}"));

        client.updateFieldText("PVTI_1", "F_NOTE", "hello");

        verify(transport).execute(eq(ProjectQueries.UPDATE_TEXT), variables.capture());
        assertThat(variables.getValue())
                .containsEntry("projectId", "PVT_1")
                .containsEntry("fieldId", "F_NOTE")
                .containsEntry("value", "hello");
    }
}
