package io.github.drompincen.tasksync.gateway.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tasksync.gateway.config.JacksonConfig;
import io.github.drompincen.tasksync.protocol.api.BoardFieldDto;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.ContentKind;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BoardItemNodeMapperTest {

    private final ObjectMapper mapper = JacksonConfig.createMapper();

    @Test
    void mapsIssueNode() throws Exception {
        JsonNode node = mapper.readTree("""
                {
                  "id": "PVTI_1",
                  "isArchived": false,
                  "fieldValues": {"nodes": [
                    {"name": "In Progress", "field": {"name": "Status"}},
                    {"date": "2026-03-01", "field": {"name": "Due"}},
                    {"date": "2026-04-15", "field": {"name": "End date"}},
                    {}
                  ]},
                  "content": {
                    "__typename": "Issue",
                    "id": "I_1",
                    "title": "Fix login",
                    "body": "Steps to reproduce",
                    "repository": {"name": "widgets", "owner": {"login": "acme"}},
                    "assignees": {"nodes": [{"login": "alice"}, {"login": "bob"}]},
                    "labels": {"nodes": [{"name": "bug"}, {"name": "urgent"}]}
                  }
                }
                """);

        BoardItemDto item = BoardItemNodeMapper.toItem(node);

        assertThat(item.itemId()).isEqualTo("PVTI_1");
        assertThat(item.contentId()).isEqualTo("I_1");
        assertThat(item.contentKind()).isEqualTo(ContentKind.ISSUE);
        assertThat(item.title()).isEqualTo("Fix login");
        assertThat(item.status()).isEqualTo("In Progress");
        assertThat(item.assignee()).isEqualTo("alice");
        assertThat(item.labels()).containsExactly("bug", "urgent");
        assertThat(item.dueDate()).isEqualTo(LocalDate.of(2026, 4, 15));
        assertThat(item.description()).isEqualTo("Steps to reproduce");
        assertThat(item.repository()).isEqualTo(new RepositoryRef("acme", "widgets"));
    }

    @Test
    void mapsDraftWithNullBodyAndDueField() throws Exception {
        JsonNode node = mapper.readTree("""
                {
                  "id": "PVTI_2",
                  "fieldValues": {"nodes": [{"date": "2026-01-31", "field": {"name": "Due"}}]},
                  "content": {"__typename": "DraftIssue", "id": "DI_2", "title": "Draft", "body": null}
                }
                """);

        BoardItemDto item = BoardItemNodeMapper.toItem(node);

        assertThat(item.isDraft()).isTrue();
        assertThat(item.description()).isEmpty();
        assertThat(item.status()).isEmpty();
        assertThat(item.dueDate()).isEqualTo(LocalDate.of(2026, 1, 31));
        assertThat(item.repository()).isNull();
    }

    @Test
    void redactedContentMapsToNone() throws Exception {
        JsonNode node = mapper.readTree("""
                {"id": "PVTI_3", "isArchived": true, "content": null}
                """);

        BoardItemDto item = BoardItemNodeMapper.toItem(node);

        assertThat(item.contentKind()).isEqualTo(ContentKind.NONE);
        assertThat(item.contentId()).isNull();
        assertThat(item.title()).isEmpty();
        assertThat(BoardItemNodeMapper.isArchived(node)).isTrue();
    }

    @Test
    void mapsFieldsWithOptionsAndSkipsUnnamed() throws Exception {
        JsonNode nodes = mapper.readTree("""
                [
                  {"id": "F_1", "name": "Status", "dataType": "SINGLE_SELECT",
                   "options": [{"id": "o1", "name": "Todo"}, {"id": "o2", "name": "Done"}]},
                  {"id": "F_2", "name": "End date", "dataType": "DATE"},
                  {}
                ]
                """);

        Map<String, BoardFieldDto> fields = BoardItemNodeMapper.toFields(nodes);

        assertThat(fields).containsOnlyKeys("Status", "End date");
        assertThat(fields.get("Status").options()).containsExactly(Map.entry("Todo", "o1"), Map.entry("Done", "o2"));
        assertThat(fields.get("End date").isDate()).isTrue();
    }
}
