package io.github.drompincen.tasksync.gateway.github;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.tasksync.protocol.api.BoardFieldDto;
import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.ContentKind;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps Projects v2 response nodes onto board DTOs.
 */
final class BoardItemNodeMapper {

    private static final Logger log = LoggerFactory.getLogger(BoardItemNodeMapper.class);

    static final String STATUS_FIELD = "Status";
    static final String END_DATE_FIELD = "End date";
    static final String DUE_FIELD = "Due";

    private BoardItemNodeMapper() {}

    static BoardItemDto toItem(JsonNode node) {
        JsonNode content = node.path("content");
        ContentKind kind = ContentKind.fromTypename(content.path("__typename").asText(null));

        String status = null;
        LocalDate endDate = null;
        LocalDate due = null;
        for (JsonNode value : node.path("fieldValues").path("nodes")) {
            String fieldName = value.path("field").path("name").asText("");
            if (STATUS_FIELD.equals(fieldName) && value.hasNonNull("name")) {
                status = value.get("name").asText();
            } else if (END_DATE_FIELD.equals(fieldName) && value.hasNonNull("date")) {
                endDate = parseDate(value.get("date").asText());
            } else if (DUE_FIELD.equals(fieldName) && value.hasNonNull("date")) {
                due = parseDate(value.get("date").asText());
            }
        }

        String assignee = null;
        JsonNode assignees = content.path("assignees").path("nodes");
        if (assignees.isArray() && !assignees.isEmpty()) {
            assignee = assignees.get(0).path("login").asText(null);
        }

        List<String> labels = new ArrayList<>();
        for (JsonNode label : content.path("labels").path("nodes")) {
            String name = label.path("name").asText("");
            if (!name.isEmpty()) {
                labels.add(name);
            }
        }

        RepositoryRef repository = null;
        JsonNode repo = content.path("repository");
        if (repo.hasNonNull("name") && repo.path("owner").hasNonNull("login")) {
            repository = new RepositoryRef(repo.path("owner").get("login").asText(), repo.get("name").asText());
        }

        return new BoardItemDto(
                node.path("id").asText(),
                content.hasNonNull("id") ? content.get("id").asText() : null,
                kind,
                content.path("title").asText(""),
                status,
                assignee,
                labels,
                endDate != null ? endDate : due,
                content.path("body").asText(""),
                repository);
    }

    static boolean isArchived(JsonNode node) {
        return node.path("isArchived").asBoolean(false);
    }

    static Map<String, BoardFieldDto> toFields(JsonNode fieldNodes) {
        Map<String, BoardFieldDto> fields = new LinkedHashMap<>();
        for (JsonNode node : fieldNodes) {
            String name = node.path("name").asText("");
            if (name.isEmpty()) {
                continue;
            }
            Map<String, String> options = new LinkedHashMap<>();
            for (JsonNode option : node.path("options")) {
                options.put(option.path("name").asText(), option.path("id").asText());
            }
            fields.put(name, new BoardFieldDto(node.path("id").asText(), name, node.path("dataType").asText(""), options));
        }
        return fields;
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable date value '{}'", raw);
            return null;
        }
    }
}
