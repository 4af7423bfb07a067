package io.github.drompincen.tasksync.protocol.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A custom field of a project board. {@code options} maps single-select option names to
 * option ids, in board order; it is empty for other field types.
 */
public record BoardFieldDto(
        String fieldId,
        String name,
        String dataType,
        Map<String, String> options
) {
    public static final String SINGLE_SELECT = "SINGLE_SELECT";
    public static final String DATE = "DATE";
    public static final String TEXT = "TEXT";

    public BoardFieldDto {
        options = options != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(options))
                : Map.of();
    }

    public boolean isDate() {
        return DATE.equalsIgnoreCase(dataType);
    }
}
