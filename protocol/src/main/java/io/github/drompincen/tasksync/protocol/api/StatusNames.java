package io.github.drompincen.tasksync.protocol.api;

import java.util.Locale;
import java.util.Map;

/**
 * Canonical task status names. Section headings in a tasks file are free-form; the common
 * spellings are folded onto these three names and anything else is kept as written.
 */
public final class StatusNames {

    public static final String TODO = "Todo";
    public static final String IN_PROGRESS = "In Progress";
    public static final String DONE = "Done";

    private static final Map<String, String> ALIASES = Map.of(
            "todo", TODO,
            "to do", TODO,
            "to-do", TODO,
            "in progress", IN_PROGRESS,
            "in-progress", IN_PROGRESS,
            "inprogress", IN_PROGRESS,
            "done", DONE,
            "completed", DONE,
            "closed", DONE
    );

    private StatusNames() {}

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        return ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
}
