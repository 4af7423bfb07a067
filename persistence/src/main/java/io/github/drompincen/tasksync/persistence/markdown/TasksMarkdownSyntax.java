package io.github.drompincen.tasksync.persistence.markdown;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Line patterns of the tasks file format, shared by the parser and the writer.
 */
final class TasksMarkdownSyntax {

    static final Pattern STATUS_HEADING = Pattern.compile("^##\\s+(.+)$");
    static final Pattern TASK_HEADING = Pattern.compile("^###\\s+(.+)$");
    static final Pattern ID_MARKER = Pattern.compile("^<!--\\s*id:\\s*(\\S+)\\s*-->$");
    static final Pattern ASSIGNEE = Pattern.compile("^-\\s+\\*\\*Assignee:\\*\\*\\s*@?(\\S+)\\s*$");
    static final Pattern LABELS = Pattern.compile("^-\\s+\\*\\*Labels:\\*\\*\\s*(.+)$");
    static final Pattern DUE = Pattern.compile("^-\\s+\\*\\*Due:\\*\\*\\s*(\\S+)\\s*$");

    private static final List<Pattern> METADATA = List.of(ID_MARKER, ASSIGNEE, LABELS, DUE);

    private TasksMarkdownSyntax() {}

    static boolean isMetadata(String strippedLine) {
        for (Pattern p : METADATA) {
            if (p.matcher(strippedLine).matches()) {
                return true;
            }
        }
        return false;
    }

    static boolean isHeading(String line) {
        return STATUS_HEADING.matcher(line).matches() || TASK_HEADING.matcher(line).matches();
    }

    static String idMarker(String id) {
        return "<!-- id: " + id + " -->";
    }
}
