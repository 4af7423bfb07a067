package io.github.drompincen.tasksync.persistence.markdown;

import io.github.drompincen.tasksync.protocol.api.StatusNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Edits a tasks file in place. Only the lines being changed are touched; everything else,
 * line endings included, is written back as read.
 */
@Component
public class TasksMarkdownWriter {

    private static final Logger log = LoggerFactory.getLogger(TasksMarkdownWriter.class);

    // -----------------------------------------------------------------------
    // Identifier writeback
    // -----------------------------------------------------------------------

    /**
     * Injects or repairs the {@code <!-- id: ... -->} marker of every task whose title is in
     * {@code idsByTitle}. A marker already present in the task's metadata block is replaced in
     * place; otherwise a new marker is inserted right below the heading.
     *
     * @return true if the file was modified
     */
    public boolean writeBackIds(Path path, Map<String, String> idsByTitle) throws IOException {
        if (idsByTitle == null || idsByTitle.isEmpty()) {
            return false;
        }
        FileLines file = FileLines.read(path);
        List<String> lines = file.lines;
        List<String> out = new ArrayList<>(lines.size() + idsByTitle.size());
        boolean modified = false;

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            out.add(line);
            i++;

            Matcher heading = TasksMarkdownSyntax.TASK_HEADING.matcher(line);
            if (!heading.matches()) {
                continue;
            }
            String title = heading.group(1).strip();
            String newId = idsByTitle.get(title);
            if (newId == null) {
                continue;
            }

            int markerIndex = findIdMarker(lines, i);
            if (markerIndex < 0) {
                out.add(TasksMarkdownSyntax.idMarker(newId));
                modified = true;
                log.debug("[Writeback] '{}' injected id {}", title, newId);
                continue;
            }
            Matcher marker = TasksMarkdownSyntax.ID_MARKER.matcher(lines.get(markerIndex).strip());
            String existing = marker.matches() ? marker.group(1) : null;
            if (newId.equals(existing)) {
                log.debug("[Writeback] '{}' already has id {}", title, newId);
                continue;
            }
            lines.set(markerIndex, TasksMarkdownSyntax.idMarker(newId));
            modified = true;
            log.debug("[Writeback] '{}' replaced stale id {} -> {}", title, existing, newId);
        }

        if (modified) {
            file.write(path, out);
        }
        return modified;
    }

    /** Index of the id marker within the metadata block starting at {@code from}, or -1. */
    private int findIdMarker(List<String> lines, int from) {
        for (int j = from; j < lines.size(); j++) {
            String stripped = lines.get(j).strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (TasksMarkdownSyntax.ID_MARKER.matcher(stripped).matches()) {
                return j;
            }
            if (!TasksMarkdownSyntax.isMetadata(stripped)) {
                return -1;
            }
        }
        return -1;
    }

    // -----------------------------------------------------------------------
    // Done-task pruning
    // -----------------------------------------------------------------------

    /**
     * Removes every task block under a section whose status normalises to Done. The section
     * heading itself is kept.
     *
     * @return true if the file was modified
     */
    public boolean removeDoneTasks(Path path) throws IOException {
        FileLines file = FileLines.read(path);
        List<String> lines = file.lines;
        List<String> kept = new ArrayList<>(lines.size());
        boolean modified = false;
        String currentStatus = null;

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            Matcher status = TasksMarkdownSyntax.STATUS_HEADING.matcher(line);
            if (status.matches()) {
                currentStatus = StatusNames.normalize(status.group(1));
                kept.add(line);
                i++;
                continue;
            }
            if (TasksMarkdownSyntax.TASK_HEADING.matcher(line).matches() && StatusNames.DONE.equals(currentStatus)) {
                log.debug("[Prune] removing done task '{}'", line.substring(3).strip());
                modified = true;
                i++;
                while (i < lines.size() && !TasksMarkdownSyntax.isHeading(lines.get(i))) {
                    i++;
                }
                continue;
            }
            kept.add(line);
            i++;
        }

        if (!modified) {
            return false;
        }
        List<String> collapsed = new ArrayList<>(kept.size());
        boolean lastBlank = false;
        for (String line : kept) {
            boolean blank = line.isBlank();
            if (blank && lastBlank) {
                continue;
            }
            collapsed.add(line);
            lastBlank = blank;
        }
        file.write(path, collapsed);
        return true;
    }

    private static final class FileLines {

        final List<String> lines;
        final String eol;
        final boolean trailingNewline;

        private FileLines(List<String> lines, String eol, boolean trailingNewline) {
            this.lines = lines;
            this.eol = eol;
            this.trailingNewline = trailingNewline;
        }

        static FileLines read(Path path) throws IOException {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            String eol = content.contains("\r\n") ? "\r\n" : "\n";
            boolean trailing = content.endsWith("\n");
            List<String> lines = new ArrayList<>(Arrays.asList(content.split("\\R", -1)));
            if (trailing) {
                lines.remove(lines.size() - 1);
            }
            return new FileLines(lines, eol, trailing);
        }

        void write(Path path, List<String> newLines) throws IOException {
            String content = String.join(eol, newLines);
            if (trailingNewline) {
                content += eol;
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        }
    }
}
