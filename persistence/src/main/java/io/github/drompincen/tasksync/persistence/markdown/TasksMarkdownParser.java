package io.github.drompincen.tasksync.persistence.markdown;

import io.github.drompincen.tasksync.persistence.document.TaskDocument;
import io.github.drompincen.tasksync.persistence.document.TasksFileDocument;
import io.github.drompincen.tasksync.protocol.api.StatusNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Reads a tasks file:
 * <pre>
 * ## In Progress
 *
 * ### Fix memory leak
 * &lt;!-- id: PVTI_def456 --&gt;
 * - **Assignee:** @bob
 * - **Labels:** bug, urgent
 * - **Due:** 2025-06-01
 *
 * Free-form description.
 * </pre>
 * {@code ##} headings set the status of the tasks below them, {@code ###} headings open a task.
 * Metadata lines are only recognised directly under the task heading; the first other
 * non-blank line starts the description.
 */
@Component
public class TasksMarkdownParser {

    private static final Logger log = LoggerFactory.getLogger(TasksMarkdownParser.class);

    public TasksFileDocument load(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return parse(content, path.toString());
    }

    public TasksFileDocument parse(String content, String sourcePath) {
        List<TaskDocument> tasks = new ArrayList<>();
        String currentStatus = null;
        TaskBuilder current = null;

        for (String line : content.split("\\R", -1)) {
            Matcher status = TasksMarkdownSyntax.STATUS_HEADING.matcher(line);
            if (status.matches()) {
                if (current != null) {
                    tasks.add(current.build());
                    current = null;
                }
                currentStatus = StatusNames.normalize(status.group(1));
                continue;
            }

            Matcher heading = TasksMarkdownSyntax.TASK_HEADING.matcher(line);
            if (heading.matches()) {
                if (current != null) {
                    tasks.add(current.build());
                }
                if (currentStatus == null) {
                    currentStatus = StatusNames.TODO;
                }
                current = new TaskBuilder(heading.group(1).strip(), currentStatus);
                continue;
            }

            if (current != null) {
                current.feed(line);
            }
        }
        if (current != null) {
            tasks.add(current.build());
        }

        log.debug("Parsed {} tasks from {}", tasks.size(), sourcePath);
        return new TasksFileDocument(tasks, sourcePath);
    }

    private static final class TaskBuilder {

        private final TaskDocument task;
        private final List<String> descriptionLines = new ArrayList<>();
        private boolean inMetadata = true;

        TaskBuilder(String title, String status) {
            this.task = new TaskDocument(title, status);
        }

        void feed(String line) {
            if (!inMetadata) {
                descriptionLines.add(line);
                return;
            }
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                return;
            }

            Matcher m = TasksMarkdownSyntax.ID_MARKER.matcher(stripped);
            if (m.matches()) {
                task.setBoardItemId(m.group(1));
                return;
            }
            m = TasksMarkdownSyntax.ASSIGNEE.matcher(stripped);
            if (m.matches()) {
                task.setAssignee(m.group(1));
                return;
            }
            m = TasksMarkdownSyntax.LABELS.matcher(stripped);
            if (m.matches()) {
                task.setLabels(Arrays.stream(m.group(1).split(","))
                        .map(String::strip)
                        .filter(s -> !s.isEmpty())
                        .toList());
                return;
            }
            m = TasksMarkdownSyntax.DUE.matcher(stripped);
            if (m.matches()) {
                try {
                    task.setDueDate(LocalDate.parse(m.group(1)));
                } catch (DateTimeParseException e) {
                    log.warn("Ignoring unparseable due date '{}' on task '{}'", m.group(1), task.getTitle());
                }
                return;
            }

            inMetadata = false;
            descriptionLines.add(line);
        }

        TaskDocument build() {
            task.setDescription(String.join("\n", descriptionLines).strip());
            return task;
        }
    }
}
