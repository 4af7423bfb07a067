package io.github.drompincen.tasksync.persistence.markdown;

import io.github.drompincen.tasksync.persistence.document.TaskDocument;
import io.github.drompincen.tasksync.persistence.document.TasksFileDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TasksMarkdownParserTest {

    static final String SAMPLE = """
            # Tasks

            ## Todo

            ### Implement user authentication
            <!-- id: PVTI_abc123 -->
            - **Assignee:** @alice
            - **Labels:** feature, security

            We need to add OAuth2 support for the login flow.
            This should support both GitHub and Google providers.

            ### Write API documentation
            - **Labels:** docs
            - **Due:** 2025-06-01

            Document all public API endpoints.

            ## In Progress

            ### Fix memory leak in worker pool
            <!-- id: PVTI_def456 -->
            - **Assignee:** @bob
            - **Labels:** bug, urgent

            The worker pool is not releasing connections properly.

            ```python
            pool.release(conn)
            ```

            ## Completed

            ### Set up CI pipeline
            <!-- id: PVTI_ghi789 -->
            - **Assignee:** @charlie

            Configured GitHub Actions for tests and linting.
            """;

    private final TasksMarkdownParser parser = new TasksMarkdownParser();

    @Test
    void parsesTitlesInFileOrder() {
        TasksFileDocument file = parser.parse(SAMPLE, "TASKS.md");

        assertThat(file.getTasks()).extracting(TaskDocument::getTitle).containsExactly(
                "Implement user authentication",
                "Write API documentation",
                "Fix memory leak in worker pool",
                "Set up CI pipeline");
    }

    @Test
    void normalisesSectionStatuses() {
        TasksFileDocument file = parser.parse(SAMPLE, "TASKS.md");

        assertThat(file.getTasks()).extracting(TaskDocument::getStatus)
                .containsExactly("Todo", "Todo", "In Progress", "Done");
    }

    @Test
    void readsMetadataBlock() {
        List<TaskDocument> tasks = parser.parse(SAMPLE, "TASKS.md").getTasks();

        assertThat(tasks).extracting(TaskDocument::getBoardItemId)
                .containsExactly("PVTI_abc123", null, "PVTI_def456", "PVTI_ghi789");
        assertThat(tasks).extracting(TaskDocument::getAssignee)
                .containsExactly("alice", null, "bob", "charlie");
        assertThat(tasks.get(0).getLabels()).containsExactly("feature", "security");
        assertThat(tasks.get(1).getLabels()).containsExactly("docs");
        assertThat(tasks.get(1).getDueDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(tasks.get(3).getLabels()).isEmpty();
    }

    @Test
    void keepsDescriptionsTrimmedWithCodeBlocks() {
        List<TaskDocument> tasks = parser.parse(SAMPLE, "TASKS.md").getTasks();

        assertThat(tasks.get(0).getDescription())
                .startsWith("We need to add OAuth2 support")
                .endsWith("GitHub and Google providers.");
        assertThat(tasks.get(2).getDescription()).contains("pool.release(conn)").endsWith("```");
        assertThat(tasks.get(3).getDescription()).isEqualTo("Configured GitHub Actions for tests and linting.");
    }

    @Test
    void metadataAfterDescriptionIsDescription() {
        String content = """
                ### Task
                Some text first.
                - **Assignee:** @alice
                """;

        TaskDocument task = parser.parse(content, "").getTasks().get(0);

        assertThat(task.getAssignee()).isNull();
        assertThat(task.getDescription()).contains("**Assignee:**");
    }

    @Test
    void taskBeforeAnySectionDefaultsToTodo() {
        TaskDocument task = parser.parse("### Orphan\n", "").getTasks().get(0);

        assertThat(task.getStatus()).isEqualTo("Todo");
        assertThat(task.getDescription()).isEmpty();
    }

    @Test
    void unparseableDueDateIsIgnored() {
        TaskDocument task = parser.parse("### T\n- **Due:** 2025-13-45\n", "").getTasks().get(0);

        assertThat(task.getDueDate()).isNull();
    }

    @Test
    void groupsByStatusAndBoardId() {
        TasksFileDocument file = parser.parse(SAMPLE, "TASKS.md");

        Map<String, List<TaskDocument>> groups = file.byStatus();
        assertThat(groups.get("Todo")).hasSize(2);
        assertThat(groups.get("In Progress")).hasSize(1);
        assertThat(groups.get("Done")).hasSize(1);
        assertThat(file.byBoardItemId()).containsOnlyKeys("PVTI_abc123", "PVTI_def456", "PVTI_ghi789");
        assertThat(file.unlinkedTasks()).extracting(TaskDocument::getTitle).containsExactly("Write API documentation");
    }

    @Test
    void loadsCrlfFileFromDisk(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("TASKS.md");
        Files.writeString(file, "## Todo\r\n\r\n### Windows task\r\n<!-- id: PVTI_1 -->\r\n\r\nBody\r\n",
                StandardCharsets.UTF_8);

        TasksFileDocument doc = parser.load(file);

        assertThat(doc.getSourcePath()).isEqualTo(file.toString());
        assertThat(doc.getTasks()).hasSize(1);
        assertThat(doc.getTasks().get(0).getBoardItemId()).isEqualTo("PVTI_1");
        assertThat(doc.getTasks().get(0).getDescription()).isEqualTo("Body");
    }
}
