package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.ContentKind;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyncScopeTest {

    private static final RepositoryRef REPO = RepositoryRef.parse("acme/widgets");

    private static BoardItemDto labelledIssue(RepositoryRef repo, String... labels) {
        return new BoardItemDto("PVTI_1", "I_1", ContentKind.ISSUE, "T", "Todo",
                null, List.of(labels), null, "", repo);
    }

    @Test
    void repositoryScopeOwnsOnlyItsIssues() {
        SyncScope scope = SyncScope.ofRepository(REPO);

        assertThat(scope.owns(labelledIssue(REPO))).isTrue();
        assertThat(scope.owns(labelledIssue(RepositoryRef.parse("acme/other")))).isFalse();
        assertThat(scope.owns(BoardItemDto.draft("PVTI_2", "DI_2", "T", "Todo", ""))).isFalse();
    }

    @Test
    void repositoryTakesPrecedenceOverLabel() {
        SyncScope scope = new SyncScope(REPO, "tasks-md");

        assertThat(scope.owns(labelledIssue(RepositoryRef.parse("acme/other"), "tasks-md"))).isFalse();
    }

    @Test
    void blankLabelMeansUnscoped() {
        SyncScope scope = new SyncScope(null, "  ");

        assertThat(scope.label()).isNull();
        assertThat(scope.isUnscoped()).isTrue();
        assertThat(scope.owns(BoardItemDto.draft("PVTI_2", "DI_2", "T", "Todo", ""))).isTrue();
        assertThat(scope.toString()).isEqualTo("whole board");
    }

    @Test
    void labelScopeMatchesExactLabel() {
        SyncScope scope = SyncScope.ofLabel("tasks-md");

        assertThat(scope.owns(labelledIssue(REPO, "tasks-md", "bug"))).isTrue();
        assertThat(scope.owns(labelledIssue(REPO, "Tasks-MD"))).isFalse();
        assertThat(scope.hasRepository()).isFalse();
    }
}
