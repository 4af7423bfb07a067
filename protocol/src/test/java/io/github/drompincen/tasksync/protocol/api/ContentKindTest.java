package io.github.drompincen.tasksync.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentKindTest {

    @Test
    void mapsGraphQlTypenames() {
        assertThat(ContentKind.fromTypename("DraftIssue")).isEqualTo(ContentKind.DRAFT_ISSUE);
        assertThat(ContentKind.fromTypename("Issue")).isEqualTo(ContentKind.ISSUE);
        assertThat(ContentKind.fromTypename("PullRequest")).isEqualTo(ContentKind.PULL_REQUEST);
        assertThat(ContentKind.fromTypename("Discussion")).isEqualTo(ContentKind.NONE);
        assertThat(ContentKind.fromTypename(null)).isEqualTo(ContentKind.NONE);
    }

    @Test
    void onlyIssuesSupportAssigneesAndLabels() {
        assertThat(ContentKind.ISSUE.supportsAssigneesAndLabels()).isTrue();
        assertThat(ContentKind.DRAFT_ISSUE.supportsAssigneesAndLabels()).isFalse();
        assertThat(ContentKind.PULL_REQUEST.supportsAssigneesAndLabels()).isFalse();
        assertThat(ContentKind.NONE.supportsAssigneesAndLabels()).isFalse();
    }

    @Test
    void boardItemDefaultsNullFields() {
        BoardItemDto item = new BoardItemDto("PVTI_1", null, null, null, null, null, null, null, null, null);

        assertThat(item.contentKind()).isEqualTo(ContentKind.NONE);
        assertThat(item.title()).isEmpty();
        assertThat(item.description()).isEmpty();
        assertThat(item.labels()).isEmpty();
    }
}
