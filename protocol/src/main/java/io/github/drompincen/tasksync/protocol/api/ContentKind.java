package io.github.drompincen.tasksync.protocol.api;

/**
 * What a board item wraps. The kind decides which mutations are legal for the item:
 * only {@link #ISSUE} content supports assignees and labels.
 */
public enum ContentKind {
    DRAFT_ISSUE,
    ISSUE,
    PULL_REQUEST,
    /** Content redacted or missing (no access to the backing repository). */
    NONE;

    /**
     * Maps a GraphQL {@code __typename} onto a kind. Unknown or absent names map to {@link #NONE}.
     */
    public static ContentKind fromTypename(String typename) {
        if (typename == null) {
            return NONE;
        }
        return switch (typename) {
            case "DraftIssue" -> DRAFT_ISSUE;
            case "Issue" -> ISSUE;
            case "PullRequest" -> PULL_REQUEST;
            default -> NONE;
        };
    }

    public boolean supportsAssigneesAndLabels() {
        return switch (this) {
            case ISSUE -> true;
            case DRAFT_ISSUE, PULL_REQUEST, NONE -> false;
        };
    }
}
