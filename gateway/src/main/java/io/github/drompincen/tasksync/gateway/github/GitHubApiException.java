package io.github.drompincen.tasksync.gateway.github;

import io.github.drompincen.tasksync.runtime.board.BoardClientException;

import java.util.List;

/**
 * A GraphQL call failed, either at the HTTP level ({@link #getStatusCode()} is set) or with
 * an {@code errors} array in the response ({@link #getErrorTypes()} lists their types).
 */
public class GitHubApiException extends BoardClientException {

    private final int statusCode;
    private final List<String> errorTypes;

    public GitHubApiException(String message, int statusCode, List<String> errorTypes) {
        super(message);
        this.statusCode = statusCode;
        this.errorTypes = errorTypes != null ? List.copyOf(errorTypes) : List.of();
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorTypes = List.of();
    }

    /** HTTP status of the failed response, or 0 when the failure was not an HTTP error. */
    public int getStatusCode() { return statusCode; }

    public List<String> getErrorTypes() { return errorTypes; }

    public boolean isNotFound() {
        return statusCode == 404 || errorTypes.contains("NOT_FOUND");
    }
}
