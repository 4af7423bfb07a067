package io.github.drompincen.tasksync.runtime.board;

/**
 * A board call failed: transport, authentication or an API-level error.
 */
public class BoardClientException extends RuntimeException {

    public BoardClientException(String message) {
        super(message);
    }

    public BoardClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
