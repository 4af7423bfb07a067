package io.github.drompincen.tasksync.protocol.api;

import java.util.Objects;

public record RepositoryRef(String owner, String name) {

    public RepositoryRef {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(name, "name");
        if (owner.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("Repository owner and name must not be blank");
        }
    }

    /**
     * Parses {@code owner/name}. Surrounding whitespace is ignored.
     */
    public static RepositoryRef parse(String slug) {
        if (slug == null) {
            throw new IllegalArgumentException("Repository must be given as owner/name");
        }
        String trimmed = slug.trim();
        int slash = trimmed.indexOf('/');
        if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
            throw new IllegalArgumentException("Repository must be given as owner/name, got: " + slug);
        }
        return new RepositoryRef(trimmed.substring(0, slash), trimmed.substring(slash + 1));
    }

    @Override
    public String toString() {
        return owner + "/" + name;
    }
}
