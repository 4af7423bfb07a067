package io.github.drompincen.tasksync.runtime.sync;

import io.github.drompincen.tasksync.protocol.api.BoardItemDto;
import io.github.drompincen.tasksync.protocol.api.RepositoryRef;

/**
 * Which board items a run owns. The repository, when present, also makes the run create full
 * issues instead of drafts and convert matched drafts into issues.
 *
 * @param repository owning repository, or null
 * @param label      label marking the run's items, or null; ignored when a repository is set
 */
public record SyncScope(RepositoryRef repository, String label) {

    public SyncScope {
        if (label != null && label.isBlank()) {
            label = null;
        }
    }

    public static SyncScope unscoped() {
        return new SyncScope(null, null);
    }

    public static SyncScope ofRepository(RepositoryRef repository) {
        return new SyncScope(repository, null);
    }

    public static SyncScope ofLabel(String label) {
        return new SyncScope(null, label);
    }

    public boolean hasRepository() {
        return repository != null;
    }

    public boolean isUnscoped() {
        return repository == null && label == null;
    }

    /** Whether an unmatched item may be archived by this run. */
    public boolean owns(BoardItemDto item) {
        if (repository != null) {
            return item.isIssue() && repository.equals(item.repository());
        }
        if (label != null) {
            return item.labels().contains(label);
        }
        return true;
    }

    @Override
    public String toString() {
        if (repository != null) {
            return "repository " + repository;
        }
        return label != null ? "label '" + label + "'" : "whole board";
    }
}
