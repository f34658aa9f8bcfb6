package io.notelite.storage.history;

import io.notelite.core.ConsistencyException;
import io.notelite.core.DataVersion;

import java.util.Set;
import java.util.UUID;

/**
 * Outcome of undo, redo or jump.
 *
 * @param version     version the cursor points at afterwards (unchanged on failure)
 * @param affectedIds entities touched by the navigation
 */
public record NavigationResult(
        boolean success,
        DataVersion version,
        Set<UUID> affectedIds,
        String error,
        ConsistencyException.Category errorCategory
) {
    public NavigationResult {
        affectedIds = affectedIds == null ? Set.of() : Set.copyOf(affectedIds);
    }

    static NavigationResult ok(DataVersion version, Set<UUID> affected) {
        return new NavigationResult(true, version, affected, null, null);
    }

    static NavigationResult failed(DataVersion current, String error, ConsistencyException.Category category) {
        return new NavigationResult(false, current, Set.of(), error, category);
    }
}
