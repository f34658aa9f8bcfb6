package io.notelite.server.consistency;

import io.notelite.core.ChangeType;
import io.notelite.core.DataVersion;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * What collaborators are told after the store changed.
 *
 * @param versionId   version the store is at now
 * @param changeType  SYSTEM for repairs, restores and history navigation
 * @param affectedIds entities whose cached views are stale
 */
public record ChangeEvent(String versionId, ChangeType changeType, Set<UUID> affectedIds, Instant at) {
    public ChangeEvent {
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(at, "at");
        affectedIds = affectedIds == null ? Set.of() : Set.copyOf(affectedIds);
    }

    static ChangeEvent of(DataVersion version) {
        return new ChangeEvent(version.versionId(), version.changeType(), version.affectedIds(), version.timestamp());
    }
}
