package io.notelite.storage.history;

import io.notelite.core.ChangeType;

import java.time.Instant;

/**
 * Lightweight view of one history entry for undo/redo affordances.
 *
 * @param replayable false for entries rehydrated from a metadata-only log
 * @param current    true for the entry the cursor points at
 */
public record VersionSummary(
        String versionId,
        long sequence,
        Instant timestamp,
        String description,
        ChangeType changeType,
        boolean snapshot,
        boolean replayable,
        boolean current
) {}
