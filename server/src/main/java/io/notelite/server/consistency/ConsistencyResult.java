package io.notelite.server.consistency;

import io.notelite.core.ConsistencyException;
import io.notelite.core.DataVersion;
import io.notelite.core.conflict.ConflictResolution;
import io.notelite.core.conflict.DataConflict;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a submitted change or batch.
 *
 * @param version        version recorded for the change, null unless APPLIED
 * @param conflicts      conflicts detected, empty when there were none
 * @param resolution     how they were resolved, null when there were no conflicts
 * @param processingTime time spent on the owner thread
 * @param error          failure or manual-resolution details, null when APPLIED
 * @param errorCategory  null when APPLIED
 */
public record ConsistencyResult(
        ConsistencyStatus status,
        DataVersion version,
        List<DataConflict> conflicts,
        ConflictResolution resolution,
        Duration processingTime,
        String error,
        ConsistencyException.Category errorCategory
) {
    public ConsistencyResult {
        Objects.requireNonNull(status, "status");
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        processingTime = processingTime == null ? Duration.ZERO : processingTime;
    }

    public boolean applied() {
        return status == ConsistencyStatus.APPLIED;
    }
}
