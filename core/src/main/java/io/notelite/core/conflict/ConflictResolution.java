package io.notelite.core.conflict;

import io.notelite.core.ChangeRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of resolving a batch of conflicts.
 * <p>
 * Every change that took part in a conflict ends up in exactly one of
 * acceptedChanges or rejectedChanges. acceptedChanges may also hold changes
 * synthesized by a strategy (merged edits, cascaded link removals).
 * When success is false the whole batch was rejected and manualDetails
 * explains what a person has to decide.
 */
public record ConflictResolution(
        UUID resolutionId,
        List<DataConflict> conflicts,
        List<ChangeRecord> acceptedChanges,
        List<ChangeRecord> rejectedChanges,
        List<ResolutionStrategy> strategiesUsed,
        boolean success,
        List<String> manualDetails,
        Instant resolvedAt
) {
    public ConflictResolution {
        Objects.requireNonNull(resolutionId, "resolutionId");
        Objects.requireNonNull(resolvedAt, "resolvedAt");
        conflicts = List.copyOf(conflicts);
        acceptedChanges = List.copyOf(acceptedChanges);
        rejectedChanges = List.copyOf(rejectedChanges);
        strategiesUsed = List.copyOf(strategiesUsed);
        manualDetails = manualDetails == null ? List.of() : List.copyOf(manualDetails);
    }

    public boolean requiresManualIntervention() {
        return !success;
    }

    public boolean accepted(ChangeRecord change) {
        return acceptedChanges.stream().anyMatch(c -> c.id().equals(change.id()));
    }

    public boolean rejected(ChangeRecord change) {
        return rejectedChanges.stream().anyMatch(c -> c.id().equals(change.id()));
    }
}
