package io.notelite.core.conflict;

import io.notelite.core.ChangeRecord;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A detected collision between changes.
 * <p>
 * Pairwise conflicts (simultaneous edit, user vs derived, version mismatch) always
 * hold at least two changes. An integrity violation detected against persisted
 * state may hold only the offending change.
 */
public record DataConflict(
        UUID conflictId,
        List<ChangeRecord> changes,
        ConflictType type,
        ConflictSeverity severity,
        boolean autoResolvable,
        Set<UUID> affectedIds,
        String reason
) {
    public DataConflict {
        Objects.requireNonNull(conflictId, "conflictId");
        Objects.requireNonNull(changes, "changes");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        if (changes.isEmpty()) {
            throw new IllegalArgumentException("conflict must reference at least one change");
        }
        if (type != ConflictType.INTEGRITY_VIOLATION && changes.size() < 2) {
            throw new IllegalArgumentException(type + " conflict needs at least two changes");
        }
        changes = List.copyOf(changes);
        affectedIds = affectedIds == null ? Set.of() : Set.copyOf(affectedIds);
        reason = reason == null ? "" : reason;
    }

    public static DataConflict of(
            List<ChangeRecord> changes,
            ConflictType type,
            ConflictSeverity severity,
            boolean autoResolvable,
            Set<UUID> extraIds,
            String reason
    ) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (ChangeRecord c : changes) {
            ids.addAll(c.affectedIds());
        }
        if (extraIds != null) {
            ids.addAll(extraIds);
        }
        return new DataConflict(UUID.randomUUID(), changes, type, severity, autoResolvable, ids, reason);
    }

    /** Multi-line report for a manual resolution surface. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append(" (").append(severity).append(")");
        if (!reason.isEmpty()) {
            sb.append(": ").append(reason);
        }
        for (ChangeRecord c : changes) {
            sb.append("\n  - ")
                    .append(c.description())
                    .append(" [").append(c.origin()).append(" at ").append(c.timestamp()).append("]")
                    .append(" entities=").append(c.affectedIds());
        }
        return sb.toString();
    }
}
