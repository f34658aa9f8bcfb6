package io.notelite.core;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable description of one semantic edit submitted to the consistency core.
 *
 * @param id             unique change id
 * @param kind           what the edit does
 * @param timestamp      when the producer made the edit
 * @param origin         user, derived (background analyzer) or system
 * @param confidence     producer confidence in [0, 1]; ranks edits in version-mismatch conflicts
 * @param baseVersionId  version the producer observed when making the edit, or null if unknown
 * @param description    short human-readable summary for history and conflict reports
 */
public record ChangeRecord(
        UUID id,
        ChangeKind kind,
        Instant timestamp,
        ChangeOrigin origin,
        double confidence,
        String baseVersionId,
        String description
) {
    public ChangeRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(origin, "origin");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]");
        }
        description = description == null || description.isBlank()
                ? defaultDescription(kind)
                : description;
    }

    public static ChangeRecord user(ChangeKind kind, Instant at) {
        return of(kind, at, ChangeOrigin.USER);
    }

    public static ChangeRecord derived(ChangeKind kind, Instant at) {
        return of(kind, at, ChangeOrigin.DERIVED);
    }

    public static ChangeRecord system(ChangeKind kind, Instant at) {
        return of(kind, at, ChangeOrigin.SYSTEM);
    }

    public static ChangeRecord of(ChangeKind kind, Instant at, ChangeOrigin origin) {
        return new ChangeRecord(UUID.randomUUID(), kind, at, origin, origin.defaultConfidence(), null, null);
    }

    /** Same edit, observed on top of the given version. */
    public ChangeRecord basedOn(String versionId) {
        return new ChangeRecord(id, kind, timestamp, origin, confidence, versionId, description);
    }

    public ChangeRecord withConfidence(double value) {
        return new ChangeRecord(id, kind, timestamp, origin, value, baseVersionId, description);
    }

    public ChangeRecord withDescription(String text) {
        return new ChangeRecord(id, kind, timestamp, origin, confidence, baseVersionId, text);
    }

    public Set<UUID> affectedIds() {
        return Collections.unmodifiableSet(kind.affectedIds());
    }

    public ChangeType type() {
        return kind.type();
    }

    public boolean userInitiated() {
        return origin == ChangeOrigin.USER;
    }

    /** True if both changes affect at least one common entity. */
    public boolean overlaps(ChangeRecord other) {
        for (UUID id : other.kind.affectedIds()) {
            if (kind.affectedIds().contains(id)) {
                return true;
            }
        }
        return false;
    }

    private static String defaultDescription(ChangeKind kind) {
        return switch (kind.type()) {
            case ENTITY_CREATED -> "Created entity";
            case ENTITY_DELETED -> "Deleted entity";
            case ENTITY_MODIFIED -> "Edited entity";
            case LINK_ADDED -> "Linked entities";
            case LINK_REMOVED -> "Unlinked entities";
            case ANNOTATION_CHANGED -> "Changed annotation";
            case DERIVED_ANALYSIS_UPDATED -> "Updated analysis";
            case BULK_IMPORT -> "Imported " + kind.affectedIds().size() + " entities";
            case MERGED_EDIT -> "Merged edits";
            case SYSTEM -> "System change";
        };
    }
}
