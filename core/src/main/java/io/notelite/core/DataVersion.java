package io.notelite.core;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One entry of the version history.
 * <p>
 * Semantics:
 *  - checksum is the {@link EntityChecksums} value of the full store state right after
 *    this version was applied; navigation verifies it.
 *  - sequence grows by one per appended version and is never reused, so it orders
 *    versions even after eviction.
 *  - a Snapshot payload is self-sufficient; a Delta payload only makes sense on top
 *    of the previous version.
 */
public record DataVersion(
        String versionId,
        long sequence,
        Instant timestamp,
        ChangeType changeType,
        Set<UUID> affectedIds,
        String checksum,
        String parentVersionId,
        Metadata metadata,
        VersionPayload payload
) {
    public DataVersion {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(changeType, "changeType");
        Objects.requireNonNull(checksum, "checksum");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(payload, "payload");
        affectedIds = affectedIds == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(affectedIds));
    }

    /**
     * Descriptive data carried alongside a version.
     *
     * @param description     human-readable summary
     * @param userInitiated   true when a user edit produced the version
     * @param systemGenerated true for baselines, repairs and restores
     * @param impact          coarse impact for displays
     * @param tags            free-form labels
     */
    public record Metadata(
            String description,
            boolean userInitiated,
            boolean systemGenerated,
            ChangeImpact impact,
            List<String> tags
    ) {
        public Metadata {
            description = description == null ? "" : description;
            impact = impact == null ? ChangeImpact.LOW : impact;
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public static Metadata system(String description) {
            return new Metadata(description, false, true, ChangeImpact.CRITICAL, List.of());
        }

        public static Metadata forChange(ChangeRecord change) {
            return new Metadata(
                    change.description(),
                    change.userInitiated(),
                    change.origin() == ChangeOrigin.SYSTEM,
                    ChangeImpact.forType(change.type()),
                    List.of()
            );
        }
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public boolean isSnapshot() {
        return payload instanceof VersionPayload.Snapshot;
    }

    public long storageSize() {
        return payload.estimatedBytes();
    }

    /** Same version with a different payload; used by compaction and rebasing. */
    public DataVersion withPayload(VersionPayload newPayload) {
        return new DataVersion(versionId, sequence, timestamp, changeType, affectedIds, checksum,
                parentVersionId, metadata, newPayload);
    }

    public DataVersion withParent(String newParent) {
        return new DataVersion(versionId, sequence, timestamp, changeType, affectedIds, checksum,
                newParent, metadata, payload);
    }
}
