package io.notelite.storage.backup;

import java.time.Instant;
import java.util.Objects;

/**
 * Backup metadata as written in the file, without the entity export.
 *
 * @param checksum    {@code EntityChecksums} value of the exported entities
 * @param sizeBytes   length of the serialized entity export
 * @param entityCount number of exported entities
 */
public record BackupHeader(
        String id,
        Instant createdAt,
        BackupTrigger trigger,
        String checksum,
        long sizeBytes,
        int entityCount
) {
    public BackupHeader {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(checksum, "checksum");
    }
}
