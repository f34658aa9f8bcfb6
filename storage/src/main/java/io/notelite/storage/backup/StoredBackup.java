package io.notelite.storage.backup;

import io.notelite.core.Entity;

import java.util.List;
import java.util.Objects;

/** A backup whose content has been verified against its header. */
public record StoredBackup(BackupHeader header, List<Entity> entities) {
    public StoredBackup {
        Objects.requireNonNull(header, "header");
        entities = List.copyOf(entities);
    }
}
