package io.notelite.server.backup;

import io.notelite.core.ConsistencyException;
import io.notelite.storage.backup.BackupHeader;

/**
 * Outcome of createBackup.
 *
 * @param backup        header of the written backup, null on failure
 * @param errorCategory null on success
 */
public record BackupResult(
        boolean success,
        BackupHeader backup,
        String message,
        ConsistencyException.Category errorCategory
) {
    static BackupResult ok(BackupHeader header) {
        return new BackupResult(true, header, "Backup created successfully", null);
    }

    static BackupResult failed(String message, ConsistencyException.Category category) {
        return new BackupResult(false, null, message, category);
    }
}
