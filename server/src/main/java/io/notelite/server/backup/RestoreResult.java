package io.notelite.server.backup;

import io.notelite.core.ConsistencyException;
import io.notelite.storage.tx.AppliedChange;

import java.util.List;

/**
 * Outcome of a restore.
 *
 * @param backupId           backup that was requested
 * @param preRestoreBackupId backup of the state before the restore, null if it could not be taken
 * @param rolledBack         true if the restored state failed its integrity check and was reverted
 * @param appliedChanges     every store mutation made, including a rollback; empty if the store was untouched
 * @param errorCategory      null on success; FATAL only when the rollback failed as well
 */
public record RestoreResult(
        boolean success,
        String message,
        String backupId,
        String preRestoreBackupId,
        boolean rolledBack,
        List<AppliedChange> appliedChanges,
        ConsistencyException.Category errorCategory
) {
    public RestoreResult {
        appliedChanges = appliedChanges == null ? List.of() : List.copyOf(appliedChanges);
    }

    public boolean storeChanged() {
        return !appliedChanges.isEmpty();
    }

    static RestoreResult untouched(String backupId, String message, ConsistencyException.Category category) {
        return new RestoreResult(false, message, backupId, null, false, List.of(), category);
    }
}
