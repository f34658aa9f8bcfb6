package io.notelite.storage.backup;

/** Why a backup was taken. */
public enum BackupTrigger {
    MANUAL,
    AUTOMATIC,
    PERIODIC,
    BEFORE_RESTORE,
    CORRUPTION
}
