package io.notelite.storage.backup;

import io.notelite.core.ConsistencyException;

/**
 * A backup that cannot be trusted. Restores fail closed on this exception.
 */
public final class BackupVerificationException extends ConsistencyException {

    public enum Reason {
        NOT_FOUND,
        CHECKSUM_MISMATCH
    }

    private final String backupId;
    private final Reason reason;

    public BackupVerificationException(String backupId, Reason reason, String message, Throwable cause) {
        super(Category.STRUCTURAL, message, cause);
        this.backupId = backupId;
        this.reason = reason;
    }

    public String backupId() {
        return backupId;
    }

    public Reason reason() {
        return reason;
    }
}
