package io.notelite.storage.backup;

import io.notelite.core.Entity;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage for full entity exports.
 * <p>
 * Implementations must write atomically and must verify content on every load.
 */
public interface BackupRepository {

    /** Persist an export and return its header. */
    BackupHeader write(String id, Instant createdAt, BackupTrigger trigger, List<Entity> entities);

    /**
     * Load and verify a backup.
     *
     * @throws BackupVerificationException if it is missing, unreadable, or its content
     *                                     does not match the recorded checksum, size or count
     */
    StoredBackup load(String id);

    /** Headers of readable backups, newest first. Unreadable files are skipped. */
    List<BackupHeader> list();

    /** @return true if a file was removed */
    boolean delete(String id);
}
