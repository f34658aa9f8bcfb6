package io.notelite.storage.history;

/**
 * What the history log keeps across process restarts.
 * <ul>
 *   <li>METADATA_ONLY: id, timestamp, description and snapshot flag per version. After a restart
 *       the old entries are listed but cannot be replayed; undo/redo is scoped to one session.</li>
 *   <li>FULL_PAYLOAD: every payload plus the cursor. After a restart the history is restored and
 *       navigable, provided the cursor checksum still matches the store.</li>
 * </ul>
 */
public enum VersionPersistencePolicy {
    METADATA_ONLY,
    FULL_PAYLOAD
}
