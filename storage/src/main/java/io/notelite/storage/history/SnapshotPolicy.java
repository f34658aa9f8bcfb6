package io.notelite.storage.history;

import io.notelite.core.ChangeType;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides when a new version is stored as a full snapshot instead of a delta.
 * <p>
 * Simple but effective:
 *  - every N-th version is a snapshot, which bounds how many deltas a replay walks;
 *  - bulk imports and system versions (baseline, repair, restore) always snapshot.
 */
public final class SnapshotPolicy {
    private final int everyVersions;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyVersions) {
        if (everyVersions <= 0) throw new IllegalArgumentException("everyVersions must be > 0");
        this.everyVersions = everyVersions;
    }

    /** Call once per appended version. Resets its counter when it answers true. */
    public boolean shouldSnapshot(ChangeType type) {
        if (type == ChangeType.BULK_IMPORT || type == ChangeType.SYSTEM
                || sinceLast.incrementAndGet() >= everyVersions) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    public int everyVersions() {
        return everyVersions;
    }
}
