package io.notelite.storage.history;

import java.util.concurrent.atomic.AtomicLong;

/** Counters for history operations. */
public final class HistoryMetrics {
    private final AtomicLong added = new AtomicLong();
    private final AtomicLong undos = new AtomicLong();
    private final AtomicLong redos = new AtomicLong();
    private final AtomicLong jumps = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong compacted = new AtomicLong();
    private final AtomicLong logWriteFailures = new AtomicLong();

    void recordAdd() { added.incrementAndGet(); }
    void recordUndo() { undos.incrementAndGet(); }
    void recordRedo() { redos.incrementAndGet(); }
    void recordJump() { jumps.incrementAndGet(); }
    void recordFailure() { failures.incrementAndGet(); }
    void recordEvicted(int n) { evicted.addAndGet(n); }
    void recordCompacted(int n) { compacted.addAndGet(n); }
    void recordLogWriteFailure() { logWriteFailures.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(added.get(), undos.get(), redos.get(), jumps.get(), failures.get(),
                evicted.get(), compacted.get(), logWriteFailures.get());
    }

    public record Snapshot(
            long versionsAdded,
            long undos,
            long redos,
            long jumps,
            long navigationFailures,
            long versionsEvicted,
            long versionsCompacted,
            long logWriteFailures
    ) {}
}
