package io.notelite.storage.tx;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory transaction counters. Thread-safe via AtomicLong.
 */
public final class TransactionMetrics {

    private final AtomicLong begun = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong committed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rolledBack = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong commitNanos = new AtomicLong();

    void recordBegin() { begun.incrementAndGet(); }
    void recordRejected() { rejected.incrementAndGet(); }
    void recordFailed() { failed.incrementAndGet(); }
    void recordRolledBack() { rolledBack.incrementAndGet(); }
    void recordTimedOut() { timedOut.incrementAndGet(); }

    void recordCommit(long nanos) {
        committed.incrementAndGet();
        commitNanos.addAndGet(nanos);
    }

    public Snapshot snapshot() {
        long c = committed.get();
        double avgMillis = c == 0 ? 0.0 : commitNanos.get() / 1_000_000.0 / c;
        return new Snapshot(begun.get(), rejected.get(), c, failed.get(), rolledBack.get(), timedOut.get(), avgMillis);
    }

    public record Snapshot(
            long begun,
            long rejectedAtCeiling,
            long committed,
            long failed,
            long rolledBack,
            long timedOut,
            double averageCommitMillis
    ) {}

    @Override
    public String toString() {
        return "TransactionMetrics" + snapshot();
    }
}
