package io.notelite.server.backup;

import java.util.concurrent.atomic.AtomicLong;

/** Counters for backup, restore and repair activity. */
public final class BackupMetrics {
    private final AtomicLong backups = new AtomicLong();
    private final AtomicLong backupFailures = new AtomicLong();
    private final AtomicLong backupNanos = new AtomicLong();
    private final AtomicLong restores = new AtomicLong();
    private final AtomicLong restoreFailures = new AtomicLong();
    private final AtomicLong rollbacks = new AtomicLong();
    private final AtomicLong repairsApplied = new AtomicLong();
    private final AtomicLong deleted = new AtomicLong();

    void recordBackup(boolean ok, long nanos) {
        if (ok) {
            backups.incrementAndGet();
            backupNanos.addAndGet(nanos);
        } else {
            backupFailures.incrementAndGet();
        }
    }

    void recordRestore(boolean ok) {
        if (ok) {
            restores.incrementAndGet();
        } else {
            restoreFailures.incrementAndGet();
        }
    }

    void recordRollback() {
        rollbacks.incrementAndGet();
    }

    void recordRepairs(int n) {
        repairsApplied.addAndGet(n);
    }

    void recordDeleted(int n) {
        deleted.addAndGet(n);
    }

    public Snapshot snapshot() {
        long b = backups.get();
        double avgMs = b == 0 ? 0.0 : backupNanos.get() / 1_000_000.0 / b;
        return new Snapshot(b, backupFailures.get(), avgMs, restores.get(), restoreFailures.get(),
                rollbacks.get(), repairsApplied.get(), deleted.get());
    }

    public record Snapshot(
            long backupsCreated,
            long backupFailures,
            double avgBackupMs,
            long restores,
            long restoreFailures,
            long restoreRollbacks,
            long repairsApplied,
            long backupsDeleted
    ) {}
}
