package io.notelite.server.integrity;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for integrity checks:
 *  - quick and comprehensive check counts with their total time,
 *  - issues reported, critical issues reported,
 *  - checks that ended critical.
 */
public final class IntegrityMetrics {
    private final AtomicLong quickChecks = new AtomicLong();
    private final AtomicLong quickNanos = new AtomicLong();
    private final AtomicLong fullChecks = new AtomicLong();
    private final AtomicLong fullNanos = new AtomicLong();
    private final AtomicLong issues = new AtomicLong();
    private final AtomicLong criticalIssues = new AtomicLong();
    private final AtomicLong criticalChecks = new AtomicLong();

    void recordQuick(Duration elapsed, int critical) {
        quickChecks.incrementAndGet();
        quickNanos.addAndGet(elapsed.toNanos());
        criticalIssues.addAndGet(critical);
        if (critical > 0) {
            criticalChecks.incrementAndGet();
        }
    }

    void recordFull(Duration elapsed, int issueCount, int critical) {
        fullChecks.incrementAndGet();
        fullNanos.addAndGet(elapsed.toNanos());
        issues.addAndGet(issueCount);
        criticalIssues.addAndGet(critical);
        if (critical > 0) {
            criticalChecks.incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        long q = quickChecks.get();
        long f = fullChecks.get();
        double avgQuickMs = q == 0 ? 0.0 : quickNanos.get() / 1_000_000.0 / q;
        double avgFullMs = f == 0 ? 0.0 : fullNanos.get() / 1_000_000.0 / f;
        return new Snapshot(q, f, avgQuickMs, avgFullMs, issues.get(), criticalIssues.get(), criticalChecks.get());
    }

    public record Snapshot(
            long quickChecks,
            long comprehensiveChecks,
            double avgQuickCheckMs,
            double avgComprehensiveCheckMs,
            long issuesReported,
            long criticalIssuesReported,
            long checksEndingCritical
    ) {}
}
