package io.notelite.server.consistency;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for the orchestrator:
 *  - submitted/applied/rejected/manual/failed: outcome of each submit call;
 *  - conflictsDetected: conflicts seen across all submits;
 *  - undos/redos/jumps: successful history navigations;
 *  - integrityChecks/repairs/restores: maintenance runs.
 */
public final class ConsistencyMetrics {

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong manual = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong conflictsDetected = new AtomicLong();
    private final AtomicLong processingNanos = new AtomicLong();
    private final AtomicLong undos = new AtomicLong();
    private final AtomicLong redos = new AtomicLong();
    private final AtomicLong jumps = new AtomicLong();
    private final AtomicLong integrityChecks = new AtomicLong();
    private final AtomicLong repairs = new AtomicLong();
    private final AtomicLong restores = new AtomicLong();

    void recordOutcome(ConsistencyStatus status, int conflicts, Duration elapsed) {
        submitted.incrementAndGet();
        conflictsDetected.addAndGet(conflicts);
        processingNanos.addAndGet(elapsed.toNanos());
        switch (status) {
            case APPLIED -> applied.incrementAndGet();
            case REJECTED -> rejected.incrementAndGet();
            case MANUAL_INTERVENTION_REQUIRED -> manual.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
        }
    }

    void recordUndo() {
        undos.incrementAndGet();
    }

    void recordRedo() {
        redos.incrementAndGet();
    }

    void recordJump() {
        jumps.incrementAndGet();
    }

    void recordIntegrityCheck() {
        integrityChecks.incrementAndGet();
    }

    void recordRepair() {
        repairs.incrementAndGet();
    }

    void recordRestore() {
        restores.incrementAndGet();
    }

    public Snapshot snapshot() {
        long n = submitted.get();
        double avgMs = n == 0 ? 0.0 : processingNanos.get() / 1_000_000.0 / n;
        return new Snapshot(n, applied.get(), rejected.get(), manual.get(), failed.get(),
                conflictsDetected.get(), avgMs, undos.get(), redos.get(), jumps.get(),
                integrityChecks.get(), repairs.get(), restores.get());
    }

    public record Snapshot(
            long changesSubmitted,
            long changesApplied,
            long changesRejected,
            long manualInterventions,
            long changesFailed,
            long conflictsDetected,
            double avgProcessingMs,
            long undos,
            long redos,
            long jumps,
            long integrityChecks,
            long repairs,
            long restores
    ) {
    }
}
