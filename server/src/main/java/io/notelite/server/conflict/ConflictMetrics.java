package io.notelite.server.conflict;

import io.notelite.core.conflict.ConflictType;
import io.notelite.core.conflict.DataConflict;
import io.notelite.core.conflict.ResolutionStrategy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for conflict detection and resolution.
 * <p>
 * Tracked:
 *  - conflicts detected, per conflict type;
 *  - resolutions that were applied automatically vs. handed to a person;
 *  - how often each strategy was used.
 */
public final class ConflictMetrics {

    private final Map<ConflictType, AtomicLong> detected = new EnumMap<>(ConflictType.class);
    private final Map<ResolutionStrategy, AtomicLong> strategies = new EnumMap<>(ResolutionStrategy.class);
    private final AtomicLong autoResolved = new AtomicLong();
    private final AtomicLong manual = new AtomicLong();
    private final AtomicLong changesRejected = new AtomicLong();

    public ConflictMetrics() {
        for (ConflictType t : ConflictType.values()) {
            detected.put(t, new AtomicLong());
        }
        for (ResolutionStrategy s : ResolutionStrategy.values()) {
            strategies.put(s, new AtomicLong());
        }
    }

    void recordDetected(List<DataConflict> conflicts) {
        for (DataConflict c : conflicts) {
            detected.get(c.type()).incrementAndGet();
        }
    }

    void recordAutoResolved(List<ResolutionStrategy> used, int rejected) {
        autoResolved.incrementAndGet();
        changesRejected.addAndGet(rejected);
        for (ResolutionStrategy s : used) {
            strategies.get(s).incrementAndGet();
        }
    }

    void recordManual(int rejected) {
        manual.incrementAndGet();
        changesRejected.addAndGet(rejected);
    }

    public Snapshot snapshot() {
        Map<ConflictType, Long> byType = new EnumMap<>(ConflictType.class);
        detected.forEach((k, v) -> byType.put(k, v.get()));
        Map<ResolutionStrategy, Long> byStrategy = new EnumMap<>(ResolutionStrategy.class);
        strategies.forEach((k, v) -> byStrategy.put(k, v.get()));
        long total = byType.values().stream().mapToLong(Long::longValue).sum();
        return new Snapshot(total, byType, byStrategy, autoResolved.get(), manual.get(), changesRejected.get());
    }

    public record Snapshot(
            long conflictsDetected,
            Map<ConflictType, Long> detectedByType,
            Map<ResolutionStrategy, Long> strategyUses,
            long autoResolved,
            long manualInterventions,
            long changesRejected
    ) {
        public Snapshot {
            detectedByType = Map.copyOf(detectedByType);
            strategyUses = Map.copyOf(strategyUses);
        }
    }
}
