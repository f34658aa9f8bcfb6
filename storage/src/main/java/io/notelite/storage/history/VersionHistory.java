package io.notelite.storage.history;

import io.notelite.core.ChangeRecord;
import io.notelite.core.ChangeType;
import io.notelite.core.ConsistencyException;
import io.notelite.core.DataVersion;
import io.notelite.core.DeltaOperation;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.core.VersionPayload;
import io.notelite.storage.EntityStore;
import io.notelite.storage.tx.AppliedChange;
import io.notelite.storage.tx.Operation;
import io.notelite.storage.tx.TransactionManager;
import io.notelite.storage.tx.TransactionResult;
import io.notelite.storage.tx.TransactionType;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered, navigable log of accepted changes.
 * <p>
 * Responsibilities:
 *  - Keep versions in a list with a cursor. Appending while the cursor is not at the
 *    tail discards the redo branch.
 *  - Undo, redo and jump apply the target state through one transaction whose verifier
 *    checks the target checksum. The cursor only moves once that commit succeeded.
 *  - Enforce the count and byte ceilings: evict oldest first (rebasing the new head into a
 *    snapshot), compact older entries when the byte budget is still exceeded.
 *  - Mirror every change to the {@link VersionLog}, if one is configured.
 * <p>
 * Invariants:
 *  - versions.get(0) is always a snapshot, so every version can be materialized.
 *  - the cursor version's checksum equals the store checksum after every successful call.
 * <p>
 * Methods are synchronized; in the running system all calls arrive from one owner thread.
 */
public final class VersionHistory {
    private static final Logger log = Logger.getLogger(VersionHistory.class.getName());

    private final EntityStore store;
    private final TransactionManager txManager;
    private final HistoryLimits limits;
    private final SnapshotPolicy snapshots;
    private final VersionLog versionLog;
    private final Clock clock;
    private final HistoryMetrics metrics = new HistoryMetrics();

    private final List<DataVersion> versions = new ArrayList<>();
    private final List<VersionSummary> archived = new ArrayList<>();
    private int cursor = -1;
    private long nextSequence;

    /**
     * @param versionLog optional; null keeps the history in memory only
     */
    public VersionHistory(
            EntityStore store,
            TransactionManager txManager,
            HistoryLimits limits,
            SnapshotPolicy snapshots,
            VersionLog versionLog,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.txManager = Objects.requireNonNull(txManager, "txManager");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.versionLog = versionLog;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Load what the log allows and make sure a replayable head exists.
     * Idempotent; returns the current version.
     */
    public synchronized DataVersion initialize() {
        if (cursor >= 0) {
            return versions.get(cursor);
        }
        if (versionLog != null) {
            restoreFromLog();
        }
        if (cursor < 0) {
            appendBaseline("Baseline");
        }
        persist();
        return versions.get(cursor);
    }

    // ---------- appending ----------

    /** Version for an accepted change whose journal was just committed. */
    public synchronized DataVersion record(ChangeRecord change, List<AppliedChange> journal) {
        return record(change, journal, List.of());
    }

    /**
     * @param mergedFrom ids of the changes a merged edit was built from; their updates
     *                   are stored as Merge operations
     */
    public synchronized DataVersion record(ChangeRecord change, List<AppliedChange> journal, List<UUID> mergedFrom) {
        Objects.requireNonNull(change, "change");
        Set<UUID> affected = new LinkedHashSet<>(change.affectedIds());
        journal.forEach(c -> affected.add(c.id()));
        List<DeltaOperation> ops = DeltaCompactor.fromJournal(journal);
        if (!mergedFrom.isEmpty()) {
            List<DeltaOperation> merged = new ArrayList<>(ops.size());
            for (DeltaOperation op : ops) {
                merged.add(op instanceof DeltaOperation.Update u
                        ? new DeltaOperation.Merge(u.before(), u.after(), mergedFrom)
                        : op);
            }
            ops = merged;
        }
        DataVersion v = build(change.type(), affected, DataVersion.Metadata.forChange(change), ops);
        addVersion(v);
        return v;
    }

    /** Version for a repair, restore or other system action. Always a snapshot. */
    public synchronized DataVersion recordSystem(String description, List<AppliedChange> journal) {
        Set<UUID> affected = new LinkedHashSet<>();
        journal.forEach(c -> affected.add(c.id()));
        DataVersion v = build(ChangeType.SYSTEM, affected, DataVersion.Metadata.system(description),
                DeltaCompactor.fromJournal(journal));
        addVersion(v);
        return v;
    }

    /**
     * Append a fully built version at the cursor. Versions after the cursor are discarded,
     * then the ceilings are enforced.
     */
    public synchronized void addVersion(DataVersion version) {
        Objects.requireNonNull(version, "version");
        if (version.sequence() < nextSequence) {
            throw new IllegalArgumentException("version sequence " + version.sequence()
                    + " is not after " + (nextSequence - 1));
        }
        if (versions.isEmpty() && !version.isSnapshot()) {
            throw new IllegalArgumentException("first version must be a snapshot");
        }
        if (cursor < versions.size() - 1) {
            int dropped = versions.size() - 1 - cursor;
            versions.subList(cursor + 1, versions.size()).clear();
            log.fine(() -> "Discarded " + dropped + " redo versions");
        }
        versions.add(version);
        cursor = versions.size() - 1;
        nextSequence = version.sequence() + 1;
        metrics.recordAdd();
        enforceLimits();
        persist();
    }

    // ---------- navigation ----------

    public synchronized NavigationResult undo() {
        if (!canUndo()) {
            return NavigationResult.failed(currentOrNull(), "nothing to undo", ConsistencyException.Category.STRUCTURAL);
        }
        return navigate(cursor - 1, Direction.BACK);
    }

    /** Undo, refusing if {@code fromVersionId} is no longer the current version. */
    public synchronized NavigationResult undo(String fromVersionId) {
        DataVersion current = currentOrNull();
        if (current == null || !current.versionId().equals(fromVersionId)) {
            return NavigationResult.failed(current,
                    "version " + fromVersionId + " is not current"
                            + (current != null ? " (current is " + current.versionId() + ")" : ""),
                    ConsistencyException.Category.STRUCTURAL);
        }
        return undo();
    }

    public synchronized NavigationResult redo() {
        if (!canRedo()) {
            return NavigationResult.failed(currentOrNull(), "nothing to redo", ConsistencyException.Category.STRUCTURAL);
        }
        return navigate(cursor + 1, Direction.FORWARD);
    }

    public synchronized NavigationResult jumpToVersion(String versionId) {
        int idx = indexOf(versionId);
        if (idx < 0) {
            return NavigationResult.failed(currentOrNull(), "unknown or non-replayable version " + versionId,
                    ConsistencyException.Category.STRUCTURAL);
        }
        if (idx == cursor) {
            return NavigationResult.ok(versions.get(cursor), Set.of());
        }
        return navigate(idx, Direction.JUMP);
    }

    public synchronized boolean canUndo() {
        return cursor > 0;
    }

    public synchronized boolean canRedo() {
        return cursor >= 0 && cursor < versions.size() - 1;
    }

    // ---------- queries ----------

    public synchronized Optional<DataVersion> current() {
        return Optional.ofNullable(currentOrNull());
    }

    /** Newest-first summaries, including entries archived from earlier sessions. */
    public synchronized List<VersionSummary> getHistory(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<VersionSummary> out = new ArrayList<>(Math.min(limit, versions.size() + archived.size()));
        for (int i = versions.size() - 1; i >= 0 && out.size() < limit; i--) {
            DataVersion v = versions.get(i);
            out.add(new VersionSummary(v.versionId(), v.sequence(), v.timestamp(), v.metadata().description(),
                    v.changeType(), v.isSnapshot(), true, i == cursor));
        }
        for (int i = archived.size() - 1; i >= 0 && out.size() < limit; i--) {
            out.add(archived.get(i));
        }
        return out;
    }

    /** Replayable versions strictly after the given one, oldest first. Unknown id gives an empty list. */
    public synchronized List<DataVersion> versionsAfter(String versionId) {
        int idx = indexOf(versionId);
        if (idx < 0) {
            return List.of();
        }
        return List.copyOf(versions.subList(idx + 1, versions.size()));
    }

    /** Sequence number of a live or archived version. */
    public synchronized OptionalLong sequenceOf(String versionId) {
        for (DataVersion v : versions) {
            if (v.versionId().equals(versionId)) return OptionalLong.of(v.sequence());
        }
        for (VersionSummary s : archived) {
            if (s.versionId().equals(versionId)) return OptionalLong.of(s.sequence());
        }
        return OptionalLong.empty();
    }

    /** Full state at the given version, replayed from the nearest snapshot. */
    public synchronized Map<UUID, Entity> materialize(String versionId) {
        int idx = indexOf(versionId);
        if (idx < 0) {
            throw new IllegalArgumentException("unknown or non-replayable version " + versionId);
        }
        return Collections.unmodifiableMap(materialize(idx));
    }

    /**
     * Drop versions older than the cutoff, never the current one, and archived entries
     * older than the cutoff. Returns the number of removed entries.
     */
    public synchronized int clearOldHistory(Instant olderThan) {
        Objects.requireNonNull(olderThan, "olderThan");
        int removed = 0;
        while (cursor > 0 && versions.get(0).timestamp().isBefore(olderThan)) {
            evictOldest();
            removed++;
        }
        int before = archived.size();
        archived.removeIf(s -> s.timestamp().isBefore(olderThan));
        removed += before - archived.size();
        if (removed > 0) {
            metrics.recordEvicted(removed);
            persist();
            log.info("Cleared " + removed + " history entries older than " + olderThan);
        }
        return removed;
    }

    public synchronized int size() {
        return versions.size();
    }

    public synchronized long totalBytes() {
        long sum = 0;
        for (DataVersion v : versions) {
            sum += v.storageSize();
        }
        return sum;
    }

    public HistoryMetrics metrics() {
        return metrics;
    }

    public HistoryLimits limits() {
        return limits;
    }

    public Optional<VersionLog> versionLog() {
        return Optional.ofNullable(versionLog);
    }

    // ---------- internals ----------

    private enum Direction { BACK, FORWARD, JUMP }

    private NavigationResult navigate(int targetIdx, Direction direction) {
        DataVersion current = versions.get(cursor);
        DataVersion target = versions.get(targetIdx);

        List<DeltaOperation> ops;
        if (direction == Direction.BACK && current.payload() instanceof VersionPayload.Delta d) {
            ops = d.inverseOperations();
        } else if (direction == Direction.FORWARD && target.payload() instanceof VersionPayload.Delta d) {
            ops = d.operations();
        } else {
            ops = DeltaCompactor.diff(liveState(), materialize(targetIdx));
        }

        TransactionResult result = txManager.builder(TransactionType.READ_WRITE)
                .addAll(toOperations(ops))
                .verifyWith(s -> EntityChecksums.of(s.findAll()).equals(target.checksum()))
                .commit();
        if (!result.success()) {
            metrics.recordFailure();
            log.warning("History " + direction + " to " + target.versionId() + " failed: " + result.error());
            return NavigationResult.failed(current, result.error(), result.errorCategory());
        }

        cursor = targetIdx;
        switch (direction) {
            case BACK -> metrics.recordUndo();
            case FORWARD -> metrics.recordRedo();
            case JUMP -> metrics.recordJump();
        }
        persist();
        Set<UUID> affected = new LinkedHashSet<>();
        result.appliedChanges().forEach(c -> affected.add(c.id()));
        return NavigationResult.ok(target, affected);
    }

    private static List<Operation> toOperations(List<DeltaOperation> ops) {
        List<Operation> out = new ArrayList<>(ops.size());
        for (DeltaOperation op : ops) {
            if (op instanceof DeltaOperation.Create c) {
                out.add(new Operation.Insert(c.after()));
            } else if (op instanceof DeltaOperation.Update u) {
                out.add(new Operation.Update(u.after()));
            } else if (op instanceof DeltaOperation.Merge m) {
                out.add(new Operation.Update(m.after()));
            } else if (op instanceof DeltaOperation.Delete d) {
                out.add(new Operation.Delete(d.before().id()));
            } else if (op instanceof DeltaOperation.Move mv) {
                out.add(new Operation.Custom("move link " + mv.entityId() + " " + mv.from() + "->" + mv.to(), s -> {
                    Entity e = s.find(mv.entityId()).orElseThrow(
                            () -> new IllegalStateException("entity " + mv.entityId() + " missing"));
                    if (!e.hasLinkTo(mv.from())) {
                        throw new IllegalStateException("link " + mv.entityId() + "->" + mv.from() + " missing");
                    }
                    s.update(e.withLinkRetargeted(mv.from(), mv.to()));
                }, false));
            }
        }
        return out;
    }

    private DataVersion build(ChangeType type, Set<UUID> affected, DataVersion.Metadata metadata, List<DeltaOperation> ops) {
        List<Entity> state = store.findAll();
        VersionPayload payload = snapshots.shouldSnapshot(type)
                ? new VersionPayload.Snapshot(state)
                : new VersionPayload.Delta(ops);
        DataVersion parent = currentOrNull();
        return new DataVersion(
                DataVersion.newId(),
                nextSequence,
                clock.instant(),
                type,
                affected,
                EntityChecksums.of(state),
                parent == null ? null : parent.versionId(),
                metadata,
                payload
        );
    }

    private void appendBaseline(String description) {
        List<Entity> state = store.findAll();
        String parent = archived.isEmpty() ? null : archived.get(archived.size() - 1).versionId();
        DataVersion baseline = new DataVersion(
                DataVersion.newId(),
                nextSequence,
                clock.instant(),
                ChangeType.SYSTEM,
                Set.of(),
                EntityChecksums.of(state),
                parent,
                DataVersion.Metadata.system(description),
                new VersionPayload.Snapshot(state)
        );
        versions.add(baseline);
        cursor = 0;
        nextSequence = baseline.sequence() + 1;
    }

    private void restoreFromLog() {
        VersionLog.Contents contents;
        try {
            Optional<VersionLog.Contents> read = versionLog.read();
            if (read.isEmpty()) {
                return;
            }
            contents = read.get();
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.log(Level.WARNING, "Ignoring unreadable version log " + versionLog.file(), e);
            return;
        }
        archived.addAll(contents.archived());
        nextSequence = Math.max(nextSequence, contents.nextSequence());

        List<DataVersion> loaded = contents.versions();
        int idx = -1;
        for (int i = 0; i < loaded.size(); i++) {
            if (loaded.get(i).versionId().equals(contents.cursorVersionId())) {
                idx = i;
            }
        }
        String live = EntityChecksums.of(store.findAll());
        if (idx >= 0 && loaded.get(0).isSnapshot() && loaded.get(idx).checksum().equals(live)) {
            versions.addAll(loaded);
            cursor = idx;
            nextSequence = Math.max(nextSequence, loaded.get(loaded.size() - 1).sequence() + 1);
            log.info("Restored " + loaded.size() + " versions from " + versionLog.file());
            return;
        }
        if (!loaded.isEmpty()) {
            log.warning("Version log " + versionLog.file() + " does not match the store; starting a new baseline");
            for (DataVersion v : loaded) {
                archived.add(new VersionSummary(v.versionId(), v.sequence(), v.timestamp(),
                        v.metadata().description(), v.changeType(), v.isSnapshot(), false, false));
            }
        }
        while (archived.size() > limits.maxVersions()) {
            archived.remove(0);
        }
    }

    private void enforceLimits() {
        int evicted = 0;
        while (versions.size() > limits.maxVersions() && cursor > 0) {
            evictOldest();
            evicted++;
        }
        if (totalBytes() > limits.maxBytes()) {
            compactOlderHalf();
        }
        while (totalBytes() > limits.maxBytes() && cursor > 0) {
            evictOldest();
            evicted++;
        }
        if (evicted > 0) {
            metrics.recordEvicted(evicted);
            int n = evicted;
            log.fine(() -> "Evicted " + n + " versions");
        }
    }

    /** Remove the oldest version; the next one becomes a self-sufficient snapshot. */
    private void evictOldest() {
        DataVersion next = versions.get(1);
        if (!next.isSnapshot()) {
            Map<UUID, Entity> state = materialize(1);
            versions.set(1, next.withPayload(new VersionPayload.Snapshot(new ArrayList<>(state.values()))));
        }
        versions.remove(0);
        cursor--;
    }

    /** Shrink non-head entries in the older half: snapshots become deltas, deltas get coalesced. */
    private void compactOlderHalf() {
        int end = Math.max(1, versions.size() / 2);
        int compacted = 0;
        for (int i = 1; i <= end && i < versions.size(); i++) {
            DataVersion v = versions.get(i);
            List<DeltaOperation> ops = v.payload() instanceof VersionPayload.Delta d
                    ? DeltaCompactor.coalesce(d.operations())
                    : DeltaCompactor.diff(materialize(i - 1), materialize(i));
            VersionPayload.Delta smaller = new VersionPayload.Delta(ops);
            if (smaller.estimatedBytes() < v.storageSize()) {
                versions.set(i, v.withPayload(smaller));
                compacted++;
            }
        }
        if (compacted > 0) {
            metrics.recordCompacted(compacted);
        }
    }

    private Map<UUID, Entity> materialize(int index) {
        int base = index;
        while (base >= 0 && !versions.get(base).isSnapshot()) {
            base--;
        }
        if (base < 0) {
            throw new IllegalStateException("no snapshot at or before version index " + index);
        }
        Map<UUID, Entity> state = new HashMap<>();
        for (Entity e : ((VersionPayload.Snapshot) versions.get(base).payload()).entities()) {
            state.put(e.id(), e);
        }
        for (int i = base + 1; i <= index; i++) {
            for (DeltaOperation op : ((VersionPayload.Delta) versions.get(i).payload()).operations()) {
                op.applyTo(state);
            }
        }
        return state;
    }

    private Map<UUID, Entity> liveState() {
        Map<UUID, Entity> state = new HashMap<>();
        for (Entity e : store.findAll()) {
            state.put(e.id(), e);
        }
        return state;
    }

    private int indexOf(String versionId) {
        for (int i = 0; i < versions.size(); i++) {
            if (versions.get(i).versionId().equals(versionId)) {
                return i;
            }
        }
        return -1;
    }

    private DataVersion currentOrNull() {
        return cursor < 0 ? null : versions.get(cursor);
    }

    private void persist() {
        if (versionLog == null) {
            return;
        }
        DataVersion current = currentOrNull();
        try {
            versionLog.write(versions, archived, current == null ? null : current.versionId(), nextSequence);
        } catch (UncheckedIOException e) {
            // the store and in-memory history already moved on; the next write catches the log up
            metrics.recordLogWriteFailure();
            log.log(Level.WARNING, "Version log " + versionLog.file() + " not written", e);
        }
    }
}
