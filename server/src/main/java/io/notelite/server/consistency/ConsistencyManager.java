package io.notelite.server.consistency;

import io.notelite.core.ChangeKind;
import io.notelite.core.ChangeRecord;
import io.notelite.core.ChangeType;
import io.notelite.core.ConsistencyException;
import io.notelite.core.DataVersion;
import io.notelite.core.conflict.ConflictResolution;
import io.notelite.core.conflict.DataConflict;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.server.backup.BackupRestoreService;
import io.notelite.server.backup.BackupResult;
import io.notelite.server.backup.RepairReport;
import io.notelite.server.backup.RestoreResult;
import io.notelite.server.conflict.ConflictResolutionEngine;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.server.integrity.IntegrityReport;
import io.notelite.storage.backup.BackupHeader;
import io.notelite.storage.backup.BackupTrigger;
import io.notelite.storage.history.NavigationResult;
import io.notelite.storage.history.VersionHistory;
import io.notelite.storage.history.VersionSummary;
import io.notelite.storage.tx.TransactionManager;
import io.notelite.storage.tx.TransactionResult;
import io.notelite.storage.tx.TransactionType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Single entry point for every mutation of the entity store.
 * <p>
 * Responsibilities:
 *  - submit: detect conflicts, resolve them, apply what was accepted in one transaction,
 *    record one version, remember the accepted changes, notify collaborators.
 *  - Take an automatic backup before deletes and large imports.
 *  - Undo, redo and jump through the version history.
 *  - Integrity checks, repairs and restores, each recorded as a system version so the
 *    history cursor always matches the store.
 * <p>
 * Every operation runs on the {@link SingleOwnerExecutor}; the returned futures complete
 * there. Components are built by the caller and passed in.
 */
public final class ConsistencyManager {
    private static final Logger log = Logger.getLogger(ConsistencyManager.class.getName());

    private final TransactionManager txManager;
    private final VersionHistory history;
    private final ConflictResolutionEngine engine;
    private final IntegrityMonitor monitor;
    private final BackupRestoreService backups;
    private final ChangeNotifier notifier;
    private final SingleOwnerExecutor owner;
    private final int bulkBackupThreshold;
    private final Clock clock;
    private final ConsistencyMetrics metrics = new ConsistencyMetrics();
    private final AtomicBoolean checkRunning = new AtomicBoolean();

    public ConsistencyManager(
            TransactionManager txManager,
            VersionHistory history,
            ConflictResolutionEngine engine,
            IntegrityMonitor monitor,
            BackupRestoreService backups,
            ChangeNotifier notifier,
            SingleOwnerExecutor owner,
            int bulkBackupThreshold,
            Clock clock
    ) {
        this.txManager = Objects.requireNonNull(txManager, "txManager");
        this.history = Objects.requireNonNull(history, "history");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (bulkBackupThreshold < 0) {
            throw new IllegalArgumentException("bulkBackupThreshold must be >= 0");
        }
        this.bulkBackupThreshold = bulkBackupThreshold;
    }

    /** Load the history log and make sure a baseline version exists. */
    public CompletableFuture<DataVersion> initialize() {
        return owner.call(history::initialize);
    }

    // ---------- changes ----------

    public CompletableFuture<ConsistencyResult> submit(ChangeRecord change) {
        Objects.requireNonNull(change, "change");
        return submitAll(List.of(change));
    }

    /** A batch is detected, resolved and applied as one unit and becomes one version. */
    public CompletableFuture<ConsistencyResult> submitAll(List<ChangeRecord> batch) {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("batch must not be empty");
        }
        List<ChangeRecord> copy = List.copyOf(batch);
        return owner.call(() -> process(copy));
    }

    // ---------- history ----------

    public CompletableFuture<NavigationResult> undo() {
        return owner.call(() -> navigated(history.undo(), "undo"));
    }

    /** Undo only if {@code versionId} is still the current version. */
    public CompletableFuture<NavigationResult> undo(String versionId) {
        return owner.call(() -> navigated(history.undo(versionId), "undo"));
    }

    public CompletableFuture<NavigationResult> redo() {
        return owner.call(() -> navigated(history.redo(), "redo"));
    }

    public CompletableFuture<NavigationResult> jumpToVersion(String versionId) {
        return owner.call(() -> navigated(history.jumpToVersion(versionId), "jump"));
    }

    public CompletableFuture<Boolean> canUndo() {
        return owner.call(history::canUndo);
    }

    public CompletableFuture<Boolean> canRedo() {
        return owner.call(history::canRedo);
    }

    public CompletableFuture<List<VersionSummary>> history(int limit) {
        return owner.call(() -> history.getHistory(limit));
    }

    public CompletableFuture<Integer> clearOldHistory(Instant olderThan) {
        return owner.call(() -> history.clearOldHistory(olderThan));
    }

    // ---------- maintenance ----------

    /**
     * Comprehensive check; critical findings are repaired right away. A request made while
     * another check is queued or running fails with an IllegalStateException.
     */
    public CompletableFuture<IntegrityReport> performIntegrityCheck() {
        if (!checkRunning.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException("integrity check already running"));
        }
        return owner.call(() -> {
            metrics.recordIntegrityCheck();
            IntegrityReport report = monitor.performComprehensiveCheck();
            if (!report.success()) {
                repairNow();
            }
            return report;
        }).whenComplete((r, e) -> checkRunning.set(false));
    }

    /** Repair critical findings; used by the integrity daemon. Warnings are left alone. */
    public CompletableFuture<RepairReport> repairCorruption() {
        return owner.call(this::repairNow);
    }

    /** User-requested repair of the given categories, warning-level issues included. */
    public CompletableFuture<RepairReport> repairIssues(Set<IssueCategory> categories) {
        Objects.requireNonNull(categories, "categories");
        return owner.call(() -> recordRepair(backups.repairIssues(categories)));
    }

    public CompletableFuture<BackupResult> createBackup(BackupTrigger trigger) {
        return owner.call(() -> backups.createBackup(trigger));
    }

    /** Backups on disk, newest first. */
    public CompletableFuture<List<BackupHeader>> listBackups() {
        return owner.call(backups::listBackups);
    }

    /** Periodic task: back up if the last backup is old enough. */
    public CompletableFuture<Void> backupIfDue(Duration interval) {
        return owner.run(() -> {
            if (backups.periodicBackupDue(interval)) {
                BackupResult r = backups.createBackup(BackupTrigger.PERIODIC);
                if (!r.success()) {
                    log.warning("Periodic backup failed: " + r.message());
                }
            }
        });
    }

    public CompletableFuture<RestoreResult> restore(String backupId) {
        return owner.call(() -> {
            RestoreResult r = backups.restore(backupId);
            if (r.storeChanged()) {
                String what = r.success() ? "Restored backup " + backupId : "Reverted failed restore of " + backupId;
                DataVersion v = history.recordSystem(what, r.appliedChanges());
                engine.clearRecent();
                notifier.publish(ChangeEvent.of(v));
            }
            metrics.recordRestore();
            return r;
        });
    }

    public ConsistencyMetrics metrics() {
        return metrics;
    }

    // ---------- internals ----------

    private ConsistencyResult process(List<ChangeRecord> batch) {
        long start = System.nanoTime();
        List<DataConflict> conflicts = List.of();
        ConflictResolution resolution = null;
        ConsistencyResult result;
        try {
            conflicts = engine.detectConflicts(batch);
            if (!conflicts.isEmpty()) {
                resolution = engine.resolveConflicts(conflicts);
            }
            if (resolution != null && resolution.requiresManualIntervention()) {
                result = result(ConsistencyStatus.MANUAL_INTERVENTION_REQUIRED, null, conflicts, resolution, start,
                        String.join("; ", resolution.manualDetails()), ConsistencyException.Category.STRUCTURAL);
            } else {
                result = apply(batch, conflicts, resolution, start);
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Processing of " + batch.size() + " change(s) failed", e);
            ConsistencyException.Category category = e instanceof ConsistencyException ce
                    ? ce.category()
                    : ConsistencyException.Category.TRANSIENT;
            result = result(ConsistencyStatus.FAILED, null, conflicts, resolution, start,
                    String.valueOf(e.getMessage()), category);
        }
        metrics.recordOutcome(result.status(), conflicts.size(), result.processingTime());
        return result;
    }

    private ConsistencyResult apply(
            List<ChangeRecord> batch,
            List<DataConflict> conflicts,
            ConflictResolution resolution,
            long start
    ) {
        List<ChangeRecord> toApply = acceptedInOrder(batch, resolution);
        if (toApply.isEmpty()) {
            log.fine(() -> "All " + batch.size() + " change(s) rejected by conflict resolution");
            return result(ConsistencyStatus.REJECTED, null, conflicts, resolution, start,
                    "rejected by conflict resolution", ConsistencyException.Category.STRUCTURAL);
        }

        backupBeforeRiskyChange(toApply);

        TransactionResult tx = txManager.builder(TransactionType.READ_WRITE)
                .addAll(OperationPlanner.plan(toApply))
                .commit();
        if (!tx.success()) {
            log.warning("Applying " + toApply.size() + " change(s) failed: " + tx.error());
            return result(ConsistencyStatus.FAILED, null, conflicts, resolution, start, tx.error(),
                    tx.errorCategory());
        }

        DataVersion version = history.record(primary(batch, toApply), tx.appliedChanges(), mergedFrom(toApply, resolution));
        for (ChangeRecord c : toApply) {
            engine.recordAccepted(c, version);
        }
        notifier.publish(ChangeEvent.of(version));
        log.fine(() -> "Applied " + toApply.size() + " change(s) as version " + version.sequence());
        return result(ConsistencyStatus.APPLIED, version, conflicts, resolution, start, null, null);
    }

    /**
     * Batch members that were not rejected, in submission order, with changes synthesized
     * by the resolution placed before the first batch member they overlap.
     */
    private List<ChangeRecord> acceptedInOrder(List<ChangeRecord> batch, ConflictResolution resolution) {
        if (resolution == null) {
            return batch;
        }
        Set<UUID> batchIds = new HashSet<>();
        batch.forEach(c -> batchIds.add(c.id()));
        Map<UUID, ChangeRecord> synthesized = new LinkedHashMap<>();
        for (ChangeRecord c : resolution.acceptedChanges()) {
            if (!batchIds.contains(c.id()) && !engine.isRecent(c.id())) {
                synthesized.put(c.id(), c);
            }
        }

        List<ChangeRecord> out = new ArrayList<>();
        for (ChangeRecord c : batch) {
            var it = synthesized.values().iterator();
            while (it.hasNext()) {
                ChangeRecord s = it.next();
                if (s.overlaps(c)) {
                    out.add(s);
                    it.remove();
                }
            }
            if (!resolution.rejected(c)) {
                out.add(c);
            }
        }
        out.addAll(synthesized.values());
        return out;
    }

    /**
     * The change a version is recorded under: the first submitted change that was applied,
     * carrying every applied description when there are several.
     */
    private static ChangeRecord primary(List<ChangeRecord> batch, List<ChangeRecord> applied) {
        ChangeRecord first = applied.stream().filter(batch::contains).findFirst().orElse(applied.get(0));
        if (applied.size() == 1) {
            return first;
        }
        String description = applied.stream().map(ChangeRecord::description).collect(Collectors.joining("; "));
        return first.withDescription(description);
    }

    /** Sources of merged edits, when the version consists of merged edits only. */
    private static List<UUID> mergedFrom(List<ChangeRecord> applied, ConflictResolution resolution) {
        if (resolution == null || !applied.stream().allMatch(c -> c.kind() instanceof ChangeKind.MergedEdit)) {
            return List.of();
        }
        List<UUID> sources = new ArrayList<>();
        for (ChangeRecord merged : applied) {
            for (ChangeRecord r : resolution.rejectedChanges()) {
                if (r.kind().mergeable() && r.affectedIds().equals(merged.affectedIds())) {
                    sources.add(r.id());
                }
            }
        }
        return sources;
    }

    private void backupBeforeRiskyChange(List<ChangeRecord> changes) {
        boolean risky = false;
        for (ChangeRecord c : changes) {
            if (c.kind() instanceof ChangeKind.EntityDeleted
                    || (c.kind() instanceof ChangeKind.BulkImport b && b.entities().size() > bulkBackupThreshold)) {
                risky = true;
                break;
            }
        }
        if (!risky) {
            return;
        }
        BackupResult r = backups.createBackup(BackupTrigger.AUTOMATIC);
        if (!r.success()) {
            log.warning("Automatic backup failed, continuing: " + r.message());
        }
    }

    private NavigationResult navigated(NavigationResult r, String action) {
        if (!r.success()) {
            log.fine(() -> action + " refused: " + r.error());
            return r;
        }
        switch (action) {
            case "undo" -> metrics.recordUndo();
            case "redo" -> metrics.recordRedo();
            default -> metrics.recordJump();
        }
        // the window describes changes that may no longer be in the store
        engine.clearRecent();
        notifier.publish(new ChangeEvent(r.version().versionId(), ChangeType.SYSTEM, r.affectedIds(), clock.instant()));
        return r;
    }

    private RepairReport repairNow() {
        return recordRepair(backups.detectAndRepairCorruption());
    }

    private RepairReport recordRepair(RepairReport report) {
        if (!report.appliedChanges().isEmpty()) {
            String what = report.restoredFromBackup() != null
                    ? "Repair: restored backup " + report.restoredFromBackup()
                    : "Repair: " + report.repairsApplied() + " fix(es)";
            DataVersion v = history.recordSystem(what, report.appliedChanges());
            if (report.restoredFromBackup() != null) {
                engine.clearRecent();
            }
            notifier.publish(ChangeEvent.of(v));
        }
        if (report.repairAttempted()) {
            metrics.recordRepair();
        }
        if (!report.repairSuccessful()) {
            log.warning("Repair incomplete: " + report.message());
        }
        return report;
    }

    private static ConsistencyResult result(
            ConsistencyStatus status,
            DataVersion version,
            List<DataConflict> conflicts,
            ConflictResolution resolution,
            long startNanos,
            String error,
            ConsistencyException.Category category
    ) {
        return new ConsistencyResult(status, version, conflicts, resolution,
                Duration.ofNanos(System.nanoTime() - startNanos), error, category);
    }
}
