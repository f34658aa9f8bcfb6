package io.notelite.server.backup;

import io.notelite.core.ConsistencyException;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.core.integrity.IntegrityIssue;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.server.integrity.IntegrityReport;
import io.notelite.storage.EntityStore;
import io.notelite.storage.backup.BackupHeader;
import io.notelite.storage.backup.BackupRepository;
import io.notelite.storage.backup.BackupTrigger;
import io.notelite.storage.backup.BackupVerificationException;
import io.notelite.storage.backup.StoredBackup;
import io.notelite.storage.tx.AppliedChange;
import io.notelite.storage.tx.Operation;
import io.notelite.storage.tx.TransactionManager;
import io.notelite.storage.tx.TransactionResult;
import io.notelite.storage.tx.TransactionType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Point-in-time exports of the entity store, verified restores, and automatic repair.
 * <p>
 * Responsibilities:
 *  - createBackup: export every entity through the {@link BackupRepository}; at most one
 *    backup in flight; retention applied afterwards.
 *  - restore: verify the backup (fail closed, store untouched), take a best-effort
 *    pre-restore backup, replace the store contents in one transaction, run a
 *    comprehensive integrity check, and roll back to the pre-restore state if critical
 *    issues remain.
 *  - detectAndRepairCorruption: repair critical issues by category in one transaction,
 *    then fall back to the newest verified backup for data corruption; warnings are
 *    only repaired when asked for through repairIssues.
 * <p>
 * All store mutations go through the {@link TransactionManager}; results carry the
 * applied changes so the caller can record a version for them.
 */
public final class BackupRestoreService {
    private static final Logger log = Logger.getLogger(BackupRestoreService.class.getName());

    private static final Set<IssueCategory> STRUCTURAL_REPAIRS = EnumSet.of(
            IssueCategory.SCHEMA_VIOLATION,
            IssueCategory.MISSING_REFERENCE,
            IssueCategory.ORPHANED_DATA,
            IssueCategory.DUPLICATE,
            IssueCategory.INVALID_RELATIONSHIP
    );

    private final EntityStore store;
    private final TransactionManager txManager;
    private final BackupRepository repository;
    private final IntegrityMonitor monitor;
    private final BackupRetention retention;
    private final Clock clock;
    private final BackupMetrics metrics = new BackupMetrics();

    private final AtomicBoolean backingUp = new AtomicBoolean();
    private final AtomicBoolean restoring = new AtomicBoolean();
    private volatile Instant lastBackupAt;

    public BackupRestoreService(
            EntityStore store,
            TransactionManager txManager,
            BackupRepository repository,
            IntegrityMonitor monitor,
            BackupRetention retention,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.txManager = Objects.requireNonNull(txManager, "txManager");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
        repository.list().stream().findFirst().ifPresent(h -> lastBackupAt = h.createdAt());
    }

    // ---------- backups ----------

    public BackupResult createBackup(BackupTrigger trigger) {
        Objects.requireNonNull(trigger, "trigger");
        if (!backingUp.compareAndSet(false, true)) {
            return BackupResult.failed("Backup already in progress", ConsistencyException.Category.TRANSIENT);
        }
        long start = System.nanoTime();
        try {
            Instant now = clock.instant();
            List<Entity> entities = store.findAll();
            BackupHeader header = repository.write(newBackupId(now), now, trigger, entities);
            lastBackupAt = now;
            metrics.recordBackup(true, System.nanoTime() - start);
            log.info("Created " + trigger + " backup " + header.id() + " with " + header.entityCount()
                    + " entities in " + Duration.ofNanos(System.nanoTime() - start).toMillis() + "ms");
            applyRetention();
            return BackupResult.ok(header);
        } catch (RuntimeException e) {
            metrics.recordBackup(false, 0);
            log.log(Level.WARNING, "Backup failed", e);
            return BackupResult.failed("Data export failed: " + e.getMessage(), categoryOf(e));
        } finally {
            backingUp.set(false);
        }
    }

    /** Newest first. */
    public List<BackupHeader> listBackups() {
        return repository.list();
    }

    /** True if the backup loads and its content matches the recorded checksum. */
    public boolean verify(String backupId) {
        try {
            repository.load(backupId);
            return true;
        } catch (BackupVerificationException e) {
            log.warning("Backup " + backupId + " failed verification: " + e.getMessage());
            return false;
        }
    }

    public Optional<BackupHeader> latestVerifiedBackup() {
        for (BackupHeader h : repository.list()) {
            if (verify(h.id())) {
                return Optional.of(h);
            }
        }
        return Optional.empty();
    }

    /** True if no backup was taken yet or the last one is older than 80% of the interval. */
    public boolean periodicBackupDue(Duration interval) {
        Instant last = lastBackupAt;
        if (last == null) {
            return true;
        }
        return Duration.between(last, clock.instant()).compareTo(interval.multipliedBy(4).dividedBy(5)) >= 0;
    }

    /** Delete backups past the age limit and beyond the count limit. Returns the number deleted. */
    public int applyRetention() {
        Instant cutoff = clock.instant().minus(retention.maxAge());
        List<BackupHeader> all = repository.list();
        int deleted = 0;
        for (int i = 0; i < all.size(); i++) {
            BackupHeader h = all.get(i);
            if ((i >= retention.maxCount() || h.createdAt().isBefore(cutoff)) && repository.delete(h.id())) {
                deleted++;
            }
        }
        if (deleted > 0) {
            metrics.recordDeleted(deleted);
            log.info("Retention removed " + deleted + " backup(s)");
        }
        return deleted;
    }

    // ---------- restore ----------

    public RestoreResult restore(String backupId) {
        Objects.requireNonNull(backupId, "backupId");
        if (!restoring.compareAndSet(false, true)) {
            return RestoreResult.untouched(backupId, "Restore already in progress",
                    ConsistencyException.Category.TRANSIENT);
        }
        try {
            RestoreResult result = doRestore(backupId);
            metrics.recordRestore(result.success());
            return result;
        } finally {
            restoring.set(false);
        }
    }

    private RestoreResult doRestore(String backupId) {
        log.info("Restoring from backup " + backupId);
        StoredBackup target;
        try {
            target = repository.load(backupId);
        } catch (BackupVerificationException e) {
            log.warning("Refusing to restore " + backupId + ": " + e.getMessage());
            return RestoreResult.untouched(backupId, "Backup integrity check failed: " + e.getMessage(),
                    e.category());
        }

        List<Entity> before = store.findAll();
        BackupResult pre = createBackup(BackupTrigger.BEFORE_RESTORE);
        String preId = pre.success() ? pre.backup().id() : null;
        if (!pre.success()) {
            log.warning("Failed to create pre-restore backup, proceeding anyway: " + pre.message());
        }

        TransactionResult applied = replaceContents(target.entities(), "restore " + backupId);
        if (!applied.success()) {
            return new RestoreResult(false, "Data restore failed: " + applied.error(), backupId, preId, false,
                    List.of(), applied.errorCategory());
        }
        List<AppliedChange> journal = new ArrayList<>(applied.appliedChanges());

        IntegrityReport check = monitor.performComprehensiveCheck();
        if (check.criticalIssues().isEmpty()) {
            log.info("Restore of " + backupId + " completed: " + target.entities().size() + " entities");
            return new RestoreResult(true, "Restore completed successfully", backupId, preId, false, journal, null);
        }

        log.warning("Restored data has " + check.criticalIssues().size()
                + " critical issue(s), rolling back");
        metrics.recordRollback();
        TransactionResult reverted = rollbackTo(preId, before);
        if (reverted.success()) {
            journal.addAll(reverted.appliedChanges());
            return new RestoreResult(false, "Restore failed, rolled back to previous state", backupId, preId,
                    true, journal, ConsistencyException.Category.STRUCTURAL);
        }
        log.severe("Rollback after failed restore of " + backupId + " failed: " + reverted.error());
        return new RestoreResult(false, "Restore failed and rollback failed - data may be corrupted", backupId,
                preId, false, journal, ConsistencyException.Category.FATAL);
    }

    private TransactionResult rollbackTo(String preRestoreId, List<Entity> inMemory) {
        List<Entity> state = inMemory;
        if (preRestoreId != null) {
            try {
                state = repository.load(preRestoreId).entities();
            } catch (BackupVerificationException e) {
                log.warning("Pre-restore backup unusable, rolling back from memory: " + e.getMessage());
            }
        }
        return replaceContents(state, "rollback restore");
    }

    // ---------- repair ----------

    /**
     * Automatic repair. Only critical findings lead to a mutation, and only the fixes for
     * critical conditions are applied; warning and info issues are reported untouched.
     */
    public RepairReport detectAndRepairCorruption() {
        IntegrityReport report = monitor.performComprehensiveCheck();
        if (report.issues().isEmpty()) {
            return RepairReport.clean();
        }
        List<IntegrityIssue> critical = report.criticalIssues();
        if (critical.isEmpty()) {
            return RepairReport.notAttempted("Minor issues found but no critical corruption");
        }
        Set<IssueCategory> categories = EnumSet.noneOf(IssueCategory.class);
        for (IntegrityIssue issue : critical) {
            categories.add(issue.category());
        }
        return repair(categories, StoreRepairer.Scope.CRITICAL);
    }

    /**
     * Explicitly requested repair of the given categories, warnings included. Categories
     * the integrity check does not currently report are skipped.
     */
    public RepairReport repairIssues(Set<IssueCategory> requested) {
        Objects.requireNonNull(requested, "requested");
        IntegrityReport report = monitor.performComprehensiveCheck();
        if (report.issues().isEmpty()) {
            return RepairReport.clean();
        }
        Set<IssueCategory> categories = EnumSet.noneOf(IssueCategory.class);
        for (IntegrityIssue issue : report.issues()) {
            if (requested.contains(issue.category())) {
                categories.add(issue.category());
            }
        }
        if (categories.isEmpty()) {
            return RepairReport.notAttempted("None of the requested categories is reported");
        }
        return repair(categories, StoreRepairer.Scope.ALL);
    }

    public BackupMetrics metrics() {
        return metrics;
    }

    // ---------- internals ----------

    private RepairReport repair(Set<IssueCategory> categories, StoreRepairer.Scope scope) {
        List<AppliedChange> journal = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        Map<IssueCategory, Integer> repaired = new LinkedHashMap<>();
        boolean attempted = false;
        boolean ok = true;
        StringBuilder message = new StringBuilder();

        Set<IssueCategory> structural = EnumSet.noneOf(IssueCategory.class);
        structural.addAll(categories);
        structural.retainAll(STRUCTURAL_REPAIRS);
        if (!structural.isEmpty() && !categories.contains(IssueCategory.DATA_CORRUPTION)) {
            StoreRepairer.Plan plan = StoreRepairer.plan(store.findAll(), structural, scope, clock.instant());
            if (plan.total() > 0) {
                attempted = true;
                TransactionResult r = replaceContents(plan.target().values(), "repair " + structural);
                if (r.success()) {
                    journal.addAll(r.appliedChanges());
                    actions.addAll(plan.actions());
                    repaired.putAll(plan.repairs());
                    message.append("Applied ").append(plan.total()).append(" repair(s)");
                } else {
                    ok = false;
                    message.append("Structural repair failed: ").append(r.error());
                }
            }
        }

        String restoredFrom = null;
        if (categories.contains(IssueCategory.DATA_CORRUPTION)) {
            attempted = true;
            Optional<BackupHeader> latest = latestVerifiedBackup();
            if (latest.isEmpty()) {
                ok = false;
                appendSentence(message, "Data corruption found but no verified backup is available");
            } else {
                RestoreResult r = restore(latest.get().id());
                journal.addAll(r.appliedChanges());
                if (r.success()) {
                    restoredFrom = latest.get().id();
                    repaired.merge(IssueCategory.DATA_CORRUPTION, 1, Integer::sum);
                    actions.add("Restored backup " + restoredFrom);
                    appendSentence(message, "Restored backup " + restoredFrom);
                } else {
                    ok = false;
                    appendSentence(message, r.message());
                }
            }
        }

        int total = repaired.values().stream().mapToInt(Integer::intValue).sum();
        metrics.recordRepairs(total);
        if (!attempted) {
            message.append("Issues found but none can be repaired automatically");
        }
        if (total > 0) {
            log.info("Repair applied " + total + " fix(es): " + repaired);
        }
        return new RepairReport(true, attempted, ok, total, repaired, actions, restoredFrom, journal,
                message.toString());
    }

    /** Replace the store with exactly the given entities in one verified transaction. */
    private TransactionResult replaceContents(Collection<Entity> target, String label) {
        Map<UUID, Entity> wanted = new HashMap<>();
        for (Entity e : target) {
            wanted.put(e.id(), e);
        }
        List<Operation> ops = new ArrayList<>();
        Map<UUID, Entity> current = new HashMap<>();
        for (Entity e : store.findAll()) {
            current.put(e.id(), e);
            if (!wanted.containsKey(e.id())) {
                ops.add(new Operation.Delete(e.id()));
            }
        }
        for (Entity e : target) {
            Entity existing = current.get(e.id());
            if (existing == null) {
                ops.add(new Operation.Insert(e));
            } else if (!existing.equals(e)) {
                ops.add(new Operation.Update(e));
            }
        }
        String expected = EntityChecksums.of(target);
        return txManager.builder(TransactionType.READ_WRITE)
                .add(new Operation.Batch(label, ops))
                .verifyWith(s -> EntityChecksums.of(s.findAll()).equals(expected))
                .commit();
    }

    private static String newBackupId(Instant now) {
        return "backup-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static void appendSentence(StringBuilder sb, String text) {
        if (sb.length() > 0) {
            sb.append("; ");
        }
        sb.append(text);
    }

    private static ConsistencyException.Category categoryOf(RuntimeException e) {
        if (e instanceof ConsistencyException ce) {
            return ce.category();
        }
        return ConsistencyException.Category.TRANSIENT;
    }
}
