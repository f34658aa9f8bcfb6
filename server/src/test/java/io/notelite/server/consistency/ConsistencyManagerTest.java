package io.notelite.server.consistency;

import io.notelite.core.ChangeKind;
import io.notelite.core.ChangeRecord;
import io.notelite.core.ChangeType;
import io.notelite.core.DataVersion;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.core.conflict.ConflictType;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.server.backup.BackupRestoreService;
import io.notelite.server.backup.BackupResult;
import io.notelite.server.backup.BackupRetention;
import io.notelite.server.backup.RepairReport;
import io.notelite.server.backup.RestoreResult;
import io.notelite.server.conflict.ConflictResolutionEngine;
import io.notelite.server.integrity.CacheConsistencyValidator;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.server.integrity.IntegrityReport;
import io.notelite.storage.InMemoryEntityStore;
import io.notelite.storage.backup.BackupHeader;
import io.notelite.storage.backup.BackupTrigger;
import io.notelite.storage.backup.FileBackupRepository;
import io.notelite.storage.history.HistoryLimits;
import io.notelite.storage.history.NavigationResult;
import io.notelite.storage.history.SnapshotPolicy;
import io.notelite.storage.history.VersionHistory;
import io.notelite.storage.history.VersionLog;
import io.notelite.storage.history.VersionPersistencePolicy;
import io.notelite.storage.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyManagerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    Path dir;

    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private final InMemoryEntityStore store = new InMemoryEntityStore();
    private TransactionManager tm;
    private VersionHistory history;
    private BackupRestoreService backups;
    private ChangeNotifier notifier;
    private SingleOwnerExecutor owner;
    private ConsistencyManager manager;
    private VersionLog versionLog;

    /** Wires the components the way the server does. Seed entities become the baseline. */
    private ConsistencyManager start(Entity... seed) {
        for (Entity e : seed) {
            store.insert(e);
        }
        owner = new SingleOwnerExecutor("consistency-test");
        tm = new TransactionManager(store, 10, Duration.ofSeconds(30), clock);
        history = new VersionHistory(store, tm, HistoryLimits.DEFAULT, new SnapshotPolicy(10), versionLog, clock);
        var engine = new ConflictResolutionEngine(store, history::sequenceOf,
                Duration.ofSeconds(5), Duration.ofSeconds(60), 100, clock);
        var monitor = new IntegrityMonitor(() -> owner.call(store::findAll).join(),
                IntegrityMonitor.defaultValidators(
                        new CacheConsistencyValidator(() -> history.current().map(DataVersion::checksum))),
                clock);
        backups = new BackupRestoreService(store, tm, new FileBackupRepository(dir), monitor,
                BackupRetention.DEFAULT, clock);
        notifier = new ChangeNotifier();
        manager = new ConsistencyManager(tm, history, engine, monitor, backups, notifier, owner, 10, clock);
        manager.initialize().join();
        return manager;
    }

    @AfterEach
    void close() {
        if (owner != null) {
            owner.close();
            notifier.close();
            tm.close();
        }
    }

    private static Entity note(String name) {
        return Entity.of(UUID.randomUUID(), name, 1_000L, "content of " + name);
    }

    private String storeChecksum() {
        return EntityChecksums.of(store.findAll());
    }

    @Test
    void accepted_change_is_applied_and_versioned() {
        var m = start();
        Entity n = note("first");

        ConsistencyResult r = m.submit(ChangeRecord.user(new ChangeKind.EntityCreated(n), T0)).join();

        assertEquals(ConsistencyStatus.APPLIED, r.status(), r.error());
        assertTrue(r.conflicts().isEmpty());
        assertNull(r.resolution());
        assertEquals(ChangeType.ENTITY_CREATED, r.version().changeType());
        assertEquals(n, store.find(n.id()).orElseThrow());
        assertEquals(storeChecksum(), r.version().checksum());
        assertTrue(m.canUndo().join());
        assertEquals(1, m.metrics().snapshot().changesApplied());
    }

    @Test
    void analyzer_edit_after_user_edit_is_rejected() {
        Entity n = note("n");
        var m = start(n);
        ConsistencyResult user = m.submit(ChangeRecord.user(
                new ChangeKind.EntityModified(n.id(), null, "typed by user"), T0)).join();
        assertTrue(user.applied());

        ConsistencyResult analyzer = m.submit(ChangeRecord.derived(
                new ChangeKind.EntityModified(n.id(), null, "proposed by analyzer"), T0.plusSeconds(2))).join();

        assertEquals(ConsistencyStatus.REJECTED, analyzer.status());
        assertEquals(ConflictType.USER_VS_DERIVED, analyzer.conflicts().get(0).type());
        assertNull(analyzer.version());
        assertEquals("typed by user", store.find(n.id()).orElseThrow().content());
        var s = m.metrics().snapshot();
        assertEquals(1, s.changesRejected());
        assertEquals(1, s.conflictsDetected());
    }

    @Test
    void link_closing_a_cycle_needs_manual_intervention() {
        Entity a = note("a");
        Entity b = note("b");
        var m = start(a.withLink(b.id()), b);
        String before = storeChecksum();
        int versions = history.size();

        ConsistencyResult r = m.submit(ChangeRecord.user(new ChangeKind.LinkAdded(b.id(), a.id()), T0)).join();

        assertEquals(ConsistencyStatus.MANUAL_INTERVENTION_REQUIRED, r.status());
        assertTrue(r.error().contains("closes a cycle"), r.error());
        assertFalse(r.resolution().success());
        assertEquals(before, storeChecksum());
        assertEquals(versions, history.size());
    }

    @Test
    void delete_removes_incoming_links_and_takes_a_backup_first() {
        Entity b = note("b");
        Entity a = note("a").withLink(b.id());
        var m = start(a, b);

        ConsistencyResult r = m.submit(ChangeRecord.user(new ChangeKind.EntityDeleted(b.id()), T0)).join();

        assertEquals(ConsistencyStatus.APPLIED, r.status(), r.error());
        assertEquals(ConflictType.INTEGRITY_VIOLATION, r.conflicts().get(0).type());
        assertEquals(ChangeType.ENTITY_DELETED, r.version().changeType());
        assertTrue(store.find(b.id()).isEmpty());
        assertFalse(store.find(a.id()).orElseThrow().hasLinkTo(b.id()));

        List<BackupHeader> list = backups.listBackups();
        assertEquals(1, list.size());
        assertEquals(BackupTrigger.AUTOMATIC, list.get(0).trigger());
        assertEquals(2, list.get(0).entityCount());
    }

    @Test
    void only_large_imports_trigger_an_automatic_backup() {
        var m = start();
        List<Entity> small = List.of(note("s1"), note("s2"));
        assertTrue(m.submit(ChangeRecord.user(new ChangeKind.BulkImport(small), T0)).join().applied());
        assertTrue(backups.listBackups().isEmpty());

        List<Entity> large = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            large.add(note("bulk-" + i));
        }
        ConsistencyResult r = m.submit(ChangeRecord.user(new ChangeKind.BulkImport(large), T0)).join();

        assertTrue(r.applied(), r.error());
        assertEquals(13, store.findAll().size());
        assertEquals(1, backups.listBackups().size());
    }

    @Test
    void disjoint_edits_close_together_are_merged() {
        Entity n = note("n");
        var m = start(n);
        assertTrue(m.submit(ChangeRecord.user(new ChangeKind.AnnotationChanged(n.id(), "remember"), T0))
                .join().applied());

        ConsistencyResult r = m.submit(ChangeRecord.user(
                new ChangeKind.DerivedAnalysisUpdated(n.id(), null, List.of("todo")), T0.plusSeconds(1))).join();

        assertEquals(ConsistencyStatus.APPLIED, r.status(), r.error());
        assertEquals(ChangeType.MERGED_EDIT, r.version().changeType());
        Entity merged = store.find(n.id()).orElseThrow();
        assertEquals("remember", merged.annotation());
        assertEquals(List.of("todo"), merged.tags());
    }

    @Test
    void undo_and_redo_move_the_store_through_versions() {
        Entity n = note("n");
        var m = start(n);
        String original = storeChecksum();
        assertTrue(m.submit(ChangeRecord.user(new ChangeKind.EntityModified(n.id(), "renamed", null), T0))
                .join().applied());
        String edited = storeChecksum();

        NavigationResult undo = m.undo().join();
        assertTrue(undo.success(), undo.error());
        assertEquals(original, storeChecksum());
        assertTrue(m.canRedo().join());

        NavigationResult redo = m.redo().join();
        assertTrue(redo.success(), redo.error());
        assertEquals(edited, storeChecksum());
        assertFalse(m.canRedo().join());

        var s = m.metrics().snapshot();
        assertEquals(1, s.undos());
        assertEquals(1, s.redos());
    }

    @Test
    void undo_is_refused_at_the_baseline() {
        var m = start(note("n"));

        NavigationResult r = m.undo().join();

        assertFalse(r.success());
        assertEquals(0, m.metrics().snapshot().undos());
    }

    @Test
    void batch_becomes_a_single_version() {
        var m = start();
        Entity a = note("a");
        Entity b = note("b");
        int versions = history.size();

        ConsistencyResult r = m.submitAll(List.of(
                ChangeRecord.user(new ChangeKind.EntityCreated(a), T0),
                ChangeRecord.user(new ChangeKind.EntityCreated(b), T0),
                ChangeRecord.user(new ChangeKind.LinkAdded(a.id(), b.id()), T0))).join();

        assertEquals(ConsistencyStatus.APPLIED, r.status(), r.error());
        assertEquals(versions + 1, history.size());
        assertTrue(store.find(a.id()).orElseThrow().hasLinkTo(b.id()));

        assertTrue(m.undo().join().success());
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void failed_apply_leaves_store_unchanged() {
        Entity a = note("a");
        var m = start(a);
        String before = storeChecksum();
        // the second member edits an entity the first one deletes
        ConsistencyResult r = m.submitAll(List.of(
                ChangeRecord.user(new ChangeKind.EntityDeleted(a.id()), T0.minusSeconds(30)),
                ChangeRecord.system(new ChangeKind.EntityModified(a.id(), "late", null), T0))).join();

        assertEquals(ConsistencyStatus.FAILED, r.status());
        assertNotNull(r.error());
        assertEquals(before, storeChecksum());
        assertEquals(1, m.metrics().snapshot().changesFailed());
    }

    @Test
    void history_log_write_failure_does_not_fail_an_applied_change() throws Exception {
        Path logDir = Files.createDirectories(dir.resolve("history"));
        versionLog = new VersionLog(logDir.resolve("history.json"), VersionPersistencePolicy.METADATA_ONLY);
        Entity n = note("n");
        var m = start(n);
        Files.createDirectories(logDir.resolve("history.json.tmp"));

        ConsistencyResult r = m.submit(ChangeRecord.user(
                new ChangeKind.EntityModified(n.id(), null, "new"), T0)).join();

        assertEquals(ConsistencyStatus.APPLIED, r.status(), r.error());
        assertEquals("new", store.find(n.id()).orElseThrow().content());
        assertEquals(2, history.size());
        assertEquals(1, history.metrics().snapshot().logWriteFailures());

        // the change is in the recent window, so a later analyzer edit still defers to it
        ConsistencyResult late = m.submit(ChangeRecord.derived(
                new ChangeKind.EntityModified(n.id(), null, "analyzer"), T0.plusSeconds(2))).join();
        assertEquals(ConsistencyStatus.REJECTED, late.status());
    }

    @Test
    void collaborators_hear_about_changes_they_care_about() throws Exception {
        Entity n = note("n");
        var m = start(n);
        CountDownLatch latch = new CountDownLatch(1);
        List<ChangeEvent> search = new CopyOnWriteArrayList<>();
        List<ChangeEvent> graph = new CopyOnWriteArrayList<>();
        notifier.register(CollaboratorCategory.ANNOTATION_SEARCH, e -> {
            search.add(e);
            latch.countDown();
        });
        notifier.register(CollaboratorCategory.RELATIONSHIP_GRAPH, graph::add);
        notifier.register(CollaboratorCategory.CONTENT_PREVIEW, e -> {
            throw new IllegalStateException("preview renderer crashed");
        });

        ConsistencyResult r = m.submit(ChangeRecord.user(new ChangeKind.AnnotationChanged(n.id(), "note"), T0)).join();
        assertTrue(r.applied());
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        notifier.close();

        assertEquals(1, search.size());
        assertEquals(r.version().versionId(), search.get(0).versionId());
        assertEquals(ChangeType.ANNOTATION_CHANGED, search.get(0).changeType());
        assertTrue(search.get(0).affectedIds().contains(n.id()));
        assertTrue(graph.isEmpty());
        assertEquals(0, notifier.failureCount());
    }

    @Test
    void restore_is_recorded_as_a_system_version() {
        Entity n = note("n");
        var m = start(n);
        String backedUp = storeChecksum();
        BackupResult backup = m.createBackup(BackupTrigger.MANUAL).join();
        assertTrue(backup.success(), backup.message());
        assertTrue(m.submit(ChangeRecord.user(new ChangeKind.EntityCreated(note("later")), T0)).join().applied());

        RestoreResult r = m.restore(backup.backup().id()).join();

        assertTrue(r.success(), r.message());
        assertEquals(backedUp, storeChecksum());
        DataVersion current = history.current().orElseThrow();
        assertEquals(ChangeType.SYSTEM, current.changeType());
        assertEquals(storeChecksum(), current.checksum());
        assertTrue(m.canUndo().join());
        assertEquals(1, m.metrics().snapshot().restores());
    }

    @Test
    void integrity_check_repairs_critical_findings() {
        Entity good = note("good");
        var m = start(good);
        // written behind the manager's back
        Entity orphan = Entity.of(UUID.randomUUID(), "orphan", 1_000L, "");
        store.insert(orphan);

        IntegrityReport report = m.performIntegrityCheck().join();

        assertFalse(report.success());
        assertTrue(store.find(orphan.id()).isEmpty());
        assertTrue(store.find(good.id()).isPresent());
        DataVersion current = history.current().orElseThrow();
        assertEquals(ChangeType.SYSTEM, current.changeType());
        assertEquals(storeChecksum(), current.checksum());
        var s = m.metrics().snapshot();
        assertEquals(1, s.integrityChecks());
        assertEquals(1, s.repairs());
    }

    @Test
    void duplicates_are_removed_only_on_request() {
        Entity first = note("twin");
        Entity second = Entity.of(UUID.randomUUID(), "twin", 2_000L, first.content());
        var m = start(first, second);
        int versions = history.size();

        IntegrityReport report = m.performIntegrityCheck().join();

        assertTrue(report.success());
        assertEquals(2, store.count());
        assertEquals(versions, history.size());
        assertEquals(0, m.metrics().snapshot().repairs());

        RepairReport repair = m.repairIssues(EnumSet.of(IssueCategory.DUPLICATE)).join();

        assertEquals(1, repair.repairsApplied());
        assertTrue(store.find(first.id()).isPresent());
        assertTrue(store.find(second.id()).isEmpty());
        DataVersion current = history.current().orElseThrow();
        assertEquals(ChangeType.SYSTEM, current.changeType());
        assertEquals(storeChecksum(), current.checksum());
    }

    @Test
    void history_lists_newest_first() {
        Entity n = note("n");
        var m = start(n);
        m.submit(ChangeRecord.user(new ChangeKind.AnnotationChanged(n.id(), "one"), T0)).join();

        var summaries = m.history(10).join();

        assertEquals(2, summaries.size());
        assertEquals(ChangeType.ANNOTATION_CHANGED, summaries.get(0).changeType());
        assertTrue(summaries.get(0).current());
    }

    @Test
    void periodic_backup_runs_once_per_interval() {
        var m = start(note("a"));

        m.backupIfDue(Duration.ofHours(6)).join();
        m.backupIfDue(Duration.ofHours(6)).join();

        List<BackupHeader> list = m.listBackups().join();
        assertEquals(1, list.size());
        assertEquals(BackupTrigger.PERIODIC, list.get(0).trigger());
    }

    @Test
    void empty_batch_is_rejected() {
        var m = start();
        assertThrows(IllegalArgumentException.class, () -> m.submitAll(List.of()));
    }
}
