package io.notelite.server.backup;

import io.notelite.core.ConsistencyException;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.server.integrity.CacheConsistencyValidator;
import io.notelite.server.integrity.EntitySource;
import io.notelite.server.integrity.IntegrityMonitor;
import io.notelite.storage.InMemoryEntityStore;
import io.notelite.storage.backup.BackupHeader;
import io.notelite.storage.backup.BackupTrigger;
import io.notelite.storage.backup.FileBackupRepository;
import io.notelite.storage.tx.TransactionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackupRestoreServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(T0);
    private final AtomicBoolean failSaves = new AtomicBoolean();
    private final InMemoryEntityStore store = new InMemoryEntityStore() {
        @Override
        public void save() {
            if (failSaves.get()) {
                throw new IllegalStateException("disk full");
            }
            super.save();
        }
    };
    private TransactionManager tm;

    @AfterEach
    void close() {
        if (tm != null) {
            tm.close();
        }
    }

    private BackupRestoreService service(BackupRetention retention) {
        return service(retention, store::findAll);
    }

    private BackupRestoreService service(BackupRetention retention, EntitySource source) {
        tm = new TransactionManager(store);
        var monitor = new IntegrityMonitor(source,
                IntegrityMonitor.defaultValidators(new CacheConsistencyValidator(Optional::empty)), clock);
        return new BackupRestoreService(store, tm, new FileBackupRepository(dir), monitor, retention, clock);
    }

    private Entity note(String name) {
        Entity e = Entity.of(UUID.randomUUID(), name, 1_000L, name + " content");
        store.insert(e);
        return e;
    }

    @Test
    void restore_brings_back_the_backed_up_state() {
        var svc = service(BackupRetention.DEFAULT);
        Entity a = note("a");
        note("b");
        String expected = EntityChecksums.of(store.findAll());
        BackupResult backup = svc.createBackup(BackupTrigger.MANUAL);
        assertTrue(backup.success());

        store.delete(a.id());
        note("c");

        RestoreResult r = svc.restore(backup.backup().id());

        assertTrue(r.success(), r.message());
        assertFalse(r.rolledBack());
        assertNotNull(r.preRestoreBackupId());
        assertTrue(r.storeChanged());
        assertEquals(expected, EntityChecksums.of(store.findAll()));
        assertEquals(2, svc.listBackups().size());
    }

    @Test
    void corrupted_backup_is_refused_without_touching_the_store() throws Exception {
        var svc = service(BackupRetention.DEFAULT);
        note("alpha");
        BackupResult backup = svc.createBackup(BackupTrigger.MANUAL);
        Path file = dir.resolve(backup.backup().id() + FileBackupRepository.SUFFIX);
        Files.writeString(file, Files.readString(file, StandardCharsets.UTF_8)
                .replace("alpha content", "alphx content"), StandardCharsets.UTF_8);
        note("beta");
        String before = EntityChecksums.of(store.findAll());

        RestoreResult r = svc.restore(backup.backup().id());

        assertFalse(r.success());
        assertTrue(r.message().startsWith("Backup integrity check failed"));
        assertEquals(ConsistencyException.Category.STRUCTURAL, r.errorCategory());
        assertFalse(r.storeChanged());
        assertNull(r.preRestoreBackupId());
        assertEquals(before, EntityChecksums.of(store.findAll()));
        assertFalse(svc.verify(backup.backup().id()));
        assertEquals(1, svc.listBackups().size());
    }

    @Test
    void restore_that_fails_its_integrity_check_is_rolled_back() {
        var svc = service(BackupRetention.DEFAULT);
        note("a");
        String before = EntityChecksums.of(store.findAll());
        var repo = new FileBackupRepository(dir);
        BackupHeader bad = repo.write("broken", T0, BackupTrigger.MANUAL,
                List.of(Entity.of(UUID.randomUUID(), "empty", 1_000L, "")));

        RestoreResult r = svc.restore(bad.id());

        assertFalse(r.success());
        assertTrue(r.rolledBack());
        assertEquals("Restore failed, rolled back to previous state", r.message());
        assertEquals(ConsistencyException.Category.STRUCTURAL, r.errorCategory());
        assertEquals(before, EntityChecksums.of(store.findAll()));
        assertEquals(1, svc.metrics().snapshot().restoreRollbacks());
    }

    @Test
    void failed_rollback_is_fatal() {
        // saves start failing once the restored state has been checked
        EntitySource source = () -> {
            failSaves.set(true);
            return store.findAll();
        };
        var svc = service(BackupRetention.DEFAULT, source);
        note("a");
        var repo = new FileBackupRepository(dir);
        BackupHeader bad = repo.write("broken", T0, BackupTrigger.MANUAL,
                List.of(Entity.of(UUID.randomUUID(), "empty", 1_000L, "")));

        RestoreResult r = svc.restore(bad.id());

        assertFalse(r.success());
        assertFalse(r.rolledBack());
        assertEquals("Restore failed and rollback failed - data may be corrupted", r.message());
        assertEquals(ConsistencyException.Category.FATAL, r.errorCategory());
    }

    @Test
    void missing_backup_fails_closed() {
        var svc = service(BackupRetention.DEFAULT);
        note("a");

        RestoreResult r = svc.restore("does-not-exist");

        assertFalse(r.success());
        assertFalse(r.storeChanged());
        assertEquals(1, store.count());
    }

    @Test
    void warnings_alone_never_mutate_the_store() {
        var svc = service(BackupRetention.DEFAULT);
        note("same");
        store.insert(Entity.of(UUID.randomUUID(), "same", 2_000L, "same content"));
        store.insert(Entity.of(UUID.randomUUID(), "", 1_000L, "text").withLink(UUID.randomUUID()));
        String before = EntityChecksums.of(store.findAll());

        RepairReport r = svc.detectAndRepairCorruption();

        assertTrue(r.corruptionFound());
        assertFalse(r.repairAttempted());
        assertEquals(0, r.repairsApplied());
        assertTrue(r.appliedChanges().isEmpty());
        assertEquals(before, EntityChecksums.of(store.findAll()));
        assertEquals(3, store.count());
    }

    @Test
    void repair_fixes_only_critical_issues_and_is_idempotent() {
        var svc = service(BackupRetention.DEFAULT);
        Entity keep = note("same");
        Entity dup = Entity.of(UUID.randomUUID(), "same", 2_000L, "same content");
        store.insert(dup);
        Entity orphan = Entity.of(UUID.randomUUID(), "orphan", 1_000L, "");
        store.insert(orphan);
        Entity pointsAtOrphan = Entity.of(UUID.randomUUID(), "p", 1_000L, "p content").withLink(orphan.id());
        store.insert(pointsAtOrphan);
        Entity ancient = Entity.of(UUID.randomUUID(), "ancient", -5L, "ancient content");
        store.insert(ancient);

        RepairReport first = svc.detectAndRepairCorruption();

        assertTrue(first.corruptionFound());
        assertTrue(first.repairSuccessful(), first.message());
        assertEquals(1, first.repairsByCategory().get(IssueCategory.ORPHANED_DATA));
        assertEquals(1, first.repairsByCategory().get(IssueCategory.SCHEMA_VIOLATION));
        assertNull(first.repairsByCategory().get(IssueCategory.DUPLICATE));
        assertFalse(first.appliedChanges().isEmpty());
        assertTrue(store.find(orphan.id()).isEmpty());
        assertFalse(store.find(pointsAtOrphan.id()).orElseThrow().hasLinkTo(orphan.id()));
        assertEquals(T0.toEpochMilli(), store.find(ancient.id()).orElseThrow().createdAtMillis());
        assertTrue(store.find(keep.id()).isPresent());
        assertTrue(store.find(dup.id()).isPresent(), "duplicates are only a warning");

        RepairReport second = svc.detectAndRepairCorruption();

        assertEquals(0, second.repairsApplied());
        assertFalse(second.repairAttempted());
        assertTrue(second.corruptionFound(), "the duplicate warning is still reported");
    }

    @Test
    void requested_repair_also_fixes_warnings() {
        var svc = service(BackupRetention.DEFAULT);
        Entity keep = note("same");
        Entity dup = Entity.of(UUID.randomUUID(), "same", 2_000L, "same content");
        store.insert(dup);
        Entity nameless = Entity.of(UUID.randomUUID(), "", 1_000L, "text").withLink(UUID.randomUUID());
        store.insert(nameless);
        Entity pointsAtDup = Entity.of(UUID.randomUUID(), "p", 1_000L, "p content").withLink(dup.id());
        store.insert(pointsAtDup);
        Set<IssueCategory> requested = EnumSet.of(IssueCategory.DUPLICATE, IssueCategory.MISSING_REFERENCE,
                IssueCategory.INVALID_RELATIONSHIP);

        RepairReport first = svc.repairIssues(requested);

        assertTrue(first.repairSuccessful(), first.message());
        assertEquals(1, first.repairsByCategory().get(IssueCategory.DUPLICATE));
        assertEquals(1, first.repairsByCategory().get(IssueCategory.MISSING_REFERENCE));
        assertEquals(1, first.repairsByCategory().get(IssueCategory.INVALID_RELATIONSHIP));
        assertTrue(store.find(dup.id()).isEmpty());
        assertTrue(store.find(pointsAtDup.id()).orElseThrow().hasLinkTo(keep.id()));
        assertEquals(StoreRepairer.generatedName(nameless.id()), store.find(nameless.id()).orElseThrow().name());
        assertTrue(store.find(nameless.id()).orElseThrow().links().isEmpty());

        RepairReport second = svc.repairIssues(requested);

        assertEquals(0, second.repairsApplied());
        assertFalse(second.corruptionFound());
    }

    @Test
    void data_corruption_is_repaired_from_the_latest_verified_backup() {
        AtomicInteger corruptReads = new AtomicInteger(1);
        EntitySource source = () -> {
            List<Entity> all = new ArrayList<>(store.findAll());
            if (corruptReads.getAndDecrement() > 0) {
                all.add(all.get(0));
            }
            return all;
        };
        var svc = service(BackupRetention.DEFAULT, source);
        note("a");
        BackupResult backup = svc.createBackup(BackupTrigger.MANUAL);

        RepairReport r = svc.detectAndRepairCorruption();

        assertTrue(r.repairSuccessful(), r.message());
        assertEquals(backup.backup().id(), r.restoredFromBackup());
        assertEquals(1, r.repairsByCategory().get(IssueCategory.DATA_CORRUPTION));
    }

    @Test
    void data_corruption_without_backup_reports_failure() {
        EntitySource source = () -> {
            throw new IllegalStateException("unreadable");
        };
        var svc = service(BackupRetention.DEFAULT, source);

        RepairReport r = svc.detectAndRepairCorruption();

        assertTrue(r.corruptionFound());
        assertTrue(r.repairAttempted());
        assertFalse(r.repairSuccessful());
        assertNull(r.restoredFromBackup());
    }

    @Test
    void retention_keeps_the_newest_backups_within_count_and_age() {
        var svc = service(new BackupRetention(Duration.ofDays(30), 2));
        note("a");
        svc.createBackup(BackupTrigger.MANUAL);
        clock.advance(Duration.ofMinutes(1));
        svc.createBackup(BackupTrigger.MANUAL);
        clock.advance(Duration.ofMinutes(1));
        BackupResult newest = svc.createBackup(BackupTrigger.MANUAL);

        assertEquals(2, svc.listBackups().size());
        assertEquals(newest.backup().id(), svc.listBackups().get(0).id());

        clock.advance(Duration.ofDays(31));
        BackupResult fresh = svc.createBackup(BackupTrigger.PERIODIC);

        assertEquals(List.of(fresh.backup().id()), svc.listBackups().stream().map(BackupHeader::id).toList());
        assertEquals(3, svc.metrics().snapshot().backupsDeleted());
    }

    @Test
    void periodic_backup_is_due_at_eighty_percent_of_the_interval() {
        var svc = service(BackupRetention.DEFAULT);
        Duration interval = Duration.ofHours(6);
        assertTrue(svc.periodicBackupDue(interval));

        svc.createBackup(BackupTrigger.PERIODIC);
        assertFalse(svc.periodicBackupDue(interval));

        clock.advance(Duration.ofMinutes(287));
        assertFalse(svc.periodicBackupDue(interval));
        clock.advance(Duration.ofMinutes(1));
        assertTrue(svc.periodicBackupDue(interval));
    }

    @Test
    void latest_verified_backup_skips_corrupted_files() throws Exception {
        var svc = service(BackupRetention.DEFAULT);
        note("alpha");
        BackupResult older = svc.createBackup(BackupTrigger.MANUAL);
        clock.advance(Duration.ofMinutes(1));
        BackupResult newer = svc.createBackup(BackupTrigger.MANUAL);
        Path file = dir.resolve(newer.backup().id() + FileBackupRepository.SUFFIX);
        Files.writeString(file, Files.readString(file, StandardCharsets.UTF_8)
                .replace("alpha content", "alphx content"), StandardCharsets.UTF_8);

        assertEquals(older.backup().id(), svc.latestVerifiedBackup().orElseThrow().id());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
