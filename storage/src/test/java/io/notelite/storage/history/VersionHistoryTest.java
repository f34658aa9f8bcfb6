package io.notelite.storage.history;

import io.notelite.core.ChangeKind;
import io.notelite.core.ChangeRecord;
import io.notelite.core.DataVersion;
import io.notelite.core.Entity;
import io.notelite.core.EntityChecksums;
import io.notelite.storage.InMemoryEntityStore;
import io.notelite.storage.tx.TransactionManager;
import io.notelite.storage.tx.TransactionResult;
import io.notelite.storage.tx.TransactionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class VersionHistoryTest {

    private final List<TransactionManager> managers = new ArrayList<>();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    @AfterEach
    void closeManagers() {
        managers.forEach(TransactionManager::close);
    }

    private TransactionManager tm(InMemoryEntityStore store) {
        var m = new TransactionManager(store, 10, Duration.ofSeconds(30), clock);
        managers.add(m);
        return m;
    }

    private VersionHistory history(InMemoryEntityStore store, TransactionManager tm, HistoryLimits limits,
                                   int snapshotEvery, VersionLog log) {
        var h = new VersionHistory(store, tm, limits, new SnapshotPolicy(snapshotEvery), log, clock);
        h.initialize();
        return h;
    }

    private static String checksum(InMemoryEntityStore store) {
        return EntityChecksums.of(store.findAll());
    }

    /** Insert a fresh note through a transaction and record it. */
    private static Entity create(TransactionManager tm, VersionHistory h, String name) {
        Entity e = Entity.of(UUID.randomUUID(), name, 1_000L, "body of " + name);
        TransactionResult r = tm.builder(TransactionType.READ_WRITE).insert(e).commit();
        assertTrue(r.success(), r.error());
        h.record(ChangeRecord.user(new ChangeKind.EntityCreated(e), Instant.now()), r.appliedChanges());
        return e;
    }

    private static void annotate(TransactionManager tm, VersionHistory h, InMemoryEntityStore store, UUID id, String text) {
        Entity updated = store.find(id).orElseThrow().withAnnotation(text);
        TransactionResult r = tm.builder(TransactionType.READ_WRITE).update(updated).commit();
        assertTrue(r.success(), r.error());
        h.record(ChangeRecord.user(new ChangeKind.AnnotationChanged(id, text), Instant.now()), r.appliedChanges());
    }

    @Test
    void undo_then_redo_round_trips_checksums_at_every_step() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 4, null);

        List<String> checksums = new ArrayList<>();
        checksums.add(checksum(store));
        List<Entity> notes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            if (i % 3 == 2) {
                annotate(tm, h, store, notes.get(notes.size() - 1).id(), "note " + i);
            } else {
                notes.add(create(tm, h, "n" + i));
            }
            checksums.add(checksum(store));
            assertEquals(checksum(store), h.current().orElseThrow().checksum(), "cursor checksum tracks the store");
        }

        for (int i = 11; i >= 0; i--) {
            assertTrue(h.undo().success());
            assertEquals(checksums.get(i), checksum(store), "undo to step " + i);
        }
        assertFalse(h.canUndo());
        for (int i = 1; i <= 12; i++) {
            assertTrue(h.redo().success());
            assertEquals(checksums.get(i), checksum(store), "redo to step " + i);
        }
        assertFalse(h.canRedo());
    }

    @Test
    void replaying_from_baseline_matches_the_live_store() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10, null);
        for (int i = 0; i < 7; i++) {
            create(tm, h, "n" + i);
        }

        Map<UUID, Entity> live = new HashMap<>();
        store.findAll().forEach(e -> live.put(e.id(), e));
        assertEquals(live, h.materialize(h.current().orElseThrow().versionId()));
    }

    @Test
    void new_change_after_undo_discards_redo_branch() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10, null);
        create(tm, h, "a");
        create(tm, h, "b");
        assertTrue(h.undo().success());
        assertTrue(h.canRedo());

        create(tm, h, "c");

        assertFalse(h.canRedo(), "redo branch is gone");
        assertEquals(3, h.size(), "baseline, a, c");
    }

    @Test
    void failed_undo_leaves_cursor_and_store_alone() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10, null);
        Entity a = create(tm, h, "a");
        DataVersion before = h.current().orElseThrow();

        // out-of-band edit: the inverse delete of `a` now fails
        store.delete(a.id());
        String drifted = checksum(store);

        NavigationResult r = h.undo();

        assertFalse(r.success());
        assertNotNull(r.error());
        assertEquals(before.versionId(), h.current().orElseThrow().versionId());
        assertEquals(drifted, checksum(store));
        assertEquals(1, h.metrics().snapshot().navigationFailures());
    }

    @Test
    void undo_from_a_stale_version_is_refused() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10, null);
        create(tm, h, "a");
        String seen = h.current().orElseThrow().versionId();
        create(tm, h, "b");

        NavigationResult r = h.undo(seen);

        assertFalse(r.success());
        assertEquals(3, h.size());
        assertFalse(h.canRedo());
    }

    @Test
    void jump_applies_an_arbitrary_version() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 3, null);
        create(tm, h, "a");
        DataVersion target = h.current().orElseThrow();
        for (int i = 0; i < 5; i++) {
            create(tm, h, "later" + i);
        }

        NavigationResult r = h.jumpToVersion(target.versionId());

        assertTrue(r.success(), r.error());
        assertEquals(target.checksum(), checksum(store));
        assertEquals(1, store.count());
        assertTrue(h.canRedo());
        assertFalse(h.jumpToVersion("no-such-version").success());
    }

    @Test
    void count_ceiling_evicts_oldest_and_keeps_history_replayable() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, new HistoryLimits(5, 10L * 1024 * 1024), 100, null);
        List<String> checksums = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            create(tm, h, "n" + i);
            checksums.add(checksum(store));
        }

        assertEquals(5, h.size());
        assertEquals(5, h.metrics().snapshot().versionsEvicted());
        List<VersionSummary> summaries = h.getHistory(10);
        assertTrue(summaries.get(summaries.size() - 1).snapshot(), "oldest retained version is rebased into a snapshot");

        for (int i = 0; i < 4; i++) {
            assertTrue(h.undo().success());
            assertEquals(checksums.get(7 - i), checksum(store));
        }
        assertFalse(h.canUndo());
    }

    @Test
    void byte_budget_compacts_snapshots_and_stays_under_the_ceiling() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        long budget = 12_000;
        var h = history(store, tm, new HistoryLimits(100, budget), 1, null);
        String body = "x".repeat(200);
        for (int i = 0; i < 10; i++) {
            Entity e = Entity.of(UUID.randomUUID(), "n" + i, 1_000L, body);
            TransactionResult r = tm.builder(TransactionType.READ_WRITE).insert(e).commit();
            h.record(ChangeRecord.user(new ChangeKind.EntityCreated(e), Instant.now()), r.appliedChanges());
        }

        assertTrue(h.totalBytes() <= budget, "history bytes " + h.totalBytes() + " exceed " + budget);
        assertTrue(h.metrics().snapshot().versionsCompacted() > 0);

        int undos = 0;
        while (h.canUndo()) {
            assertTrue(h.undo().success());
            undos++;
            assertEquals(h.current().orElseThrow().checksum(), checksum(store));
        }
        assertTrue(undos > 0);
    }

    @Test
    void metadata_only_log_lists_previous_session_without_replay(@TempDir Path dir) {
        Path file = dir.resolve("history.json");
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var first = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.METADATA_ONLY));
        create(tm, first, "a");
        create(tm, first, "b");
        assertTrue(Files.exists(file));

        var second = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.METADATA_ONLY));

        List<VersionSummary> listed = second.getHistory(50);
        assertEquals(4, listed.size(), "new baseline plus three archived entries");
        assertTrue(listed.get(0).replayable());
        assertTrue(listed.get(0).current());
        assertTrue(listed.subList(1, 4).stream().noneMatch(VersionSummary::replayable));
        assertFalse(second.canUndo(), "undo is scoped to one session");
        assertTrue(listed.get(0).sequence() > listed.get(1).sequence(), "sequences keep growing across sessions");
    }

    @Test
    void full_payload_log_restores_navigable_history(@TempDir Path dir) {
        Path file = dir.resolve("history.json");
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var first = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.FULL_PAYLOAD));
        String empty = checksum(store);
        Entity a = create(tm, first, "a");
        annotate(tm, first, store, a.id(), "remember me");
        String cursorId = first.current().orElseThrow().versionId();

        var second = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.FULL_PAYLOAD));

        assertEquals(cursorId, second.current().orElseThrow().versionId());
        assertTrue(second.undo().success());
        assertEquals("", store.find(a.id()).orElseThrow().annotation());
        assertTrue(second.undo().success());
        assertEquals(empty, checksum(store));
    }

    @Test
    void unwritable_log_keeps_the_version_in_memory(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("history.json");
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.METADATA_ONLY));
        // a directory where the temp file should go makes every write fail
        Files.createDirectories(dir.resolve("history.json.tmp"));

        Entity a = create(tm, h, "a");

        assertEquals(2, h.size());
        assertEquals(checksum(store), h.current().orElseThrow().checksum());
        assertTrue(store.find(a.id()).isPresent());
        assertEquals(1, h.metrics().snapshot().logWriteFailures());
        assertTrue(h.undo().success());
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void full_payload_log_is_ignored_when_the_store_drifted(@TempDir Path dir) {
        Path file = dir.resolve("history.json");
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var first = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.FULL_PAYLOAD));
        create(tm, first, "a");

        store.insert(Entity.of(UUID.randomUUID(), "edited elsewhere", 5L, "x"));
        var second = history(store, tm, HistoryLimits.DEFAULT, 10,
                new VersionLog(file, VersionPersistencePolicy.FULL_PAYLOAD));

        assertFalse(second.canUndo());
        assertEquals(checksum(store), second.current().orElseThrow().checksum());
        assertEquals(3, second.getHistory(10).size(), "old entries are still listed");
    }

    @Test
    void clear_old_history_never_drops_the_current_version() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10, null);
        create(tm, h, "old");
        clock.advance(Duration.ofDays(2));
        create(tm, h, "recent");

        int removed = h.clearOldHistory(clock.instant().minus(Duration.ofDays(1)));

        assertEquals(2, removed, "baseline and the first change are older than a day");
        assertEquals(1, h.size());
        assertEquals(checksum(store), h.current().orElseThrow().checksum());
        assertTrue(h.current().orElseThrow().isSnapshot());
    }

    @Test
    void sequence_lookup_and_versions_after() {
        var store = new InMemoryEntityStore();
        var tm = tm(store);
        var h = history(store, tm, HistoryLimits.DEFAULT, 10, null);
        String baseline = h.current().orElseThrow().versionId();
        create(tm, h, "a");
        create(tm, h, "b");

        assertEquals(0L, h.sequenceOf(baseline).orElseThrow());
        assertEquals(2, h.versionsAfter(baseline).size());
        assertTrue(h.sequenceOf("unknown").isEmpty());
        assertTrue(h.versionsAfter("unknown").isEmpty());
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
