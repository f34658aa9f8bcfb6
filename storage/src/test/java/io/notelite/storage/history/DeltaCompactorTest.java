package io.notelite.storage.history;

import io.notelite.core.DeltaOperation;
import io.notelite.core.Entity;
import io.notelite.core.VersionPayload;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeltaCompactorTest {

    private static Entity note(String name) {
        return Entity.of(UUID.randomUUID(), name, 1_000L, "body " + name);
    }

    private static Map<UUID, Entity> replay(Map<UUID, Entity> start, List<DeltaOperation> ops) {
        Map<UUID, Entity> state = new HashMap<>(start);
        ops.forEach(op -> op.applyTo(state));
        return state;
    }

    @Test
    void create_then_updates_fold_into_one_create() {
        Entity a = note("a");
        Entity a2 = a.withAnnotation("one");
        Entity a3 = a2.withAnnotation("two");
        List<DeltaOperation> ops = List.of(
                new DeltaOperation.Create(a),
                new DeltaOperation.Update(a, a2),
                new DeltaOperation.Update(a2, a3));

        List<DeltaOperation> folded = DeltaCompactor.coalesce(ops);

        assertEquals(List.of(new DeltaOperation.Create(a3)), folded);
    }

    @Test
    void create_then_delete_disappears() {
        Entity a = note("a");
        assertTrue(DeltaCompactor.coalesce(List.of(
                new DeltaOperation.Create(a),
                new DeltaOperation.Delete(a))).isEmpty());
    }

    @Test
    void identity_update_is_dropped() {
        Entity a = note("a");
        Entity edited = a.withName("tmp");
        assertTrue(DeltaCompactor.coalesce(List.of(
                new DeltaOperation.Update(a, edited),
                new DeltaOperation.Update(edited, a))).isEmpty());
    }

    @Test
    void single_link_retarget_becomes_move() {
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        Entity a = note("a").withLink(b);
        Entity moved = a.withLinkRetargeted(b, c);

        List<DeltaOperation> folded = DeltaCompactor.coalesce(List.of(new DeltaOperation.Update(a, moved)));

        assertEquals(List.of(new DeltaOperation.Move(a.id(), b, c)), folded);
        assertEquals(moved, replay(Map.of(a.id(), a), folded).get(a.id()));
    }

    @Test
    void coalesced_delta_replays_and_reverses_like_the_original() {
        Entity a = note("a");
        Entity b = note("b");
        Entity b2 = b.withContent("changed");
        Entity c = note("c");
        List<DeltaOperation> ops = List.of(
                new DeltaOperation.Update(b, b2),
                new DeltaOperation.Create(c),
                new DeltaOperation.Delete(a),
                new DeltaOperation.Update(b2, b2.withLink(c.id())));
        Map<UUID, Entity> start = Map.of(a.id(), a, b.id(), b);

        List<DeltaOperation> folded = DeltaCompactor.coalesce(ops);
        Map<UUID, Entity> end = replay(start, ops);

        assertEquals(3, folded.size());
        assertEquals(end, replay(start, folded));
        assertEquals(start, replay(end, new VersionPayload.Delta(folded).inverseOperations()));
    }

    @Test
    void diff_maps_one_state_onto_another() {
        Entity a = note("a");
        Entity b = note("b");
        Entity c = note("c");
        Map<UUID, Entity> from = Map.of(a.id(), a, b.id(), b);
        Map<UUID, Entity> to = Map.of(b.id(), b.withName("renamed"), c.id(), c);

        List<DeltaOperation> ops = DeltaCompactor.diff(from, to);

        assertEquals(3, ops.size(), "delete a, update b, create c");
        assertEquals(to, replay(from, ops));
    }
}
