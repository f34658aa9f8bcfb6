package io.notelite.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeltaOperationTest {

    private static final UUID A = UUID.randomUUID();
    private static final UUID B = UUID.randomUUID();
    private static final UUID C = UUID.randomUUID();

    @Test
    void delta_followed_by_its_inverse_restores_state() {
        Entity a = Entity.of(A, "a", 1L, "alpha").withLink(B);
        Entity b = Entity.of(B, "b", 2L, "beta");
        Map<UUID, Entity> state = new HashMap<>(Map.of(A, a, B, b));
        String before = EntityChecksums.of(state.values());

        Entity c = Entity.of(C, "c", 3L, "gamma");
        var delta = new VersionPayload.Delta(List.of(
                new DeltaOperation.Create(c),
                new DeltaOperation.Update(b, b.withAnnotation("edited")),
                new DeltaOperation.Move(A, B, C),
                new DeltaOperation.Delete(b.withAnnotation("edited"))
        ));

        delta.operations().forEach(op -> op.applyTo(state));
        assertFalse(state.containsKey(B));
        assertTrue(state.get(A).hasLinkTo(C));

        delta.inverseOperations().forEach(op -> op.applyTo(state));
        assertEquals(before, EntityChecksums.of(state.values()), "Inverse must restore the original state");
    }

    @Test
    void move_of_missing_link_is_rejected() {
        Map<UUID, Entity> state = new HashMap<>(Map.of(A, Entity.of(A, "a", 1L, "alpha")));
        var move = new DeltaOperation.Move(A, B, C);
        assertThrows(IllegalStateException.class, () -> move.applyTo(state));
    }

    @Test
    void update_cannot_change_identity() {
        Entity a = Entity.of(A, "a", 1L, "alpha");
        assertThrows(IllegalArgumentException.class,
                () -> new DeltaOperation.Update(a, a.withId(B)));
    }
}
