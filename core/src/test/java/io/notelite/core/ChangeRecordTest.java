package io.notelite.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ChangeRecordTest {

    @Test
    void partial_updates_must_carry_a_value() {
        UUID id = UUID.randomUUID();
        assertThrows(IllegalArgumentException.class, () -> new ChangeKind.EntityModified(id, null, null));
        assertThrows(IllegalArgumentException.class, () -> new ChangeKind.DerivedAnalysisUpdated(id, null, null));
    }

    @Test
    void touched_fields_follow_present_values() {
        UUID id = UUID.randomUUID();
        var derived = new ChangeKind.DerivedAnalysisUpdated(id, null, List.of("receipt"));
        assertEquals(EnumSet.of(EntityField.TAGS), derived.touchedFields());

        var modified = new ChangeKind.EntityModified(id, "renamed", null);
        assertEquals(EnumSet.of(EntityField.NAME), modified.touchedFields());
    }

    @Test
    void link_changes_affect_both_endpoints() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        var change = ChangeRecord.user(new ChangeKind.LinkAdded(a, b), Instant.now());
        assertEquals(Set.of(a, b), change.affectedIds());
        assertTrue(change.overlaps(ChangeRecord.derived(new ChangeKind.AnnotationChanged(b, "x"), Instant.now())));
    }

    @Test
    void origin_sets_default_confidence() {
        UUID id = UUID.randomUUID();
        var user = ChangeRecord.user(new ChangeKind.AnnotationChanged(id, "x"), Instant.now());
        var derived = ChangeRecord.derived(new ChangeKind.AnnotationChanged(id, "y"), Instant.now());
        assertTrue(user.confidence() > derived.confidence());
        assertFalse(user.description().isBlank(), "A default description is filled in");
    }
}
