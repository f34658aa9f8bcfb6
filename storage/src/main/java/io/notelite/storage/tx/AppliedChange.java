package io.notelite.storage.tx;

import io.notelite.core.Entity;
import io.notelite.storage.EntityStore;

import java.util.Objects;
import java.util.UUID;

/**
 * Journal entry for one executed store mutation.
 * before == null means the entity was created, after == null means it was deleted.
 */
public record AppliedChange(UUID id, Entity before, Entity after) {
    public AppliedChange {
        Objects.requireNonNull(id, "id");
        if (before == null && after == null) {
            throw new IllegalArgumentException("applied change needs a before or an after value");
        }
    }

    public boolean created() {
        return before == null;
    }

    public boolean deleted() {
        return after == null;
    }

    /** Undo this mutation against the raw store. */
    void revert(EntityStore store) {
        if (before == null) {
            store.delete(id);
        } else if (after == null) {
            store.insert(before);
        } else {
            store.update(before);
        }
    }
}
