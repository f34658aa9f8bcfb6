package io.notelite.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One reversible primitive inside a delta version.
 * <p>
 * Every variant carries the values needed to replay it forward and to undo it,
 * so a delta can be reversed without consulting any other version.
 */
public sealed interface DeltaOperation permits
        DeltaOperation.Create,
        DeltaOperation.Update,
        DeltaOperation.Delete,
        DeltaOperation.Move,
        DeltaOperation.Merge {

    UUID targetId();

    /** Apply this operation to an id -> entity map. */
    void applyTo(Map<UUID, Entity> state);

    /** The operation that undoes this one. */
    DeltaOperation inverse();

    long estimatedBytes();

    record Create(Entity after) implements DeltaOperation {
        public Create {
            Objects.requireNonNull(after, "after");
        }
        @Override public UUID targetId() { return after.id(); }
        @Override public void applyTo(Map<UUID, Entity> state) { state.put(after.id(), after); }
        @Override public DeltaOperation inverse() { return new Delete(after); }
        @Override public long estimatedBytes() { return 8 + after.estimatedBytes(); }
    }

    record Update(Entity before, Entity after) implements DeltaOperation {
        public Update {
            Objects.requireNonNull(before, "before");
            Objects.requireNonNull(after, "after");
            if (!before.id().equals(after.id())) {
                throw new IllegalArgumentException("update must keep the entity id");
            }
        }
        @Override public UUID targetId() { return after.id(); }
        @Override public void applyTo(Map<UUID, Entity> state) { state.put(after.id(), after); }
        @Override public DeltaOperation inverse() { return new Update(after, before); }
        @Override public long estimatedBytes() { return 8 + before.estimatedBytes() + after.estimatedBytes(); }
    }

    record Delete(Entity before) implements DeltaOperation {
        public Delete {
            Objects.requireNonNull(before, "before");
        }
        @Override public UUID targetId() { return before.id(); }
        @Override public void applyTo(Map<UUID, Entity> state) { state.remove(before.id()); }
        @Override public DeltaOperation inverse() { return new Create(before); }
        @Override public long estimatedBytes() { return 8 + before.estimatedBytes(); }
    }

    /** Retarget one link of an entity: entityId -> from becomes entityId -> to. */
    record Move(UUID entityId, UUID from, UUID to) implements DeltaOperation {
        public Move {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
        @Override public UUID targetId() { return entityId; }
        @Override public void applyTo(Map<UUID, Entity> state) {
            Entity current = state.get(entityId);
            if (current == null || !current.hasLinkTo(from)) {
                throw new IllegalStateException("cannot move link " + entityId + "->" + from + ": not present");
            }
            state.put(entityId, current.withLinkRetargeted(from, to));
        }
        @Override public DeltaOperation inverse() { return new Move(entityId, to, from); }
        @Override public long estimatedBytes() { return 8 + 48; }
    }

    /** Result of combining several edits into one entity value. */
    record Merge(Entity before, Entity after, List<UUID> sourceChangeIds) implements DeltaOperation {
        public Merge {
            Objects.requireNonNull(before, "before");
            Objects.requireNonNull(after, "after");
            sourceChangeIds = sourceChangeIds == null ? List.of() : List.copyOf(sourceChangeIds);
        }
        @Override public UUID targetId() { return after.id(); }
        @Override public void applyTo(Map<UUID, Entity> state) { state.put(after.id(), after); }
        @Override public DeltaOperation inverse() { return new Merge(after, before, sourceChangeIds); }
        @Override public long estimatedBytes() {
            return 8 + before.estimatedBytes() + after.estimatedBytes() + 16L * sourceChangeIds.size();
        }
    }
}
