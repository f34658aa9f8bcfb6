package io.notelite.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Content of a {@link DataVersion}: either an ordered list of reversible
 * operations or the complete entity state.
 */
public sealed interface VersionPayload permits VersionPayload.Delta, VersionPayload.Snapshot {

    long estimatedBytes();

    record Delta(List<DeltaOperation> operations) implements VersionPayload {
        public Delta {
            Objects.requireNonNull(operations, "operations");
            operations = List.copyOf(operations);
        }

        /** Operations that undo this delta, in the order they must run. */
        public List<DeltaOperation> inverseOperations() {
            List<DeltaOperation> out = new ArrayList<>(operations.size());
            for (int i = operations.size() - 1; i >= 0; i--) {
                out.add(operations.get(i).inverse());
            }
            return out;
        }

        @Override
        public long estimatedBytes() {
            long sum = 16;
            for (DeltaOperation op : operations) {
                sum += op.estimatedBytes();
            }
            return sum;
        }
    }

    /** Full state. Entities are kept sorted by id so equal states compare equal. */
    record Snapshot(List<Entity> entities) implements VersionPayload {
        public Snapshot {
            Objects.requireNonNull(entities, "entities");
            List<Entity> sorted = new ArrayList<>(entities);
            sorted.sort(Comparator.comparing(Entity::id));
            entities = List.copyOf(sorted);
        }

        @Override
        public long estimatedBytes() {
            long sum = 16;
            for (Entity e : entities) {
                sum += e.estimatedBytes();
            }
            return sum;
        }
    }
}
