package io.notelite.storage.tx;

import io.notelite.core.Entity;
import io.notelite.storage.EntityStore;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Primitive unit of work inside a transaction.
 * <p>
 * Operations never capture their own inverse: the store view passed to
 * {@link #execute} journals every mutation, and the manager reverses the
 * journal on failure. This keeps Custom operations as safe as the built-ins.
 */
public sealed interface Operation permits
        Operation.Insert,
        Operation.Update,
        Operation.Delete,
        Operation.Batch,
        Operation.Custom {

    void execute(EntityStore store) throws Exception;

    /** True if the operation may write; read-only transactions refuse writers. */
    boolean mutating();

    String describe();

    record Insert(Entity entity) implements Operation {
        public Insert {
            Objects.requireNonNull(entity, "entity");
        }
        @Override public void execute(EntityStore store) { store.insert(entity); }
        @Override public boolean mutating() { return true; }
        @Override public String describe() { return "insert " + entity.id(); }
    }

    record Update(Entity entity) implements Operation {
        public Update {
            Objects.requireNonNull(entity, "entity");
        }
        @Override public void execute(EntityStore store) { store.update(entity); }
        @Override public boolean mutating() { return true; }
        @Override public String describe() { return "update " + entity.id(); }
    }

    record Delete(UUID entityId) implements Operation {
        public Delete {
            Objects.requireNonNull(entityId, "entityId");
        }
        @Override public void execute(EntityStore store) { store.delete(entityId); }
        @Override public boolean mutating() { return true; }
        @Override public String describe() { return "delete " + entityId; }
    }

    /** Ordered group; partial progress is reversed with the rest of the transaction. */
    record Batch(String label, List<Operation> operations) implements Operation {
        public Batch {
            Objects.requireNonNull(operations, "operations");
            operations = List.copyOf(operations);
            label = label == null ? "batch" : label;
        }
        @Override public void execute(EntityStore store) throws Exception {
            for (Operation op : operations) {
                op.execute(store);
            }
        }
        @Override public boolean mutating() {
            return operations.stream().anyMatch(Operation::mutating);
        }
        @Override public String describe() { return label + " (" + operations.size() + " ops)"; }
    }

    /** Caller-supplied logic; only readOnly actions may join a read-only transaction. */
    record Custom(String description, Action action, boolean readOnly) implements Operation {
        public Custom {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(action, "action");
        }
        @Override public void execute(EntityStore store) throws Exception { action.run(store); }
        @Override public boolean mutating() { return !readOnly; }
        @Override public String describe() { return description; }
    }

    @FunctionalInterface
    interface Action {
        void run(EntityStore store) throws Exception;
    }
}
