package io.notelite.storage.tx;

import io.notelite.core.ConsistencyException;
import io.notelite.core.Entity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Fluent helper: collect operations, then begin and commit in one call.
 * <pre>
 *   txManager.builder(TransactionType.READ_WRITE)
 *       .insert(note)
 *       .delete(oldId)
 *       .commit();
 * </pre>
 */
public final class TransactionBuilder {
    private final TransactionManager manager;
    private final TransactionType type;
    private final List<Operation> operations = new ArrayList<>();
    private Duration timeout;
    private TransactionManager.Verifier verifier;

    TransactionBuilder(TransactionManager manager, TransactionType type) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.type = Objects.requireNonNull(type, "type");
    }

    public TransactionBuilder timeout(Duration value) {
        this.timeout = value;
        return this;
    }

    public TransactionBuilder insert(Entity entity) {
        return add(new Operation.Insert(entity));
    }

    public TransactionBuilder update(Entity entity) {
        return add(new Operation.Update(entity));
    }

    public TransactionBuilder delete(UUID id) {
        return add(new Operation.Delete(id));
    }

    public TransactionBuilder custom(String description, Operation.Action action) {
        return add(new Operation.Custom(description, action, false));
    }

    public TransactionBuilder add(Operation op) {
        operations.add(Objects.requireNonNull(op, "op"));
        return this;
    }

    public TransactionBuilder addAll(List<Operation> ops) {
        ops.forEach(this::add);
        return this;
    }

    public TransactionBuilder verifyWith(TransactionManager.Verifier check) {
        this.verifier = check;
        return this;
    }

    /** Begin, add everything, commit. A refused begin is reported as a failed result. */
    public TransactionResult commit() {
        Transaction tx = manager.begin(type, timeout);
        if (tx.state() != TransactionState.ACTIVE) {
            return TransactionResult.failed(tx, tx.error(), ConsistencyException.Category.TRANSIENT);
        }
        try {
            for (Operation op : operations) {
                manager.addOperation(tx, op);
            }
        } catch (IllegalStateException e) {
            manager.rollback(tx);
            return TransactionResult.failed(tx, e.getMessage(), ConsistencyException.Category.STRUCTURAL);
        }
        return manager.commit(tx, verifier);
    }
}
