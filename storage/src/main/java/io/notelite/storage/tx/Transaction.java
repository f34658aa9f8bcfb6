package io.notelite.storage.tx;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Handle for one atomic group of operations.
 * <p>
 * A transaction is owned by whoever called begin() until commit or rollback
 * completes. State transitions happen only inside {@link TransactionManager},
 * which synchronizes on the transaction, so the timeout thread and the owner
 * never race on them.
 */
public final class Transaction {
    private final String id;
    private final TransactionType type;
    private final Duration timeout;
    private final Instant startedAt;
    private final List<Operation> operations = new ArrayList<>();

    private TransactionState state;
    private String error;
    private volatile boolean cancelRequested;
    private volatile String cancelReason;
    private ScheduledFuture<?> timeoutTask;

    Transaction(TransactionType type, Duration timeout, Instant startedAt, TransactionState initial) {
        this.id = UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(type, "type");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.state = initial;
    }

    public String id() {
        return id;
    }

    public TransactionType type() {
        return type;
    }

    public Duration timeout() {
        return timeout;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized TransactionState state() {
        return state;
    }

    public synchronized String error() {
        return error;
    }

    public synchronized List<Operation> operations() {
        return List.copyOf(operations);
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    // ---------- manager-only mutators ----------

    synchronized void add(Operation op) {
        operations.add(op);
    }

    synchronized void transition(TransactionState next) {
        this.state = next;
    }

    synchronized void fail(TransactionState next, String message) {
        this.state = next;
        this.error = message;
    }

    void requestCancel(String reason) {
        this.cancelReason = reason;
        this.cancelRequested = true;
    }

    String cancelReason() {
        return cancelReason;
    }

    synchronized void timeoutTask(ScheduledFuture<?> task) {
        this.timeoutTask = task;
    }

    synchronized void clearTimeout() {
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
    }

    @Override
    public String toString() {
        return "Transaction{" + id + ", " + type + ", " + state() + ", ops=" + operations().size() + '}';
    }
}
