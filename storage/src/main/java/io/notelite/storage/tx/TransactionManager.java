package io.notelite.storage.tx;

import io.notelite.core.ConsistencyException;
import io.notelite.storage.EntityStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups store mutations into atomic, reversible units.
 * <p>
 * Responsibilities:
 *  - Cap the number of concurrently active transactions; begin() past the ceiling
 *    returns a FAILED transaction immediately instead of queuing.
 *  - On commit:
 *      1) Execute operations in append order through a journaling store view.
 *      2) Run the optional verifier against the resulting state.
 *      3) Save the store exactly once.
 *    Any failure (exception, verifier, cancellation) reverses the journal in strict
 *    reverse order before the store is saved, so no partial state ever persists.
 *  - Arm a per-transaction timeout at begin(). An expired ACTIVE transaction is rolled
 *    back; an expired COMMITTING transaction is cancelled between operations.
 * <p>
 * Operations run against the store only inside commit(), so rolling back an ACTIVE
 * transaction never has to touch the store.
 */
public final class TransactionManager implements AutoCloseable {
    private static final Logger log = Logger.getLogger(TransactionManager.class.getName());

    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Pre-save check; returning false fails the commit. */
    @FunctionalInterface
    public interface Verifier {
        boolean verify(EntityStore store);
    }

    private final EntityStore store;
    private final int maxConcurrent;
    private final Duration defaultTimeout;
    private final Clock clock;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;
    private final Map<String, Transaction> active = new ConcurrentHashMap<>();
    private final TransactionMetrics metrics = new TransactionMetrics();

    public TransactionManager(EntityStore store) {
        this(store, DEFAULT_MAX_CONCURRENT, DEFAULT_TIMEOUT, Clock.systemUTC());
    }

    public TransactionManager(EntityStore store, int maxConcurrent, Duration defaultTimeout, Clock clock) {
        this(store, maxConcurrent, defaultTimeout, clock, null);
    }

    /**
     * @param timer scheduler used for timeouts; null creates a private daemon scheduler
     */
    public TransactionManager(
            EntityStore store,
            int maxConcurrent,
            Duration defaultTimeout,
            Clock clock,
            ScheduledExecutorService timer
    ) {
        if (maxConcurrent <= 0) throw new IllegalArgumentException("maxConcurrent must be > 0");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be > 0");
        }
        this.store = Objects.requireNonNull(store, "store");
        this.maxConcurrent = maxConcurrent;
        this.defaultTimeout = defaultTimeout;
        this.clock = Objects.requireNonNull(clock, "clock");
        if (timer == null) {
            this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "tx-timeout");
                t.setDaemon(true);
                return t;
            });
            this.ownsTimer = true;
        } else {
            this.timer = timer;
            this.ownsTimer = false;
        }
    }

    public Transaction begin(TransactionType type) {
        return begin(type, defaultTimeout);
    }

    public Transaction begin(TransactionType type, Duration timeout) {
        Objects.requireNonNull(type, "type");
        Duration effective = timeout == null ? defaultTimeout : timeout;

        Transaction tx;
        synchronized (active) {
            if (active.size() >= maxConcurrent) {
                tx = new Transaction(type, effective, clock.instant(), TransactionState.FAILED);
                tx.fail(TransactionState.FAILED,
                        "Too many concurrent transactions (limit " + maxConcurrent + ")");
                metrics.recordRejected();
                log.fine(() -> "Refused transaction at ceiling " + maxConcurrent);
                return tx;
            }
            tx = new Transaction(type, effective, clock.instant(), TransactionState.ACTIVE);
            active.put(tx.id(), tx);
        }
        metrics.recordBegin();
        tx.timeoutTask(timer.schedule(() -> expire(tx), effective.toMillis(), TimeUnit.MILLISECONDS));
        return tx;
    }

    public void addOperation(Transaction tx, Operation op) {
        Objects.requireNonNull(tx, "tx");
        Objects.requireNonNull(op, "op");
        synchronized (tx) {
            if (tx.state() != TransactionState.ACTIVE) {
                throw new IllegalStateException("cannot add operations to transaction in state " + tx.state());
            }
            if (op.mutating() && !tx.type().allowsWrites()) {
                throw new IllegalStateException("read-only transaction cannot accept " + op.describe());
            }
            tx.add(op);
        }
    }

    public TransactionResult commit(Transaction tx) {
        return commit(tx, null);
    }

    public TransactionResult commit(Transaction tx, Verifier verifier) {
        Objects.requireNonNull(tx, "tx");
        synchronized (tx) {
            if (tx.state() != TransactionState.ACTIVE) {
                return TransactionResult.failed(tx,
                        "cannot commit transaction in state " + tx.state()
                                + (tx.error() != null ? " (" + tx.error() + ")" : ""),
                        ConsistencyException.Category.STRUCTURAL);
            }
            tx.transition(TransactionState.COMMITTING);
        }

        long start = System.nanoTime();
        List<AppliedChange> journal = new ArrayList<>();
        JournalingStore view = new JournalingStore(store, journal, tx.type().allowsWrites());
        List<Operation> ops = tx.operations();
        int executed = 0;
        try {
            for (Operation op : ops) {
                checkCancelled(tx);
                op.execute(view);
                executed++;
            }
            if (verifier != null && !verifier.verify(store)) {
                throw new IllegalStateException("verification failed after " + executed + " operations");
            }
            checkCancelled(tx);
            if (!journal.isEmpty()) {
                store.save();
            }
            tx.transition(TransactionState.COMMITTED);
            metrics.recordCommit(System.nanoTime() - start);
            return TransactionResult.ok(tx, journal);
        } catch (Exception e) {
            boolean cancelled = e instanceof TransactionCancelledException;
            String reason;
            if (cancelled) {
                reason = e.getMessage();
            } else if (executed < ops.size()) {
                reason = "operation " + (executed + 1) + " (" + ops.get(executed).describe() + ") failed: " + e.getMessage();
            } else {
                reason = "commit failed: " + e.getMessage();
            }
            return reverse(tx, journal, reason, cancelled, e);
        } finally {
            release(tx);
        }
    }

    /**
     * Roll back an ACTIVE transaction. A transaction that is committing is asked to
     * cancel instead; it then reverses itself on the committing thread.
     */
    public TransactionResult rollback(Transaction tx) {
        Objects.requireNonNull(tx, "tx");
        synchronized (tx) {
            switch (tx.state()) {
                case ACTIVE -> {
                    tx.transition(TransactionState.ROLLED_BACK);
                    release(tx);
                    metrics.recordRolledBack();
                    return TransactionResult.ok(tx, List.of());
                }
                case COMMITTING -> {
                    tx.requestCancel("rolled back by caller");
                    return TransactionResult.failed(tx, "cancellation requested while committing",
                            ConsistencyException.Category.TRANSIENT);
                }
                default -> {
                    return TransactionResult.failed(tx, "cannot roll back transaction in state " + tx.state(),
                            ConsistencyException.Category.STRUCTURAL);
                }
            }
        }
    }

    /** External cancellation: same path as a timeout. */
    public void cancel(Transaction tx) {
        cancel(tx, "cancelled by caller");
    }

    public TransactionBuilder builder(TransactionType type) {
        return new TransactionBuilder(this, type);
    }

    public int activeCount() {
        return active.size();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public TransactionMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        if (ownsTimer) {
            timer.shutdownNow();
        }
    }

    // ---------- internals ----------

    private void expire(Transaction tx) {
        boolean expired = cancel(tx, "timed out after " + tx.timeout().toMillis() + "ms");
        if (expired) {
            metrics.recordTimedOut();
            log.warning("Transaction " + tx.id() + " timed out after " + tx.timeout());
        }
    }

    private boolean cancel(Transaction tx, String reason) {
        synchronized (tx) {
            switch (tx.state()) {
                case ACTIVE -> {
                    tx.fail(TransactionState.ROLLED_BACK, reason);
                    release(tx);
                    metrics.recordRolledBack();
                    return true;
                }
                case COMMITTING -> {
                    tx.requestCancel(reason);
                    return true;
                }
                default -> {
                    return false;
                }
            }
        }
    }

    private TransactionResult reverse(
            Transaction tx,
            List<AppliedChange> journal,
            String reason,
            boolean cancelled,
            Exception cause
    ) {
        tx.transition(TransactionState.ROLLING_BACK);
        try {
            for (int i = journal.size() - 1; i >= 0; i--) {
                journal.get(i).revert(store);
            }
        } catch (RuntimeException rollbackError) {
            rollbackError.addSuppressed(cause);
            log.log(Level.SEVERE, "Rollback of transaction " + tx.id() + " failed", rollbackError);
            tx.fail(TransactionState.FAILED, reason + "; rollback failed: " + rollbackError.getMessage());
            metrics.recordFailed();
            return TransactionResult.failed(tx, tx.error(), ConsistencyException.Category.FATAL);
        }

        if (cancelled) {
            tx.fail(TransactionState.ROLLED_BACK, reason);
            metrics.recordRolledBack();
            return TransactionResult.failed(tx, reason, ConsistencyException.Category.TRANSIENT);
        }
        log.log(Level.FINE, "Transaction " + tx.id() + " reversed " + journal.size() + " mutations", cause);
        tx.fail(TransactionState.FAILED, reason);
        metrics.recordFailed();
        return TransactionResult.failed(tx, reason, categoryOf(cause));
    }

    private void release(Transaction tx) {
        tx.clearTimeout();
        active.remove(tx.id());
    }

    private static void checkCancelled(Transaction tx) {
        if (tx.cancelRequested()) {
            throw new TransactionCancelledException(tx.cancelReason());
        }
    }

    private static ConsistencyException.Category categoryOf(Exception e) {
        if (e instanceof ConsistencyException ce) {
            return ce.category();
        }
        if (e instanceof java.io.IOException || e instanceof java.io.UncheckedIOException) {
            return ConsistencyException.Category.TRANSIENT;
        }
        return ConsistencyException.Category.STRUCTURAL;
    }

    private static final class TransactionCancelledException extends RuntimeException {
        TransactionCancelledException(String reason) {
            super(reason);
        }
    }
}
