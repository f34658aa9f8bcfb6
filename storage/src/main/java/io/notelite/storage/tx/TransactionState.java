package io.notelite.storage.tx;

/**
 * Transaction lifecycle:
 *   ACTIVE -> COMMITTING -> COMMITTED
 *   ACTIVE -> COMMITTING -> ROLLING_BACK -> FAILED | ROLLED_BACK
 *   ACTIVE -> ROLLED_BACK            (explicit rollback or timeout before commit)
 *   FAILED                           (begin refused at the concurrency ceiling)
 */
public enum TransactionState {
    ACTIVE,
    COMMITTING,
    COMMITTED,
    ROLLING_BACK,
    ROLLED_BACK,
    FAILED;

    public boolean terminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == FAILED;
    }
}
