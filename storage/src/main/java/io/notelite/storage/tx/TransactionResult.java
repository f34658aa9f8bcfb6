package io.notelite.storage.tx;

import io.notelite.core.ConsistencyException;

import java.util.List;

/**
 * Outcome of commit or rollback.
 *
 * @param transactionId  id of the transaction
 * @param success        true if the requested transition completed
 * @param state          state after the call
 * @param appliedChanges journal of a committed transaction, empty otherwise
 * @param error          failure message, null on success
 * @param errorCategory  how callers should treat the failure, null on success
 */
public record TransactionResult(
        String transactionId,
        boolean success,
        TransactionState state,
        List<AppliedChange> appliedChanges,
        String error,
        ConsistencyException.Category errorCategory
) {
    public TransactionResult {
        appliedChanges = appliedChanges == null ? List.of() : List.copyOf(appliedChanges);
    }

    static TransactionResult ok(Transaction tx, List<AppliedChange> applied) {
        return new TransactionResult(tx.id(), true, tx.state(), applied, null, null);
    }

    static TransactionResult failed(Transaction tx, String error, ConsistencyException.Category category) {
        return new TransactionResult(tx.id(), false, tx.state(), List.of(), error, category);
    }

    /** Convert a failure into an exception for callers that prefer throwing. */
    public ConsistencyException toException() {
        if (success) {
            throw new IllegalStateException("transaction " + transactionId + " succeeded");
        }
        return new ConsistencyException(
                errorCategory == null ? ConsistencyException.Category.TRANSIENT : errorCategory,
                "Transaction " + transactionId + " " + state + ": " + error
        );
    }
}
