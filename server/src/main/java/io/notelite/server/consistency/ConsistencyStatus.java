package io.notelite.server.consistency;

public enum ConsistencyStatus {
    /** The change (or what resolution kept of the batch) is in the store and versioned. */
    APPLIED,
    /** Conflict resolution rejected every change; nothing was written. */
    REJECTED,
    /** At least one conflict cannot be resolved automatically; nothing was written. */
    MANUAL_INTERVENTION_REQUIRED,
    /** Applying failed and was rolled back. */
    FAILED
}
