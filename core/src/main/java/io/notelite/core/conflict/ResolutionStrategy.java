package io.notelite.core.conflict;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of resolution strategies, declared in fallback priority order.
 * <p>
 * Each strategy names the conflict types it can resolve; the engine dispatches
 * on the constant with one exhaustive switch.
 */
public enum ResolutionStrategy {
    /** Accept every user change, reject the rest. */
    USER_PRIORITY(0.95, EnumSet.of(ConflictType.USER_VS_DERIVED, ConflictType.SIMULTANEOUS_EDIT)),
    /** Combine two mergeable edits that touch disjoint fields. */
    CONTENT_MERGE(0.85, EnumSet.of(ConflictType.SIMULTANEOUS_EDIT)),
    /** Last write wins. */
    TIMESTAMP(0.8, EnumSet.of(ConflictType.SIMULTANEOUS_EDIT, ConflictType.USER_VS_DERIVED)),
    /** Highest producer confidence wins. */
    CONFIDENCE(0.75, EnumSet.of(ConflictType.VERSION_MISMATCH, ConflictType.SIMULTANEOUS_EDIT)),
    /** Accept everything after a structural pass over relationships. */
    SEMANTIC_MERGE(0.7, EnumSet.allOf(ConflictType.class));

    private final double baseConfidence;
    private final Set<ConflictType> resolvable;

    ResolutionStrategy(double baseConfidence, Set<ConflictType> resolvable) {
        this.baseConfidence = baseConfidence;
        this.resolvable = resolvable;
    }

    public boolean canResolve(ConflictType type) {
        return resolvable.contains(type);
    }

    /** Confidence reported when suggesting this strategy for a conflict. */
    public double baseConfidence() {
        return baseConfidence;
    }

    /** Strategy tried first for a conflict type, before the priority fallback. */
    public static ResolutionStrategy preferredFor(ConflictType type) {
        return switch (type) {
            case USER_VS_DERIVED -> USER_PRIORITY;
            case SIMULTANEOUS_EDIT -> TIMESTAMP;
            case VERSION_MISMATCH -> CONFIDENCE;
            case INTEGRITY_VIOLATION -> SEMANTIC_MERGE;
        };
    }
}
