package io.notelite.core;

/** Coarse impact of a version, weighted for history displays. */
public enum ChangeImpact {
    LOW(0.25),
    MEDIUM(0.5),
    HIGH(0.75),
    CRITICAL(1.0);

    private final double weight;

    ChangeImpact(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    public static ChangeImpact forType(ChangeType type) {
        return switch (type) {
            case BULK_IMPORT, SYSTEM -> CRITICAL;
            case ENTITY_DELETED, ENTITY_CREATED -> HIGH;
            case ENTITY_MODIFIED, LINK_ADDED, LINK_REMOVED, MERGED_EDIT -> MEDIUM;
            case ANNOTATION_CHANGED, DERIVED_ANALYSIS_UPDATED -> LOW;
        };
    }
}
