package io.notelite.core;

/**
 * Flat tag for a {@link ChangeKind}, used where only the kind of change matters
 * (version metadata, the persisted history log, notification routing).
 */
public enum ChangeType {
    ENTITY_CREATED,
    ENTITY_DELETED,
    ENTITY_MODIFIED,
    LINK_ADDED,
    LINK_REMOVED,
    ANNOTATION_CHANGED,
    DERIVED_ANALYSIS_UPDATED,
    BULK_IMPORT,
    MERGED_EDIT,
    /** Versions the core records for itself: baseline, repair, restore. */
    SYSTEM
}
