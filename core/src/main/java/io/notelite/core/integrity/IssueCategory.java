package io.notelite.core.integrity;

/**
 * What kind of inconsistency an issue reports. The repair path is chosen per category;
 * the last two are report-only.
 */
public enum IssueCategory {
    ORPHANED_DATA,
    MISSING_REFERENCE,
    DATA_CORRUPTION,
    DUPLICATE,
    INVALID_RELATIONSHIP,
    SCHEMA_VIOLATION,
    CACHE_INCONSISTENCY,
    CORRELATED
}
