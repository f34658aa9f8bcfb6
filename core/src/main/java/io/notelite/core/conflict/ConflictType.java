package io.notelite.core.conflict;

/** Why two or more changes collide. */
public enum ConflictType {
    SIMULTANEOUS_EDIT,
    INTEGRITY_VIOLATION,
    USER_VS_DERIVED,
    VERSION_MISMATCH
}
