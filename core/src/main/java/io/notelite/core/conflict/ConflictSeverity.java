package io.notelite.core.conflict;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH
}
