package io.notelite.core.integrity;

public enum IssueSeverity {
    INFO,
    WARNING,
    CRITICAL
}
