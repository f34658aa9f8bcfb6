package io.notelite.core.integrity;

import java.util.Collection;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    /** Any critical issue makes the store critical, else any warning makes it warning. */
    public static HealthStatus of(Collection<IntegrityIssue> issues) {
        boolean warning = false;
        for (IntegrityIssue issue : issues) {
            if (issue.severity() == IssueSeverity.CRITICAL) {
                return CRITICAL;
            }
            if (issue.severity() == IssueSeverity.WARNING) {
                warning = true;
            }
        }
        return warning ? WARNING : HEALTHY;
    }
}
