package io.notelite.server.integrity;

import io.notelite.core.integrity.HealthStatus;

import java.time.Instant;

/**
 * Current health as of the last check.
 *
 * @param status        null before the first check
 * @param lastCheck     last quick or comprehensive check, null if none ran yet
 * @param lastFullCheck last comprehensive check, null if none ran yet
 */
public record HealthSummary(
        HealthStatus status,
        int activeIssues,
        int criticalIssues,
        int warningIssues,
        Instant lastCheck,
        Instant lastFullCheck,
        IntegrityMetrics.Snapshot metrics
) {
    public boolean checked() {
        return status != null;
    }
}
