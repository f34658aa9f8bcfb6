package io.notelite.server.integrity;

import io.notelite.core.integrity.HealthStatus;
import io.notelite.core.integrity.IntegrityIssue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of a comprehensive check.
 *
 * @param issues          every issue found, cross-validation findings last
 * @param status          derived from the issue severities
 * @param validatorsRun   number of validators executed
 * @param validatorsClean validators that reported nothing
 * @param checkedAt       start of the check
 * @param elapsed         wall time of the check
 */
public record IntegrityReport(
        List<IntegrityIssue> issues,
        HealthStatus status,
        int validatorsRun,
        int validatorsClean,
        Instant checkedAt,
        Duration elapsed
) {
    public IntegrityReport {
        issues = List.copyOf(issues);
    }

    public boolean success() {
        return status != HealthStatus.CRITICAL;
    }

    public List<IntegrityIssue> criticalIssues() {
        return issues.stream().filter(IntegrityIssue::critical).toList();
    }

    public String message() {
        return switch (status) {
            case HEALTHY -> "All data integrity checks passed";
            case WARNING -> "Minor issues detected (" + issues.size() + " total)";
            case CRITICAL -> "Critical data integrity issues require immediate attention";
        };
    }
}
