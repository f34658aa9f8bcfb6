package io.notelite.server.integrity;

import io.notelite.core.integrity.IntegrityIssue;

import java.time.Duration;
import java.util.List;

/** Result of a quick check: only critical validators, only critical findings. */
public record QuickCheckResult(boolean healthy, int criticalCount, List<IntegrityIssue> issues, Duration elapsed) {
    public QuickCheckResult {
        issues = List.copyOf(issues);
    }
}
