package io.notelite.core.integrity;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One inconsistency found by a validator.
 *
 * @param severity    critical issues drive automatic repair, the others are only recorded
 * @param description human-readable explanation
 * @param affectedIds entities involved
 * @param category    selects the repair path
 * @param validator   name of the validator that reported it
 */
public record IntegrityIssue(
        IssueSeverity severity,
        String description,
        Set<UUID> affectedIds,
        IssueCategory category,
        String validator
) {
    public IntegrityIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(category, "category");
        affectedIds = affectedIds == null ? Set.of() : Set.copyOf(affectedIds);
        validator = validator == null ? "" : validator;
    }

    public boolean critical() {
        return severity == IssueSeverity.CRITICAL;
    }
}
