package io.notelite.server.integrity;

import io.notelite.core.integrity.IntegrityIssue;

import java.util.List;

/**
 * A single family of integrity checks.
 * <p>
 * Validators only report. They never mutate the store; repairs are the job of the
 * backup/restore service.
 */
public interface IntegrityValidator {

    /** Name stamped on every issue this validator reports. */
    String name();

    /** True if the validator takes part in quick checks. */
    boolean isCritical();

    List<IntegrityIssue> validate(ValidationContext context);

    /** Quick-check path: only the critical-severity findings. */
    default List<IntegrityIssue> validateCritical(ValidationContext context) {
        return validate(context).stream().filter(IntegrityIssue::critical).toList();
    }
}
