package io.notelite.server.integrity;

import io.notelite.core.EntityChecksums;
import io.notelite.core.integrity.IntegrityIssue;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.core.integrity.IssueSeverity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Compares the live state with the checksum the version history believes is current.
 * A mismatch means undo/redo would refuse to navigate until a new version is recorded.
 */
public final class CacheConsistencyValidator implements IntegrityValidator {

    private final Supplier<Optional<String>> expectedChecksum;

    /**
     * @param expectedChecksum checksum of the current history version, empty when there is none
     */
    public CacheConsistencyValidator(Supplier<Optional<String>> expectedChecksum) {
        this.expectedChecksum = Objects.requireNonNull(expectedChecksum, "expectedChecksum");
    }

    @Override
    public String name() {
        return "cache-consistency";
    }

    @Override
    public boolean isCritical() {
        return false;
    }

    @Override
    public List<IntegrityIssue> validate(ValidationContext context) {
        if (!context.readable() || context.hasNullEntries()) {
            return List.of();
        }
        Optional<String> expected = expectedChecksum.get();
        if (expected.isEmpty()) {
            return List.of();
        }
        String actual = EntityChecksums.of(context.entities());
        if (actual.equals(expected.get())) {
            return List.of();
        }
        return List.of(new IntegrityIssue(IssueSeverity.WARNING,
                "Live state differs from the current history version",
                Set.of(), IssueCategory.CACHE_INCONSISTENCY, name()));
    }
}
