package io.notelite.server.integrity;

import io.notelite.core.Entity;
import io.notelite.core.integrity.IntegrityIssue;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.core.integrity.IssueSeverity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Store-level checks: the store must be readable, must not hand out null entries,
 * and must not hold two entries under one id. Findings here are only repairable
 * from a backup.
 */
public final class StorageIntegrityValidator implements IntegrityValidator {

    @Override
    public String name() {
        return "storage-integrity";
    }

    @Override
    public boolean isCritical() {
        return true;
    }

    @Override
    public List<IntegrityIssue> validate(ValidationContext context) {
        if (!context.readable()) {
            return List.of(new IntegrityIssue(IssueSeverity.CRITICAL,
                    "Store could not be read: " + context.loadError(),
                    Set.of(), IssueCategory.DATA_CORRUPTION, name()));
        }
        List<IntegrityIssue> issues = new ArrayList<>();
        int nulls = 0;
        Set<UUID> seen = new HashSet<>();
        Set<UUID> repeated = new HashSet<>();
        for (Entity e : context.entities()) {
            if (e == null) {
                nulls++;
            } else if (!seen.add(e.id())) {
                repeated.add(e.id());
            }
        }
        if (nulls > 0) {
            issues.add(new IntegrityIssue(IssueSeverity.CRITICAL,
                    "Store returned " + nulls + " null entries",
                    Set.of(), IssueCategory.DATA_CORRUPTION, name()));
        }
        if (!repeated.isEmpty()) {
            issues.add(new IntegrityIssue(IssueSeverity.CRITICAL,
                    "Store holds several entries for " + repeated.size() + " id(s)",
                    repeated, IssueCategory.DATA_CORRUPTION, name()));
        }
        return issues;
    }
}
