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

/** Link graph checks: links to entities that do not exist, and links to self. */
public final class RelationshipValidator implements IntegrityValidator {

    @Override
    public String name() {
        return "relationship";
    }

    @Override
    public boolean isCritical() {
        return false;
    }

    @Override
    public List<IntegrityIssue> validate(ValidationContext context) {
        if (!context.readable()) {
            return List.of();
        }
        Set<UUID> known = new HashSet<>();
        for (Entity e : context.entities()) {
            if (e != null) {
                known.add(e.id());
            }
        }

        List<IntegrityIssue> issues = new ArrayList<>();
        for (Entity e : context.entities()) {
            if (e == null) {
                continue;
            }
            for (UUID target : e.links()) {
                if (target.equals(e.id())) {
                    issues.add(new IntegrityIssue(IssueSeverity.WARNING,
                            "Entity " + e.id() + " links to itself",
                            Set.of(e.id()), IssueCategory.INVALID_RELATIONSHIP, name()));
                } else if (!known.contains(target)) {
                    issues.add(new IntegrityIssue(IssueSeverity.WARNING,
                            "Entity " + e.id() + " links to missing entity " + target,
                            Set.of(e.id(), target), IssueCategory.INVALID_RELATIONSHIP, name()));
                }
            }
        }
        return issues;
    }
}
