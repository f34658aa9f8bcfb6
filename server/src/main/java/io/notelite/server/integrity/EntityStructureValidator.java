package io.notelite.server.integrity;

import io.notelite.core.Entity;
import io.notelite.core.integrity.IntegrityIssue;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.core.integrity.IssueSeverity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Field-level checks on each entity.
 * <p>
 * Critical: nil id, blank content (orphaned entity), negative creation time.
 * Warning: blank name, creation time in the future, duplicate entries
 * (same name and same content under different ids).
 */
public final class EntityStructureValidator implements IntegrityValidator {

    /** Clock skew tolerated before a creation time counts as "in the future". */
    public static final Duration FUTURE_TOLERANCE = Duration.ofMinutes(5);

    @Override
    public String name() {
        return "entity-structure";
    }

    @Override
    public boolean isCritical() {
        return true;
    }

    @Override
    public List<IntegrityIssue> validate(ValidationContext context) {
        if (!context.readable()) {
            return List.of();
        }
        List<IntegrityIssue> issues = new ArrayList<>();
        long futureLimit = context.checkedAt().plus(FUTURE_TOLERANCE).toEpochMilli();
        Map<String, Set<UUID>> byNameAndContent = new LinkedHashMap<>();

        for (Entity e : context.entities()) {
            if (e == null) {
                continue; // storage integrity reports these
            }
            if (Entity.NIL_ID.equals(e.id())) {
                issues.add(issue(IssueSeverity.CRITICAL, "Entity has the nil id", e.id(), IssueCategory.SCHEMA_VIOLATION));
            }
            if (e.content().isBlank()) {
                issues.add(issue(IssueSeverity.CRITICAL, "Entity " + e.id() + " has no content", e.id(),
                        IssueCategory.ORPHANED_DATA));
            }
            if (e.createdAtMillis() < 0) {
                issues.add(issue(IssueSeverity.CRITICAL, "Entity " + e.id() + " has a negative creation time",
                        e.id(), IssueCategory.SCHEMA_VIOLATION));
            } else if (e.createdAtMillis() > futureLimit) {
                issues.add(issue(IssueSeverity.WARNING, "Entity " + e.id() + " was created in the future",
                        e.id(), IssueCategory.SCHEMA_VIOLATION));
            }
            if (e.name().isBlank()) {
                issues.add(issue(IssueSeverity.WARNING, "Entity " + e.id() + " has no name", e.id(),
                        IssueCategory.MISSING_REFERENCE));
            } else if (!e.content().isBlank()) {
                byNameAndContent.computeIfAbsent(e.name() + '\u0000' + e.content(), k -> new LinkedHashSet<>())
                        .add(e.id());
            }
        }

        for (Set<UUID> ids : byNameAndContent.values()) {
            if (ids.size() > 1) {
                issues.add(new IntegrityIssue(IssueSeverity.WARNING,
                        "Duplicate entries: " + ids.size() + " entities share name and content",
                        ids, IssueCategory.DUPLICATE, name()));
            }
        }
        return issues;
    }

    private IntegrityIssue issue(IssueSeverity severity, String description, UUID id, IssueCategory category) {
        Objects.requireNonNull(id, "id");
        return new IntegrityIssue(severity, description, Set.of(id), category, name());
    }
}
