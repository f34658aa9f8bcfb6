package io.notelite.server.integrity;

import io.notelite.core.Entity;
import io.notelite.core.integrity.IntegrityIssue;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.core.integrity.IssueSeverity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Consistency of analyzer output: tags must be non-blank, unique and short, and
 * extracted text only makes sense on an entity that has content.
 */
public final class DerivedDataValidator implements IntegrityValidator {

    public static final int MAX_TAG_LENGTH = 64;

    @Override
    public String name() {
        return "derived-data";
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
        List<IntegrityIssue> issues = new ArrayList<>();
        for (Entity e : context.entities()) {
            if (e == null) {
                continue;
            }
            if (!validTags(e.tags())) {
                issues.add(new IntegrityIssue(IssueSeverity.WARNING,
                        "Entity " + e.id() + " has blank, repeated or over-long tags",
                        Set.of(e.id()), IssueCategory.SCHEMA_VIOLATION, name()));
            }
            if (!e.extractedText().isEmpty() && e.content().isBlank()) {
                issues.add(new IntegrityIssue(IssueSeverity.WARNING,
                        "Entity " + e.id() + " has extracted text but no content",
                        Set.of(e.id()), IssueCategory.ORPHANED_DATA, name()));
            }
        }
        return issues;
    }

    /** Same rule the repair path uses to clean tags. */
    public static boolean validTags(List<String> tags) {
        Set<String> seen = new HashSet<>();
        for (String t : tags) {
            if (t.isBlank() || t.length() > MAX_TAG_LENGTH || !seen.add(t)) {
                return false;
            }
        }
        return true;
    }

    /** Drop blank and repeated tags, truncate long ones. */
    public static List<String> cleanTags(List<String> tags) {
        List<String> out = new ArrayList<>(tags.size());
        for (String t : tags) {
            if (t.isBlank()) {
                continue;
            }
            String v = t.length() > MAX_TAG_LENGTH ? t.substring(0, MAX_TAG_LENGTH) : t;
            if (!out.contains(v)) {
                out.add(v);
            }
        }
        return out;
    }
}
