package io.notelite.core;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Closed set of semantic edits a {@link ChangeRecord} can describe.
 * <p>
 * Each variant carries exactly the typed data needed to apply it; nullable
 * fields on the partial-update variants mean "leave unchanged" and at least
 * one of them must be present.
 */
public sealed interface ChangeKind permits
        ChangeKind.EntityCreated,
        ChangeKind.EntityDeleted,
        ChangeKind.EntityModified,
        ChangeKind.LinkAdded,
        ChangeKind.LinkRemoved,
        ChangeKind.AnnotationChanged,
        ChangeKind.DerivedAnalysisUpdated,
        ChangeKind.BulkImport,
        ChangeKind.MergedEdit {

    ChangeType type();

    /** Entity ids this edit reads or writes. */
    Set<UUID> affectedIds();

    /** Fields this edit overwrites. */
    Set<EntityField> touchedFields();

    /** True for the kinds content-merge may combine. */
    default boolean mergeable() {
        return false;
    }

    record EntityCreated(Entity entity) implements ChangeKind {
        public EntityCreated {
            Objects.requireNonNull(entity, "entity");
        }
        @Override public ChangeType type() { return ChangeType.ENTITY_CREATED; }
        @Override public Set<UUID> affectedIds() { return Set.of(entity.id()); }
        @Override public Set<EntityField> touchedFields() { return EnumSet.allOf(EntityField.class); }
    }

    record EntityDeleted(UUID entityId) implements ChangeKind {
        public EntityDeleted {
            Objects.requireNonNull(entityId, "entityId");
        }
        @Override public ChangeType type() { return ChangeType.ENTITY_DELETED; }
        @Override public Set<UUID> affectedIds() { return Set.of(entityId); }
        @Override public Set<EntityField> touchedFields() { return EnumSet.allOf(EntityField.class); }
    }

    record EntityModified(UUID entityId, String name, String content) implements ChangeKind {
        public EntityModified {
            Objects.requireNonNull(entityId, "entityId");
            if (name == null && content == null) {
                throw new IllegalArgumentException("EntityModified must change name or content");
            }
        }
        @Override public ChangeType type() { return ChangeType.ENTITY_MODIFIED; }
        @Override public Set<UUID> affectedIds() { return Set.of(entityId); }
        @Override public Set<EntityField> touchedFields() {
            Set<EntityField> f = EnumSet.noneOf(EntityField.class);
            if (name != null) f.add(EntityField.NAME);
            if (content != null) f.add(EntityField.CONTENT);
            return f;
        }
    }

    record LinkAdded(UUID from, UUID to) implements ChangeKind {
        public LinkAdded {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
        @Override public ChangeType type() { return ChangeType.LINK_ADDED; }
        @Override public Set<UUID> affectedIds() { return orderedPair(from, to); }
        @Override public Set<EntityField> touchedFields() { return EnumSet.of(EntityField.LINKS); }
    }

    record LinkRemoved(UUID from, UUID to) implements ChangeKind {
        public LinkRemoved {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
        @Override public ChangeType type() { return ChangeType.LINK_REMOVED; }
        @Override public Set<UUID> affectedIds() { return orderedPair(from, to); }
        @Override public Set<EntityField> touchedFields() { return EnumSet.of(EntityField.LINKS); }
    }

    record AnnotationChanged(UUID entityId, String annotation) implements ChangeKind {
        public AnnotationChanged {
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(annotation, "annotation");
        }
        @Override public ChangeType type() { return ChangeType.ANNOTATION_CHANGED; }
        @Override public Set<UUID> affectedIds() { return Set.of(entityId); }
        @Override public Set<EntityField> touchedFields() { return EnumSet.of(EntityField.ANNOTATION); }
        @Override public boolean mergeable() { return true; }
    }

    record DerivedAnalysisUpdated(UUID entityId, String extractedText, List<String> tags) implements ChangeKind {
        public DerivedAnalysisUpdated {
            Objects.requireNonNull(entityId, "entityId");
            if (extractedText == null && tags == null) {
                throw new IllegalArgumentException("DerivedAnalysisUpdated must carry text or tags");
            }
            tags = tags == null ? null : List.copyOf(tags);
        }
        @Override public ChangeType type() { return ChangeType.DERIVED_ANALYSIS_UPDATED; }
        @Override public Set<UUID> affectedIds() { return Set.of(entityId); }
        @Override public Set<EntityField> touchedFields() {
            Set<EntityField> f = EnumSet.noneOf(EntityField.class);
            if (extractedText != null) f.add(EntityField.EXTRACTED_TEXT);
            if (tags != null) f.add(EntityField.TAGS);
            return f;
        }
        @Override public boolean mergeable() { return true; }
    }

    record BulkImport(List<Entity> entities) implements ChangeKind {
        public BulkImport {
            Objects.requireNonNull(entities, "entities");
            if (entities.isEmpty()) throw new IllegalArgumentException("BulkImport must not be empty");
            entities = List.copyOf(entities);
        }
        @Override public ChangeType type() { return ChangeType.BULK_IMPORT; }
        @Override public Set<UUID> affectedIds() {
            Set<UUID> ids = new LinkedHashSet<>();
            for (Entity e : entities) ids.add(e.id());
            return ids;
        }
        @Override public Set<EntityField> touchedFields() { return EnumSet.allOf(EntityField.class); }
    }

    /**
     * Combination of two mergeable edits on disjoint fields of one entity.
     * Only the content-merge strategy produces this kind.
     */
    record MergedEdit(UUID entityId, String annotation, String extractedText, List<String> tags) implements ChangeKind {
        public MergedEdit {
            Objects.requireNonNull(entityId, "entityId");
            if (annotation == null && extractedText == null && tags == null) {
                throw new IllegalArgumentException("MergedEdit must carry at least one field");
            }
            tags = tags == null ? null : List.copyOf(tags);
        }
        @Override public ChangeType type() { return ChangeType.MERGED_EDIT; }
        @Override public Set<UUID> affectedIds() { return Set.of(entityId); }
        @Override public Set<EntityField> touchedFields() {
            Set<EntityField> f = EnumSet.noneOf(EntityField.class);
            if (annotation != null) f.add(EntityField.ANNOTATION);
            if (extractedText != null) f.add(EntityField.EXTRACTED_TEXT);
            if (tags != null) f.add(EntityField.TAGS);
            return f;
        }
        @Override public boolean mergeable() { return true; }
    }

    private static Set<UUID> orderedPair(UUID a, UUID b) {
        Set<UUID> s = new LinkedHashSet<>();
        s.add(a);
        s.add(b);
        return s;
    }
}
