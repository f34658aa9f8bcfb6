package io.notelite.server.consistency;

import io.notelite.core.ChangeType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Groups of collaborators that cache derived views of the entities and must be told
 * when those entities change.
 */
public enum CollaboratorCategory {
    /** Previews and thumbnails rendered from content. */
    CONTENT_PREVIEW(EnumSet.of(
            ChangeType.ENTITY_CREATED,
            ChangeType.ENTITY_DELETED,
            ChangeType.ENTITY_MODIFIED,
            ChangeType.BULK_IMPORT)),

    RELATIONSHIP_GRAPH(EnumSet.of(
            ChangeType.ENTITY_CREATED,
            ChangeType.ENTITY_DELETED,
            ChangeType.LINK_ADDED,
            ChangeType.LINK_REMOVED,
            ChangeType.BULK_IMPORT)),

    ANNOTATION_SEARCH(EnumSet.of(
            ChangeType.ENTITY_CREATED,
            ChangeType.ENTITY_DELETED,
            ChangeType.ENTITY_MODIFIED,
            ChangeType.ANNOTATION_CHANGED,
            ChangeType.DERIVED_ANALYSIS_UPDATED,
            ChangeType.MERGED_EDIT,
            ChangeType.BULK_IMPORT)),

    /** Analyzers that recompute extracted text and tags when content changes. */
    DERIVED_ANALYSIS(EnumSet.of(
            ChangeType.ENTITY_CREATED,
            ChangeType.ENTITY_DELETED,
            ChangeType.ENTITY_MODIFIED,
            ChangeType.DERIVED_ANALYSIS_UPDATED,
            ChangeType.MERGED_EDIT,
            ChangeType.BULK_IMPORT));

    private final Set<ChangeType> interests;

    CollaboratorCategory(Set<ChangeType> interests) {
        this.interests = interests;
    }

    /** System versions (repairs, restores, undo and redo) concern everybody. */
    public boolean interestedIn(ChangeType type) {
        return type == ChangeType.SYSTEM || interests.contains(type);
    }
}
