package io.notelite.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable note entity as held by the entity store.
 * <p>
 * Semantics:
 *  - id identifies the entity for its whole life; the all-zero UUID is treated as invalid.
 *  - content is the required primary payload; an entity without it is orphaned.
 *  - annotation is written by the user, extractedText and tags by background analyzers.
 *  - links are directed references to other entities (this -> target).
 * <p>
 * All "with" methods return a new instance; collections are copied on the way in.
 */
public record Entity(
        UUID id,
        String name,
        long createdAtMillis,
        String content,
        String annotation,
        String extractedText,
        List<String> tags,
        Set<UUID> links
) {
    /** The nil UUID, never a valid entity id. */
    public static final UUID NIL_ID = new UUID(0L, 0L);

    public Entity {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
        content = content == null ? "" : content;
        annotation = annotation == null ? "" : annotation;
        extractedText = extractedText == null ? "" : extractedText;
        tags = tags == null ? List.of() : List.copyOf(tags);
        // keep insertion order for stable serialization
        links = links == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(links));
    }

    public static Entity of(UUID id, String name, long createdAtMillis, String content) {
        return new Entity(id, name, createdAtMillis, content, "", "", List.of(), Set.of());
    }

    public Entity withName(String newName) {
        return new Entity(id, newName, createdAtMillis, content, annotation, extractedText, tags, links);
    }

    public Entity withContent(String newContent) {
        return new Entity(id, name, createdAtMillis, newContent, annotation, extractedText, tags, links);
    }

    public Entity withAnnotation(String newAnnotation) {
        return new Entity(id, name, createdAtMillis, content, newAnnotation, extractedText, tags, links);
    }

    public Entity withExtractedText(String newText) {
        return new Entity(id, name, createdAtMillis, content, annotation, newText, tags, links);
    }

    public Entity withTags(List<String> newTags) {
        return new Entity(id, name, createdAtMillis, content, annotation, extractedText, newTags, links);
    }

    public Entity withCreatedAt(long millis) {
        return new Entity(id, name, millis, content, annotation, extractedText, tags, links);
    }

    public Entity withId(UUID newId) {
        return new Entity(newId, name, createdAtMillis, content, annotation, extractedText, tags, links);
    }

    public Entity withLinks(Set<UUID> newLinks) {
        return new Entity(id, name, createdAtMillis, content, annotation, extractedText, tags, newLinks);
    }

    public Entity withLink(UUID target) {
        Set<UUID> next = new LinkedHashSet<>(links);
        next.add(target);
        return withLinks(next);
    }

    public Entity withoutLink(UUID target) {
        Set<UUID> next = new LinkedHashSet<>(links);
        next.remove(target);
        return withLinks(next);
    }

    /** Replace a single link target, keeping the others. */
    public Entity withLinkRetargeted(UUID from, UUID to) {
        List<UUID> ordered = new ArrayList<>(links.size());
        for (UUID l : links) {
            ordered.add(l.equals(from) ? to : l);
        }
        return withLinks(new LinkedHashSet<>(ordered));
    }

    public boolean hasLinkTo(UUID target) {
        return links.contains(target);
    }

    /**
     * Rough in-memory footprint used for history byte budgets.
     * Strings count two bytes per char, ids sixteen bytes.
     */
    public long estimatedBytes() {
        long bytes = 16 + 8;
        bytes += 2L * (name.length() + content.length() + annotation.length() + extractedText.length());
        for (String t : tags) {
            bytes += 2L * t.length();
        }
        bytes += 16L * links.size();
        return bytes;
    }
}
