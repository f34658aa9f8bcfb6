package io.notelite.storage.dto;

import io.notelite.core.Entity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/** JSON shape of an {@link Entity}. */
public class EntityDto {
    public String id;
    public String name;
    public long createdAtMillis;
    public String content;
    public String annotation;
    public String extractedText;
    public List<String> tags;
    public List<String> links;

    public static EntityDto from(Entity e) {
        EntityDto dto = new EntityDto();
        dto.id = e.id().toString();
        dto.name = e.name();
        dto.createdAtMillis = e.createdAtMillis();
        dto.content = e.content();
        dto.annotation = e.annotation();
        dto.extractedText = e.extractedText();
        dto.tags = new ArrayList<>(e.tags());
        dto.links = new ArrayList<>(e.links().size());
        for (UUID l : e.links()) {
            dto.links.add(l.toString());
        }
        return dto;
    }

    public Entity toEntity() {
        if (id == null) {
            throw new IllegalArgumentException("entity id missing");
        }
        Set<UUID> linkIds = new LinkedHashSet<>();
        if (links != null) {
            for (String l : links) {
                linkIds.add(UUID.fromString(l));
            }
        }
        return new Entity(
                UUID.fromString(id),
                name,
                createdAtMillis,
                content,
                annotation,
                extractedText,
                tags,
                linkIds
        );
    }

    public static List<EntityDto> fromAll(List<Entity> entities) {
        List<EntityDto> out = new ArrayList<>(entities.size());
        for (Entity e : entities) {
            out.add(from(e));
        }
        return out;
    }

    public static List<Entity> toEntities(List<EntityDto> dtos) {
        if (dtos == null) {
            return List.of();
        }
        List<Entity> out = new ArrayList<>(dtos.size());
        for (EntityDto d : dtos) {
            out.add(d.toEntity());
        }
        return out;
    }
}
