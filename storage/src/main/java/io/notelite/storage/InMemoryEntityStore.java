package io.notelite.storage;

import io.notelite.core.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entity store that keeps everything in memory. save() only counts calls.
 * Used for tests and as the working set of {@link JsonFileEntityStore}.
 */
public class InMemoryEntityStore implements EntityStore {
    private final Map<UUID, Entity> mem = new ConcurrentHashMap<>();
    private final AtomicLong saves = new AtomicLong();

    public InMemoryEntityStore() {
    }

    public InMemoryEntityStore(Collection<Entity> initial) {
        for (Entity e : initial) {
            mem.put(e.id(), e);
        }
    }

    @Override
    public Optional<Entity> find(UUID id) {
        return Optional.ofNullable(mem.get(id));
    }

    @Override
    public List<Entity> findAll() {
        List<Entity> all = new ArrayList<>(mem.values());
        all.sort(Comparator.comparing(Entity::id));
        return List.copyOf(all);
    }

    @Override
    public int count() {
        return mem.size();
    }

    @Override
    public void insert(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        if (mem.putIfAbsent(entity.id(), entity) != null) {
            throw new IllegalStateException("entity already exists: " + entity.id());
        }
    }

    @Override
    public void update(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        if (mem.replace(entity.id(), entity) == null) {
            throw new IllegalStateException("entity not found: " + entity.id());
        }
    }

    @Override
    public void delete(UUID id) {
        if (mem.remove(id) == null) {
            throw new IllegalStateException("entity not found: " + id);
        }
    }

    @Override
    public void save() {
        saves.incrementAndGet();
    }

    /** Number of save() calls so far. */
    public long saveCount() {
        return saves.get();
    }

    /** Replace the working state wholesale; used when loading from disk. */
    protected void load(Collection<Entity> entities) {
        mem.clear();
        for (Entity e : entities) {
            mem.put(e.id(), e);
        }
    }
}
