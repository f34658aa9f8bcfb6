package io.notelite.storage;

import io.notelite.core.Entity;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Minimal persistent object store the consistency core sits on.
 * <p>
 * Semantics:
 *  - insert/update/delete change the in-memory working state only.
 *  - save() makes the working state durable in one step; callers batch
 *    all mutations of a transaction before calling it.
 *  - insert fails if the id exists, update and delete fail if it does not.
 *  - findAll() returns an immutable copy ordered by id.
 */
public interface EntityStore {

    Optional<Entity> find(UUID id);

    List<Entity> findAll();

    int count();

    void insert(Entity entity);

    void update(Entity entity);

    void delete(UUID id);

    /** Persist the working state. */
    void save();
}
