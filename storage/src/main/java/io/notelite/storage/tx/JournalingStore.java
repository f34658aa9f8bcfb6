package io.notelite.storage.tx;

import io.notelite.core.Entity;
import io.notelite.storage.EntityStore;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store view handed to operations during commit.
 * <p>
 * Every successful mutation is appended to the transaction journal with its
 * before/after values, so a failure at any point can be reversed precisely.
 * save() is reserved for the transaction manager.
 */
final class JournalingStore implements EntityStore {
    private final EntityStore delegate;
    private final List<AppliedChange> journal;
    private final boolean writable;

    JournalingStore(EntityStore delegate, List<AppliedChange> journal, boolean writable) {
        this.delegate = delegate;
        this.journal = journal;
        this.writable = writable;
    }

    @Override
    public Optional<Entity> find(UUID id) {
        return delegate.find(id);
    }

    @Override
    public List<Entity> findAll() {
        return delegate.findAll();
    }

    @Override
    public int count() {
        return delegate.count();
    }

    @Override
    public void insert(Entity entity) {
        checkWritable();
        delegate.insert(entity);
        journal.add(new AppliedChange(entity.id(), null, entity));
    }

    @Override
    public void update(Entity entity) {
        checkWritable();
        Entity before = delegate.find(entity.id())
                .orElseThrow(() -> new IllegalStateException("entity not found: " + entity.id()));
        delegate.update(entity);
        journal.add(new AppliedChange(entity.id(), before, entity));
    }

    @Override
    public void delete(UUID id) {
        checkWritable();
        Entity before = delegate.find(id)
                .orElseThrow(() -> new IllegalStateException("entity not found: " + id));
        delegate.delete(id);
        journal.add(new AppliedChange(id, before, null));
    }

    @Override
    public void save() {
        throw new UnsupportedOperationException("operations must not save; the transaction manager saves once on commit");
    }

    private void checkWritable() {
        if (!writable) {
            throw new IllegalStateException("read-only transaction cannot mutate the store");
        }
    }
}
