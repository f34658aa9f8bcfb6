package io.notelite.server.consistency;

import io.notelite.core.ChangeKind;
import io.notelite.core.ChangeRecord;
import io.notelite.core.Entity;
import io.notelite.storage.EntityStore;
import io.notelite.storage.tx.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Translates accepted changes into transaction operations.
 * <p>
 * Field edits read the entity when the operation executes, so changes later in a batch
 * see the effect of earlier ones. Deleting an entity also removes every link pointing
 * at it.
 */
final class OperationPlanner {

    private OperationPlanner() {
        // utility
    }

    static List<Operation> plan(List<ChangeRecord> changes) {
        List<Operation> ops = new ArrayList<>(changes.size());
        for (ChangeRecord c : changes) {
            ops.add(toOperation(c.kind()));
        }
        return ops;
    }

    static Operation toOperation(ChangeKind kind) {
        if (kind instanceof ChangeKind.EntityCreated k) {
            return new Operation.Insert(k.entity());
        }
        if (kind instanceof ChangeKind.EntityDeleted k) {
            return new Operation.Custom("delete " + k.entityId() + " and links to it",
                    s -> deleteWithIncomingLinks(s, k.entityId()), false);
        }
        if (kind instanceof ChangeKind.EntityModified k) {
            return edit("modify " + k.entityId(), k.entityId(), e -> {
                Entity next = e;
                if (k.name() != null) next = next.withName(k.name());
                if (k.content() != null) next = next.withContent(k.content());
                return next;
            });
        }
        if (kind instanceof ChangeKind.LinkAdded k) {
            return new Operation.Custom("link " + k.from() + " -> " + k.to(), s -> {
                if (s.find(k.to()).isEmpty()) {
                    throw new IllegalStateException("link target not found: " + k.to());
                }
                Entity from = require(s, k.from());
                if (!from.hasLinkTo(k.to())) {
                    s.update(from.withLink(k.to()));
                }
            }, false);
        }
        if (kind instanceof ChangeKind.LinkRemoved k) {
            return new Operation.Custom("unlink " + k.from() + " -> " + k.to(), s -> {
                // the endpoint may be gone already when a delete cascaded
                s.find(k.from()).filter(e -> e.hasLinkTo(k.to()))
                        .ifPresent(e -> s.update(e.withoutLink(k.to())));
            }, false);
        }
        if (kind instanceof ChangeKind.AnnotationChanged k) {
            return edit("annotate " + k.entityId(), k.entityId(), e -> e.withAnnotation(k.annotation()));
        }
        if (kind instanceof ChangeKind.DerivedAnalysisUpdated k) {
            return edit("analysis " + k.entityId(), k.entityId(), e -> {
                Entity next = e;
                if (k.extractedText() != null) next = next.withExtractedText(k.extractedText());
                if (k.tags() != null) next = next.withTags(k.tags());
                return next;
            });
        }
        if (kind instanceof ChangeKind.MergedEdit k) {
            return edit("merged edit " + k.entityId(), k.entityId(), e -> {
                Entity next = e;
                if (k.annotation() != null) next = next.withAnnotation(k.annotation());
                if (k.extractedText() != null) next = next.withExtractedText(k.extractedText());
                if (k.tags() != null) next = next.withTags(k.tags());
                return next;
            });
        }
        if (kind instanceof ChangeKind.BulkImport k) {
            List<Operation> inserts = new ArrayList<>(k.entities().size());
            for (Entity e : k.entities()) {
                inserts.add(new Operation.Insert(e));
            }
            return new Operation.Batch("import " + inserts.size() + " entities", inserts);
        }
        throw new IllegalArgumentException("unsupported change kind " + kind.type());
    }

    // ---------- internals ----------

    @FunctionalInterface
    private interface Edit {
        Entity apply(Entity current);
    }

    private static Operation edit(String description, UUID id, Edit edit) {
        return new Operation.Custom(description, s -> {
            Entity current = require(s, id);
            Entity next = edit.apply(current);
            if (!next.equals(current)) {
                s.update(next);
            }
        }, false);
    }

    private static void deleteWithIncomingLinks(EntityStore store, UUID id) {
        require(store, id);
        for (Entity e : store.findAll()) {
            if (!e.id().equals(id) && e.hasLinkTo(id)) {
                store.update(e.withoutLink(id));
            }
        }
        store.delete(id);
    }

    private static Entity require(EntityStore store, UUID id) {
        return store.find(id).orElseThrow(() -> new IllegalStateException("entity not found: " + id));
    }
}
