package io.notelite.storage.history;

import io.notelite.core.DeltaOperation;
import io.notelite.core.Entity;
import io.notelite.storage.tx.AppliedChange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Builds and shrinks delta payloads.
 * <p>
 * Responsibilities:
 *  - Turn a transaction journal into delta operations.
 *  - Diff two full states into the smallest operation list that maps one onto the other.
 *  - Coalesce a delta: fold all operations on one target into a single operation,
 *    drop no-ops, and express a single link retarget as a Move.
 * <p>
 * Operations on different targets are independent, so per-target folding keeps the
 * replay result identical.
 */
public final class DeltaCompactor {

    private DeltaCompactor() {
        // utility
    }

    /** Delta operations for a committed journal, in journal order. */
    public static List<DeltaOperation> fromJournal(List<AppliedChange> journal) {
        List<DeltaOperation> ops = new ArrayList<>(journal.size());
        for (AppliedChange c : journal) {
            if (c.created()) {
                ops.add(new DeltaOperation.Create(c.after()));
            } else if (c.deleted()) {
                ops.add(new DeltaOperation.Delete(c.before()));
            } else {
                ops.add(new DeltaOperation.Update(c.before(), c.after()));
            }
        }
        return ops;
    }

    /** Operations that turn state {@code from} into state {@code to}. Ids are visited in sorted order. */
    public static List<DeltaOperation> diff(Map<UUID, Entity> from, Map<UUID, Entity> to) {
        Set<UUID> ids = new TreeSet<>(from.keySet());
        ids.addAll(to.keySet());
        List<DeltaOperation> ops = new ArrayList<>();
        for (UUID id : ids) {
            DeltaOperation op = fold(from.get(id), to.get(id));
            if (op != null) {
                ops.add(op);
            }
        }
        return ops;
    }

    /**
     * Fold operations per target. Targets keep the order of their first appearance.
     * Groups that already contain a Move, and lone Merge operations, are kept as they are:
     * a Move does not carry full entity values, and a Merge records its sources.
     */
    public static List<DeltaOperation> coalesce(List<DeltaOperation> ops) {
        Map<UUID, List<DeltaOperation>> byTarget = new LinkedHashMap<>();
        for (DeltaOperation op : ops) {
            byTarget.computeIfAbsent(op.targetId(), k -> new ArrayList<>()).add(op);
        }
        List<DeltaOperation> out = new ArrayList<>(ops.size());
        for (List<DeltaOperation> group : byTarget.values()) {
            boolean keep = group.stream().anyMatch(op -> op instanceof DeltaOperation.Move)
                    || (group.size() == 1 && group.get(0) instanceof DeltaOperation.Merge);
            if (keep) {
                out.addAll(group);
                continue;
            }
            DeltaOperation folded = fold(beforeOf(group.get(0)), afterOf(group.get(group.size() - 1)));
            if (folded != null) {
                out.add(folded);
            }
        }
        return out;
    }

    // ---------- internals ----------

    private static DeltaOperation fold(Entity before, Entity after) {
        if (before == null && after == null) {
            return null;
        }
        if (before == null) {
            return new DeltaOperation.Create(after);
        }
        if (after == null) {
            return new DeltaOperation.Delete(before);
        }
        if (before.equals(after)) {
            return null;
        }
        DeltaOperation.Move move = asMove(before, after);
        return move != null ? move : new DeltaOperation.Update(before, after);
    }

    /** A Move when the two values differ only by one link pointing elsewhere. */
    private static DeltaOperation.Move asMove(Entity before, Entity after) {
        if (before.links().size() != after.links().size()) {
            return null;
        }
        Set<UUID> removed = new HashSet<>(before.links());
        removed.removeAll(after.links());
        Set<UUID> added = new HashSet<>(after.links());
        added.removeAll(before.links());
        if (removed.size() != 1 || added.size() != 1) {
            return null;
        }
        UUID from = removed.iterator().next();
        UUID to = added.iterator().next();
        // Move keeps link order, so only accept it when the replay reproduces `after` exactly.
        if (!before.withLinkRetargeted(from, to).equals(after)) {
            return null;
        }
        return new DeltaOperation.Move(before.id(), from, to);
    }

    private static Entity beforeOf(DeltaOperation op) {
        if (op instanceof DeltaOperation.Update u) return u.before();
        if (op instanceof DeltaOperation.Delete d) return d.before();
        if (op instanceof DeltaOperation.Merge m) return m.before();
        if (op instanceof DeltaOperation.Create) return null;
        throw new IllegalStateException("move has no full before value");
    }

    private static Entity afterOf(DeltaOperation op) {
        if (op instanceof DeltaOperation.Create c) return c.after();
        if (op instanceof DeltaOperation.Update u) return u.after();
        if (op instanceof DeltaOperation.Merge m) return m.after();
        if (op instanceof DeltaOperation.Delete) return null;
        throw new IllegalStateException("move has no full after value");
    }
}
