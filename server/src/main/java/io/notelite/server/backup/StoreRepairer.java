package io.notelite.server.backup;

import io.notelite.core.Entity;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.server.integrity.DerivedDataValidator;
import io.notelite.server.integrity.EntityStructureValidator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Computes the repaired state of a store without touching it.
 * <p>
 * Repairs run in a fixed order, each only when its category was reported:
 *  1) schema violations: nil id replaced (links redirected), negative creation time reset;
 *     with {@link Scope#ALL} also future creation times clamped and tags cleaned;
 *  2) missing references: blank names replaced with {@code note_<8 hex chars>};
 *  3) orphaned data: entities without content removed, links to them stripped;
 *  4) duplicates: same name and content, the earliest entity is kept and links redirected to it;
 *  5) invalid relationships: links to missing entities and self links stripped.
 * Running the plan on its own output finds nothing left to repair.
 */
final class StoreRepairer {

    /** CRITICAL fixes only the conditions the integrity check reports as critical. */
    enum Scope { CRITICAL, ALL }

    /** Target state plus what was done to reach it. */
    record Plan(Map<UUID, Entity> target, Map<IssueCategory, Integer> repairs, List<String> actions) {
        int total() {
            return repairs.values().stream().mapToInt(Integer::intValue).sum();
        }
    }

    private final Map<UUID, Entity> state = new LinkedHashMap<>();
    private final Map<IssueCategory, Integer> repairs = new EnumMap<>(IssueCategory.class);
    private final List<String> actions = new ArrayList<>();

    private StoreRepairer(List<Entity> entities) {
        for (Entity e : entities) {
            if (e != null) {
                state.putIfAbsent(e.id(), e);
            }
        }
    }

    static Plan plan(List<Entity> entities, Set<IssueCategory> categories, Scope scope, Instant now) {
        StoreRepairer r = new StoreRepairer(entities);
        if (categories.contains(IssueCategory.SCHEMA_VIOLATION)) {
            r.repairSchema(scope, now);
        }
        if (categories.contains(IssueCategory.MISSING_REFERENCE)) {
            r.repairMissingNames();
        }
        if (categories.contains(IssueCategory.ORPHANED_DATA)) {
            r.removeOrphans();
        }
        if (categories.contains(IssueCategory.DUPLICATE)) {
            r.removeDuplicates();
        }
        if (categories.contains(IssueCategory.INVALID_RELATIONSHIP)) {
            r.stripInvalidLinks();
        }
        return new Plan(r.state, r.repairs, r.actions);
    }

    static String generatedName(UUID id) {
        return "note_" + id.toString().replace("-", "").substring(0, 8);
    }

    // ---------- steps ----------

    private void repairSchema(Scope scope, Instant now) {
        Entity nil = state.remove(Entity.NIL_ID);
        if (nil != null) {
            UUID fresh = UUID.randomUUID();
            state.put(fresh, nil.withId(fresh));
            redirectLinks(Entity.NIL_ID, fresh);
            count(IssueCategory.SCHEMA_VIOLATION, "Replaced nil id with " + fresh);
        }

        long nowMillis = now.toEpochMilli();
        long futureLimit = now.plus(EntityStructureValidator.FUTURE_TOLERANCE).toEpochMilli();
        for (Entity e : List.copyOf(state.values())) {
            Entity fixed = e;
            boolean future = scope == Scope.ALL && fixed.createdAtMillis() > futureLimit;
            if (fixed.createdAtMillis() < 0 || future) {
                fixed = fixed.withCreatedAt(nowMillis);
                count(IssueCategory.SCHEMA_VIOLATION, "Clamped creation time of " + e.id());
            }
            if (scope == Scope.ALL && !DerivedDataValidator.validTags(fixed.tags())) {
                fixed = fixed.withTags(DerivedDataValidator.cleanTags(fixed.tags()));
                count(IssueCategory.SCHEMA_VIOLATION, "Cleaned tags of " + e.id());
            }
            if (fixed != e) {
                state.put(e.id(), fixed);
            }
        }
    }

    private void repairMissingNames() {
        for (Entity e : List.copyOf(state.values())) {
            if (e.name().isBlank()) {
                String name = generatedName(e.id());
                state.put(e.id(), e.withName(name));
                count(IssueCategory.MISSING_REFERENCE, "Named " + e.id() + " " + name);
            }
        }
    }

    private void removeOrphans() {
        for (Entity e : List.copyOf(state.values())) {
            if (e.content().isBlank()) {
                state.remove(e.id());
                stripLinksTo(e.id());
                count(IssueCategory.ORPHANED_DATA, "Removed orphaned entity " + e.id());
            }
        }
    }

    private void removeDuplicates() {
        Map<String, List<Entity>> groups = new LinkedHashMap<>();
        for (Entity e : state.values()) {
            if (!e.name().isBlank() && !e.content().isBlank()) {
                groups.computeIfAbsent(e.name() + '\u0000' + e.content(), k -> new ArrayList<>()).add(e);
            }
        }
        for (List<Entity> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(Comparator.comparingLong(Entity::createdAtMillis).thenComparing(Entity::id));
            Entity keep = group.get(0);
            for (Entity dup : group.subList(1, group.size())) {
                state.remove(dup.id());
                redirectLinks(dup.id(), keep.id());
                count(IssueCategory.DUPLICATE, "Removed duplicate " + dup.id() + " of " + keep.id());
            }
        }
        // redirecting can make an entity point at itself
        rewrite(e -> e.hasLinkTo(e.id()) ? e.withoutLink(e.id()) : e);
    }

    private void stripInvalidLinks() {
        for (Entity e : List.copyOf(state.values())) {
            Set<UUID> valid = new LinkedHashSet<>();
            for (UUID target : e.links()) {
                if (!target.equals(e.id()) && state.containsKey(target)) {
                    valid.add(target);
                }
            }
            if (valid.size() != e.links().size()) {
                state.put(e.id(), e.withLinks(valid));
                count(IssueCategory.INVALID_RELATIONSHIP,
                        "Stripped " + (e.links().size() - valid.size()) + " invalid link(s) from " + e.id());
            }
        }
    }

    // ---------- internals ----------

    private void redirectLinks(UUID from, UUID to) {
        rewrite(e -> e.hasLinkTo(from) ? e.withLinkRetargeted(from, to) : e);
    }

    private void stripLinksTo(UUID target) {
        rewrite(e -> e.hasLinkTo(target) ? e.withoutLink(target) : e);
    }

    private void rewrite(UnaryOperator<Entity> fn) {
        for (Entity e : List.copyOf(state.values())) {
            Entity next = fn.apply(e);
            if (next != e) {
                state.put(e.id(), next);
            }
        }
    }

    private void count(IssueCategory category, String action) {
        repairs.merge(category, 1, Integer::sum);
        actions.add(action);
    }
}
