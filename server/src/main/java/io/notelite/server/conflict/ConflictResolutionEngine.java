package io.notelite.server.conflict;

import io.notelite.core.ChangeKind;
import io.notelite.core.ChangeOrigin;
import io.notelite.core.ChangeRecord;
import io.notelite.core.DataVersion;
import io.notelite.core.Entity;
import io.notelite.core.EntityField;
import io.notelite.core.conflict.ConflictResolution;
import io.notelite.core.conflict.ConflictSeverity;
import io.notelite.core.conflict.ConflictType;
import io.notelite.core.conflict.DataConflict;
import io.notelite.core.conflict.ResolutionStrategy;
import io.notelite.storage.EntityStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Detects collisions between changes and decides which of them may proceed.
 * <p>
 * Responsibilities:
 *  - Keep a bounded window of recently accepted changes (with the version each one
 *    landed in) and compare every incoming change against it, against the other
 *    members of its batch, and against the live store.
 *  - Classify each collision (simultaneous edit, user vs derived, version mismatch,
 *    integrity violation) with a severity and an auto-resolvable flag.
 *  - Resolve a set of conflicts by dispatching each one to exactly one
 *    {@link ResolutionStrategy} through {@link #resolve(ResolutionStrategy, DataConflict)}.
 * <p>
 * Every change that takes part in a conflict ends up accepted or rejected. When any
 * conflict is not auto-resolvable the whole set is rejected and reported for manual
 * resolution instead of being guessed.
 * <p>
 * A change from the recent window that loses a resolution is reported as rejected but
 * it is already applied; the caller only applies accepted changes it has not applied yet.
 */
public final class ConflictResolutionEngine {
    private static final Logger log = Logger.getLogger(ConflictResolutionEngine.class.getName());

    public static final Duration DEFAULT_SIMULTANEOUS_WINDOW = Duration.ofSeconds(5);
    public static final Duration DEFAULT_BUSINESS_WINDOW = Duration.ofSeconds(60);
    public static final int DEFAULT_HISTORY_CAPACITY = 100;
    static final int RECENT_CAPACITY = 500;

    /** Resolves a version id to its sequence; empty when the version is unknown. */
    @FunctionalInterface
    public interface VersionLookup {
        OptionalLong sequenceOf(String versionId);
    }

    private record Accepted(ChangeRecord change, long versionSequence) {}

    /** Result of one strategy applied to one conflict. */
    private record Outcome(
            ResolutionStrategy strategy,
            List<ChangeRecord> accepted,
            List<ChangeRecord> rejected,
            List<ChangeRecord> synthesized
    ) {
        static Outcome of(ResolutionStrategy strategy, List<ChangeRecord> accepted, List<ChangeRecord> rejected) {
            return new Outcome(strategy, accepted, rejected, List.of());
        }
    }

    private final EntityStore store;
    private final VersionLookup versions;
    private final Duration simultaneousWindow;
    private final Duration businessWindow;
    private final int historyCapacity;
    private final Clock clock;

    private final Deque<Accepted> recent = new ArrayDeque<>();
    private final Deque<ConflictResolution> history = new ArrayDeque<>();
    private final ConflictMetrics metrics = new ConflictMetrics();

    public ConflictResolutionEngine(EntityStore store, VersionLookup versions) {
        this(store, versions, DEFAULT_SIMULTANEOUS_WINDOW, DEFAULT_BUSINESS_WINDOW,
                DEFAULT_HISTORY_CAPACITY, Clock.systemUTC());
    }

    public ConflictResolutionEngine(
            EntityStore store,
            VersionLookup versions,
            Duration simultaneousWindow,
            Duration businessWindow,
            int historyCapacity,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.versions = Objects.requireNonNull(versions, "versions");
        this.simultaneousWindow = Objects.requireNonNull(simultaneousWindow, "simultaneousWindow");
        this.businessWindow = Objects.requireNonNull(businessWindow, "businessWindow");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (simultaneousWindow.isNegative() || businessWindow.isNegative()) {
            throw new IllegalArgumentException("conflict windows must be >= 0");
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be > 0");
        }
        this.historyCapacity = historyCapacity;
    }

    // ---------- detection ----------

    /** Conflicts of a single change against recently accepted changes and the store. */
    public List<DataConflict> detectConflicts(ChangeRecord change) {
        return detectConflicts(List.of(change));
    }

    /**
     * Conflicts of a batch submitted together.
     * Each member is checked against the recent window, against earlier batch members
     * for time-based rules, and against the whole batch for structural rules.
     */
    public synchronized List<DataConflict> detectConflicts(List<ChangeRecord> batch) {
        Objects.requireNonNull(batch, "batch");
        List<DataConflict> found = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            ChangeRecord change = batch.get(i);
            for (Accepted a : recent) {
                if (a.change().id().equals(change.id()) || !a.change().overlaps(change)) {
                    continue;
                }
                DataConflict c = temporalConflict(a.change(), change);
                if (c == null) {
                    c = versionConflict(a, change);
                }
                if (c != null) {
                    found.add(c);
                }
            }
            for (int j = 0; j < i; j++) {
                ChangeRecord earlier = batch.get(j);
                if (earlier.overlaps(change)) {
                    DataConflict c = temporalConflict(earlier, change);
                    if (c != null) {
                        found.add(c);
                    }
                }
            }
            List<ChangeRecord> others = new ArrayList<>(batch);
            others.remove(i);
            DataConflict structural = integrityConflict(change, others);
            if (structural != null) {
                found.add(structural);
            }
        }
        metrics.recordDetected(found);
        if (!found.isEmpty()) {
            log.fine(() -> "Detected " + found.size() + " conflict(s) in batch of " + batch.size());
        }
        return found;
    }

    /** Remember an applied change so later changes are compared against it. */
    public synchronized void recordAccepted(ChangeRecord change, DataVersion version) {
        Objects.requireNonNull(change, "change");
        Objects.requireNonNull(version, "version");
        recent.addLast(new Accepted(change, version.sequence()));
        Instant horizon = clock.instant().minus(businessWindow);
        while (recent.size() > RECENT_CAPACITY
                || (!recent.isEmpty() && recent.peekFirst().change().timestamp().isBefore(horizon))) {
            recent.removeFirst();
        }
    }

    /** Forget the recent window; used after restore, when the accepted changes no longer describe the store. */
    public synchronized void clearRecent() {
        recent.clear();
    }

    // ---------- resolution ----------

    public synchronized ConflictResolution resolveConflicts(List<DataConflict> conflicts) {
        Objects.requireNonNull(conflicts, "conflicts");
        Instant now = clock.instant();

        List<DataConflict> manual = conflicts.stream().filter(c -> !c.autoResolvable()).toList();
        ConflictResolution resolution;
        if (conflicts.isEmpty()) {
            resolution = new ConflictResolution(UUID.randomUUID(), List.of(), List.of(), List.of(),
                    List.of(), true, List.of(), now);
        } else if (!manual.isEmpty()) {
            Map<UUID, ChangeRecord> involved = new LinkedHashMap<>();
            for (DataConflict c : conflicts) {
                for (ChangeRecord ch : c.changes()) {
                    involved.putIfAbsent(ch.id(), ch);
                }
            }
            List<String> details = manual.stream().map(DataConflict::describe).toList();
            resolution = new ConflictResolution(UUID.randomUUID(), conflicts, List.of(),
                    List.copyOf(involved.values()), List.of(), false, details, now);
            metrics.recordManual(involved.size());
            log.info("Conflict set needs manual resolution: " + manual.size() + " of "
                    + conflicts.size() + " conflict(s) cannot be resolved automatically");
        } else {
            resolution = resolveAutomatically(conflicts, now);
        }

        history.addLast(resolution);
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
        return resolution;
    }

    /**
     * Strategy used for a conflict: the preferred one for its type, or the first
     * strategy in priority order that declares the type.
     */
    public ResolutionStrategy selectStrategy(DataConflict conflict) {
        ResolutionStrategy preferred = ResolutionStrategy.preferredFor(conflict.type());
        if (conflict.type() == ConflictType.SIMULTANEOUS_EDIT && mergeablePair(conflict)) {
            preferred = ResolutionStrategy.CONTENT_MERGE;
        }
        if (preferred.canResolve(conflict.type())) {
            return preferred;
        }
        for (ResolutionStrategy s : ResolutionStrategy.values()) {
            if (s.canResolve(conflict.type())) {
                return s;
            }
        }
        return ResolutionStrategy.SEMANTIC_MERGE;
    }

    /** Every strategy that declares the conflict's type, most confident first. */
    public List<ResolutionSuggestion> suggestionsFor(DataConflict conflict) {
        List<ResolutionSuggestion> out = new ArrayList<>();
        for (ResolutionStrategy s : ResolutionStrategy.values()) {
            if (!s.canResolve(conflict.type())) {
                continue;
            }
            double confidence = s.baseConfidence();
            String rationale = switch (s) {
                case USER_PRIORITY -> "keep the user's edits";
                case CONTENT_MERGE -> "combine edits on disjoint fields";
                case TIMESTAMP -> "keep the most recent edit";
                case CONFIDENCE -> "keep the edit with the highest producer confidence";
                case SEMANTIC_MERGE -> "accept edits after repairing relationships";
            };
            if (s == ResolutionStrategy.CONTENT_MERGE && !(mergeablePair(conflict) && disjointFields(conflict))) {
                confidence = 0.3;
                rationale = "edits touch the same fields";
            }
            out.add(new ResolutionSuggestion(s, confidence, rationale));
        }
        out.sort(Comparator.comparingDouble(ResolutionSuggestion::confidence).reversed());
        return out;
    }

    /** Most recent resolutions, oldest first. */
    public synchronized List<ConflictResolution> resolutionHistory() {
        return List.copyOf(history);
    }

    public synchronized int recentCount() {
        return recent.size();
    }

    /** True if the change is still in the recent window, i.e. it was applied already. */
    public synchronized boolean isRecent(UUID changeId) {
        for (Accepted a : recent) {
            if (a.change().id().equals(changeId)) {
                return true;
            }
        }
        return false;
    }

    public ConflictMetrics metrics() {
        return metrics;
    }

    // ---------- internals: detection ----------

    private DataConflict temporalConflict(ChangeRecord earlier, ChangeRecord incoming) {
        if (earlier.origin() == ChangeOrigin.SYSTEM || incoming.origin() == ChangeOrigin.SYSTEM) {
            return null;
        }
        if (!contend(earlier, incoming)) {
            return null;
        }
        Duration gap = Duration.between(earlier.timestamp(), incoming.timestamp()).abs();
        boolean near = gap.compareTo(simultaneousWindow) <= 0;

        if (earlier.origin() != incoming.origin()) {
            ChangeRecord user = earlier.userInitiated() ? earlier : incoming;
            ChangeRecord derived = user == earlier ? incoming : earlier;
            Duration after = Duration.between(user.timestamp(), derived.timestamp());
            boolean deferring = !after.isNegative() && after.compareTo(businessWindow) <= 0;
            if (near || deferring) {
                return DataConflict.of(List.of(earlier, incoming), ConflictType.USER_VS_DERIVED,
                        ConflictSeverity.MEDIUM, true, null,
                        "derived change " + after.toMillis() + "ms after a user edit");
            }
            return null;
        }
        if (near) {
            ConflictSeverity severity = incoming.userInitiated() ? ConflictSeverity.HIGH : ConflictSeverity.LOW;
            return DataConflict.of(List.of(earlier, incoming), ConflictType.SIMULTANEOUS_EDIT,
                    severity, true, null, "edits " + gap.toMillis() + "ms apart");
        }
        return null;
    }

    private DataConflict versionConflict(Accepted accepted, ChangeRecord incoming) {
        if (incoming.baseVersionId() == null || !contend(accepted.change(), incoming)) {
            return null;
        }
        OptionalLong base = versions.sequenceOf(incoming.baseVersionId());
        if (base.isPresent() && base.getAsLong() >= accepted.versionSequence()) {
            return null;
        }
        String basis = base.isPresent() ? "version " + base.getAsLong() : "an unknown version";
        return DataConflict.of(List.of(accepted.change(), incoming), ConflictType.VERSION_MISMATCH,
                ConflictSeverity.MEDIUM, true, null,
                "based on " + basis + " but the entity changed in version " + accepted.versionSequence());
    }

    /**
     * True when two changes with overlapping entity ids collide in time. Creations
     * never collide, and link changes against deletes are left to the structural check.
     */
    private static boolean contend(ChangeRecord a, ChangeRecord b) {
        ChangeKind x = a.kind();
        ChangeKind y = b.kind();
        if (creates(x) || creates(y)) {
            return false;
        }
        boolean linkVsDelete = (isLink(x) && y instanceof ChangeKind.EntityDeleted)
                || (isLink(y) && x instanceof ChangeKind.EntityDeleted);
        return !linkVsDelete;
    }

    private DataConflict integrityConflict(ChangeRecord change, List<ChangeRecord> others) {
        ChangeKind kind = change.kind();
        if (kind instanceof ChangeKind.EntityDeleted d) {
            return deleteConflict(change, d.entityId(), others);
        }
        if (kind instanceof ChangeKind.LinkAdded l) {
            if (l.from().equals(l.to())) {
                return DataConflict.of(List.of(change), ConflictType.INTEGRITY_VIOLATION,
                        ConflictSeverity.MEDIUM, false, null, "link from " + l.from() + " targets itself");
            }
            if (deletedBy(l.from(), others) || deletedBy(l.to(), others)) {
                return null; // reported with the delete
            }
            if (!exists(l.from(), others) || !exists(l.to(), others)) {
                return DataConflict.of(List.of(change), ConflictType.INTEGRITY_VIOLATION,
                        ConflictSeverity.MEDIUM, true, null, "link endpoint does not exist");
            }
            if (reaches(l.to(), l.from(), others)) {
                return DataConflict.of(List.of(change), ConflictType.INTEGRITY_VIOLATION,
                        ConflictSeverity.MEDIUM, false, null,
                        "link " + l.from() + " -> " + l.to() + " closes a cycle");
            }
            return null;
        }
        if (kind instanceof ChangeKind.LinkRemoved l) {
            if (deletedBy(l.from(), others) || deletedBy(l.to(), others)) {
                return null;
            }
            if (!linkExists(l.from(), l.to(), others)) {
                return DataConflict.of(List.of(change), ConflictType.INTEGRITY_VIOLATION,
                        ConflictSeverity.MEDIUM, true, null, "link " + l.from() + " -> " + l.to() + " does not exist");
            }
            return null;
        }
        if (kind instanceof ChangeKind.EntityCreated || kind instanceof ChangeKind.BulkImport) {
            for (UUID id : kind.affectedIds()) {
                if (store.find(id).isPresent()) {
                    return DataConflict.of(List.of(change), ConflictType.INTEGRITY_VIOLATION,
                            ConflictSeverity.MEDIUM, true, null, "entity " + id + " already exists");
                }
            }
            return null;
        }
        // field edits
        for (UUID id : kind.affectedIds()) {
            if (!exists(id, others)) {
                return DataConflict.of(List.of(change), ConflictType.INTEGRITY_VIOLATION,
                        ConflictSeverity.MEDIUM, true, null, "entity " + id + " does not exist");
            }
        }
        return null;
    }

    private DataConflict deleteConflict(ChangeRecord change, UUID id, List<ChangeRecord> others) {
        Set<UUID> linked = new LinkedHashSet<>();
        store.find(id).ifPresent(e -> linked.addAll(e.links()));
        for (Entity e : store.findAll()) {
            if (e.hasLinkTo(id)) {
                linked.add(e.id());
            }
        }
        List<ChangeRecord> involved = new ArrayList<>();
        involved.add(change);
        for (ChangeRecord other : others) {
            if (isLink(other.kind()) && other.affectedIds().contains(id)) {
                involved.add(other);
                linked.addAll(other.affectedIds());
            }
        }
        linked.remove(id);
        if (linked.isEmpty()) {
            return null;
        }
        return DataConflict.of(involved, ConflictType.INTEGRITY_VIOLATION, ConflictSeverity.HIGH, true, linked,
                "deleting " + id + " which still has " + linked.size() + " active link(s)");
    }

    private boolean exists(UUID id, List<ChangeRecord> pending) {
        if (store.find(id).isPresent()) {
            return true;
        }
        for (ChangeRecord c : pending) {
            if (creates(c.kind()) && c.affectedIds().contains(id)) {
                return true;
            }
        }
        return false;
    }

    private boolean linkExists(UUID from, UUID to, List<ChangeRecord> pending) {
        if (store.find(from).map(e -> e.hasLinkTo(to)).orElse(false)) {
            return true;
        }
        for (ChangeRecord c : pending) {
            if (c.kind() instanceof ChangeKind.LinkAdded l && l.from().equals(from) && l.to().equals(to)) {
                return true;
            }
        }
        return false;
    }

    /** Breadth-first walk over stored links plus pending additions. */
    private boolean reaches(UUID start, UUID target, List<ChangeRecord> pending) {
        Deque<UUID> queue = new ArrayDeque<>();
        Set<UUID> seen = new HashSet<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            UUID at = queue.removeFirst();
            if (at.equals(target)) {
                return true;
            }
            if (!seen.add(at)) {
                continue;
            }
            store.find(at).ifPresent(e -> queue.addAll(e.links()));
            for (ChangeRecord c : pending) {
                if (c.kind() instanceof ChangeKind.LinkAdded l && l.from().equals(at)) {
                    queue.add(l.to());
                }
            }
        }
        return false;
    }

    private static boolean deletedBy(UUID id, List<ChangeRecord> pending) {
        for (ChangeRecord c : pending) {
            if (c.kind() instanceof ChangeKind.EntityDeleted d && d.entityId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    private static boolean creates(ChangeKind kind) {
        return kind instanceof ChangeKind.EntityCreated || kind instanceof ChangeKind.BulkImport;
    }

    private static boolean isLink(ChangeKind kind) {
        return kind instanceof ChangeKind.LinkAdded || kind instanceof ChangeKind.LinkRemoved;
    }

    // ---------- internals: resolution ----------

    private ConflictResolution resolveAutomatically(List<DataConflict> conflicts, Instant now) {
        Map<UUID, ChangeRecord> accepted = new LinkedHashMap<>();
        Map<UUID, ChangeRecord> rejected = new LinkedHashMap<>();
        Set<ChangeKind> synthesizedKinds = new HashSet<>();
        List<ResolutionStrategy> used = new ArrayList<>();

        for (DataConflict conflict : conflicts) {
            Outcome outcome = resolve(selectStrategy(conflict), conflict);
            used.add(outcome.strategy());
            for (ChangeRecord c : outcome.accepted()) {
                accepted.putIfAbsent(c.id(), c);
            }
            for (ChangeRecord c : outcome.synthesized()) {
                // two deletes can cascade into the same link removal
                if (synthesizedKinds.add(c.kind())) {
                    accepted.putIfAbsent(c.id(), c);
                }
            }
            for (ChangeRecord c : outcome.rejected()) {
                rejected.putIfAbsent(c.id(), c);
            }
        }
        // rejected anywhere means rejected overall
        accepted.keySet().removeAll(rejected.keySet());

        metrics.recordAutoResolved(used, rejected.size());
        log.fine(() -> "Resolved " + conflicts.size() + " conflict(s) with " + used
                + ": accepted " + accepted.size() + ", rejected " + rejected.size());
        return new ConflictResolution(UUID.randomUUID(), conflicts, List.copyOf(accepted.values()),
                List.copyOf(rejected.values()), used, true, List.of(), now);
    }

    /** The single dispatch point from strategy to behaviour. */
    private Outcome resolve(ResolutionStrategy strategy, DataConflict conflict) {
        return switch (strategy) {
            case USER_PRIORITY -> userPriority(conflict);
            case CONTENT_MERGE -> contentMerge(conflict);
            case TIMESTAMP -> latestWins(conflict);
            case CONFIDENCE -> highestConfidence(conflict);
            case SEMANTIC_MERGE -> semanticMerge(conflict);
        };
    }

    private Outcome userPriority(DataConflict conflict) {
        List<ChangeRecord> users = conflict.changes().stream().filter(ChangeRecord::userInitiated).toList();
        if (users.isEmpty()) {
            return latestWins(conflict);
        }
        List<ChangeRecord> others = conflict.changes().stream().filter(c -> !c.userInitiated()).toList();
        return Outcome.of(ResolutionStrategy.USER_PRIORITY, users, others);
    }

    private Outcome contentMerge(DataConflict conflict) {
        if (!mergeablePair(conflict) || !disjointFields(conflict)) {
            return userPriority(conflict);
        }
        ChangeRecord a = conflict.changes().get(0);
        ChangeRecord b = conflict.changes().get(1);
        ChangeKind.MergedEdit merged = mergeKinds(a.kind(), b.kind());
        if (merged == null) {
            return userPriority(conflict);
        }
        ChangeOrigin origin = a.userInitiated() || b.userInitiated() ? ChangeOrigin.USER : ChangeOrigin.DERIVED;
        Instant at = a.timestamp().isAfter(b.timestamp()) ? a.timestamp() : b.timestamp();
        ChangeRecord result = new ChangeRecord(UUID.randomUUID(), merged, at, origin,
                Math.max(a.confidence(), b.confidence()), null,
                "Merged: " + a.description() + " + " + b.description());
        return new Outcome(ResolutionStrategy.CONTENT_MERGE, List.of(), List.of(a, b), List.of(result));
    }

    private Outcome latestWins(DataConflict conflict) {
        List<ChangeRecord> changes = conflict.changes();
        ChangeRecord winner = changes.get(0);
        for (ChangeRecord c : changes) {
            // ties go to the later entry
            if (!c.timestamp().isBefore(winner.timestamp())) {
                winner = c;
            }
        }
        return Outcome.of(ResolutionStrategy.TIMESTAMP, List.of(winner), without(changes, winner));
    }

    private Outcome highestConfidence(DataConflict conflict) {
        List<ChangeRecord> changes = conflict.changes();
        ChangeRecord winner = changes.get(0);
        for (ChangeRecord c : changes) {
            int cmp = Double.compare(c.confidence(), winner.confidence());
            if (cmp > 0 || (cmp == 0 && !c.timestamp().isBefore(winner.timestamp()))) {
                winner = c;
            }
        }
        return Outcome.of(ResolutionStrategy.CONFIDENCE, List.of(winner), without(changes, winner));
    }

    /**
     * Deletes go through and cascade into explicit link removals; link changes that
     * touch a deleted entity, and changes that no longer apply to the store, are rejected.
     */
    private Outcome semanticMerge(DataConflict conflict) {
        Set<UUID> deleted = new HashSet<>();
        for (ChangeRecord c : conflict.changes()) {
            if (c.kind() instanceof ChangeKind.EntityDeleted d) {
                deleted.add(d.entityId());
            }
        }

        List<ChangeRecord> accepted = new ArrayList<>();
        List<ChangeRecord> rejected = new ArrayList<>();
        List<ChangeRecord> cascade = new ArrayList<>();
        Set<ChangeKind> cascaded = new HashSet<>();
        for (ChangeRecord c : conflict.changes()) {
            ChangeKind kind = c.kind();
            if (kind instanceof ChangeKind.EntityDeleted d) {
                accepted.add(c);
                for (ChangeKind.LinkRemoved removal : activeLinks(d.entityId())) {
                    if (cascaded.add(removal)) {
                        cascade.add(new ChangeRecord(UUID.randomUUID(), removal, c.timestamp(),
                                ChangeOrigin.SYSTEM, ChangeOrigin.SYSTEM.defaultConfidence(), null,
                                "Removed link " + removal.from() + " -> " + removal.to() + " of deleted entity"));
                    }
                }
            } else if (isLink(kind) && !Collections.disjoint(kind.affectedIds(), deleted)) {
                rejected.add(c);
            } else if (appliesToStore(kind)) {
                accepted.add(c);
            } else {
                rejected.add(c);
            }
        }
        return new Outcome(ResolutionStrategy.SEMANTIC_MERGE, accepted, rejected, cascade);
    }

    private List<ChangeKind.LinkRemoved> activeLinks(UUID id) {
        List<ChangeKind.LinkRemoved> out = new ArrayList<>();
        store.find(id).ifPresent(e -> e.links().forEach(to -> out.add(new ChangeKind.LinkRemoved(id, to))));
        for (Entity e : store.findAll()) {
            if (!e.id().equals(id) && e.hasLinkTo(id)) {
                out.add(new ChangeKind.LinkRemoved(e.id(), id));
            }
        }
        return out;
    }

    /** Store-only validity; pending context was already considered during detection. */
    private boolean appliesToStore(ChangeKind kind) {
        if (kind instanceof ChangeKind.LinkAdded l) {
            return !l.from().equals(l.to())
                    && store.find(l.from()).isPresent()
                    && store.find(l.to()).isPresent();
        }
        if (kind instanceof ChangeKind.LinkRemoved l) {
            return store.find(l.from()).map(e -> e.hasLinkTo(l.to())).orElse(false);
        }
        if (creates(kind)) {
            return kind.affectedIds().stream().noneMatch(id -> store.find(id).isPresent());
        }
        return kind.affectedIds().stream().allMatch(id -> store.find(id).isPresent());
    }

    private static boolean mergeablePair(DataConflict conflict) {
        List<ChangeRecord> changes = conflict.changes();
        return changes.size() == 2
                && changes.get(0).kind().mergeable()
                && changes.get(1).kind().mergeable()
                && changes.get(0).affectedIds().equals(changes.get(1).affectedIds());
    }

    private static boolean disjointFields(DataConflict conflict) {
        Set<EntityField> a = conflict.changes().get(0).kind().touchedFields();
        Set<EntityField> b = conflict.changes().get(1).kind().touchedFields();
        return Collections.disjoint(a, b);
    }

    private static ChangeKind.MergedEdit mergeKinds(ChangeKind a, ChangeKind b) {
        UUID entityId = a.affectedIds().iterator().next();
        String annotation = null;
        String extractedText = null;
        List<String> tags = null;
        for (ChangeKind k : List.of(a, b)) {
            if (k instanceof ChangeKind.AnnotationChanged ac) {
                annotation = ac.annotation();
            } else if (k instanceof ChangeKind.DerivedAnalysisUpdated du) {
                extractedText = du.extractedText() != null ? du.extractedText() : extractedText;
                tags = du.tags() != null ? du.tags() : tags;
            } else if (k instanceof ChangeKind.MergedEdit me) {
                annotation = me.annotation() != null ? me.annotation() : annotation;
                extractedText = me.extractedText() != null ? me.extractedText() : extractedText;
                tags = me.tags() != null ? me.tags() : tags;
            } else {
                return null;
            }
        }
        return new ChangeKind.MergedEdit(entityId, annotation, extractedText, tags);
    }

    private static List<ChangeRecord> without(List<ChangeRecord> changes, ChangeRecord winner) {
        return changes.stream().filter(c -> !c.id().equals(winner.id())).toList();
    }
}
