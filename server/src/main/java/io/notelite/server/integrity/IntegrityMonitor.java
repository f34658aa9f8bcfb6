package io.notelite.server.integrity;

import io.notelite.core.Entity;
import io.notelite.core.integrity.HealthStatus;
import io.notelite.core.integrity.IntegrityIssue;
import io.notelite.core.integrity.IssueCategory;
import io.notelite.core.integrity.IssueSeverity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Runs the validator battery and keeps the latest health picture.
 * <p>
 * Responsibilities:
 *  - Comprehensive check: every validator, then a cross-validation pass that emits one
 *    CORRELATED warning per entity reported by two or more validators.
 *  - Quick check: only validators flagged critical, only their critical findings.
 *  - Targeted check of a set of entity ids.
 * <p>
 * The monitor only reports. Repairs are requested by whoever consumes the reports
 * (see {@link IntegrityDaemon}).
 */
public final class IntegrityMonitor {
    private static final Logger log = Logger.getLogger(IntegrityMonitor.class.getName());

    static final String CROSS_VALIDATION = "cross-validation";

    private final EntitySource source;
    private final List<IntegrityValidator> validators;
    private final Clock clock;
    private final IntegrityMetrics metrics = new IntegrityMetrics();

    private HealthStatus status;
    private List<IntegrityIssue> activeIssues = List.of();
    private Instant lastCheck;
    private Instant lastFullCheck;

    public IntegrityMonitor(EntitySource source, List<IntegrityValidator> validators, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.validators = List.copyOf(validators);
        this.clock = Objects.requireNonNull(clock, "clock");
        if (this.validators.isEmpty()) {
            throw new IllegalArgumentException("at least one validator is required");
        }
    }

    /** The standard battery. */
    public static List<IntegrityValidator> defaultValidators(CacheConsistencyValidator cacheValidator) {
        return List.of(
                new EntityStructureValidator(),
                new RelationshipValidator(),
                new DerivedDataValidator(),
                cacheValidator,
                new StorageIntegrityValidator()
        );
    }

    public IntegrityReport performComprehensiveCheck() {
        long start = System.nanoTime();
        ValidationContext ctx = read();

        List<IntegrityIssue> issues = new ArrayList<>();
        int clean = 0;
        for (IntegrityValidator v : validators) {
            List<IntegrityIssue> found = v.validate(ctx);
            issues.addAll(found);
            if (found.isEmpty()) {
                clean++;
            }
            log.fine(() -> "Validator " + v.name() + " reported " + found.size() + " issue(s)");
        }
        issues.addAll(crossValidate(issues));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        HealthStatus health = HealthStatus.of(issues);
        IntegrityReport report = new IntegrityReport(issues, health, validators.size(), clean,
                ctx.checkedAt(), elapsed);

        synchronized (this) {
            status = health;
            activeIssues = issues.stream().filter(i -> i.severity() != IssueSeverity.INFO).toList();
            lastCheck = ctx.checkedAt();
            lastFullCheck = ctx.checkedAt();
        }
        metrics.recordFull(elapsed, issues.size(), report.criticalIssues().size());
        log.info("Comprehensive integrity check: " + health + " with " + issues.size()
                + " issue(s) in " + elapsed.toMillis() + "ms");
        return report;
    }

    public QuickCheckResult performQuickCheck() {
        long start = System.nanoTime();
        ValidationContext ctx = read();

        List<IntegrityIssue> critical = new ArrayList<>();
        for (IntegrityValidator v : validators) {
            if (v.isCritical()) {
                for (IntegrityIssue issue : v.validateCritical(ctx)) {
                    if (issue.critical()) {
                        critical.add(issue);
                    }
                }
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        synchronized (this) {
            lastCheck = ctx.checkedAt();
            if (!critical.isEmpty()) {
                status = HealthStatus.CRITICAL;
                List<IntegrityIssue> merged = new ArrayList<>(activeIssues);
                for (IntegrityIssue issue : critical) {
                    if (!merged.contains(issue)) {
                        merged.add(issue);
                    }
                }
                activeIssues = List.copyOf(merged);
            }
        }
        metrics.recordQuick(elapsed, critical.size());
        if (!critical.isEmpty()) {
            log.warning("Quick integrity check found " + critical.size() + " critical issue(s)");
        }
        return new QuickCheckResult(critical.isEmpty(), critical.size(), critical, elapsed);
    }

    /**
     * Issues touching the given entities. Ids that do not exist are reported as
     * missing references.
     */
    public List<IntegrityIssue> checkEntities(Collection<UUID> ids) {
        Set<UUID> wanted = new LinkedHashSet<>(ids);
        ValidationContext ctx = read();
        List<IntegrityIssue> out = new ArrayList<>();
        if (!ctx.readable()) {
            for (IntegrityValidator v : validators) {
                out.addAll(v.validate(ctx));
            }
            return out;
        }

        Set<UUID> present = new HashSet<>();
        for (Entity e : ctx.entities()) {
            if (e != null && wanted.contains(e.id())) {
                present.add(e.id());
            }
        }
        for (UUID id : wanted) {
            if (!present.contains(id)) {
                out.add(new IntegrityIssue(IssueSeverity.WARNING, "Entity " + id + " not found",
                        Set.of(id), IssueCategory.MISSING_REFERENCE, "targeted"));
            }
        }
        for (IntegrityValidator v : validators) {
            for (IntegrityIssue issue : v.validate(ctx)) {
                if (!Collections.disjoint(issue.affectedIds(), wanted)) {
                    out.add(issue);
                }
            }
        }
        return out;
    }

    /** True when the last comprehensive check is older than the interval or critical issues are open. */
    public synchronized boolean comprehensiveCheckDue(Duration interval) {
        if (lastFullCheck == null) {
            return true;
        }
        boolean stale = Duration.between(lastFullCheck, clock.instant()).compareTo(interval) >= 0;
        return stale || activeIssues.stream().anyMatch(IntegrityIssue::critical);
    }

    public synchronized HealthSummary healthSummary() {
        int critical = 0;
        int warnings = 0;
        for (IntegrityIssue i : activeIssues) {
            if (i.severity() == IssueSeverity.CRITICAL) {
                critical++;
            } else if (i.severity() == IssueSeverity.WARNING) {
                warnings++;
            }
        }
        return new HealthSummary(status, activeIssues.size(), critical, warnings, lastCheck, lastFullCheck,
                metrics.snapshot());
    }

    public IntegrityMetrics metrics() {
        return metrics;
    }

    // ---------- internals ----------

    private ValidationContext read() {
        Instant now = clock.instant();
        try {
            List<Entity> entities = source.load();
            if (entities == null) {
                return new ValidationContext(List.of(), "entity source returned null", now);
            }
            return new ValidationContext(entities, null, now);
        } catch (RuntimeException e) {
            log.warning("Integrity check could not read the store: " + e);
            return new ValidationContext(List.of(), String.valueOf(e.getMessage()), now);
        }
    }

    private static List<IntegrityIssue> crossValidate(List<IntegrityIssue> issues) {
        Map<UUID, Set<String>> reporters = new LinkedHashMap<>();
        for (IntegrityIssue issue : issues) {
            for (UUID id : issue.affectedIds()) {
                reporters.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(issue.validator());
            }
        }
        List<IntegrityIssue> out = new ArrayList<>();
        reporters.forEach((id, names) -> {
            if (names.size() >= 2) {
                out.add(new IntegrityIssue(IssueSeverity.WARNING,
                        "Entity " + id + " reported by " + String.join(", ", names),
                        Set.of(id), IssueCategory.CORRELATED, CROSS_VALIDATION));
            }
        });
        return out;
    }
}
