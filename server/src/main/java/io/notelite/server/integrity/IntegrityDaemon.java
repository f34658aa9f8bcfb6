package io.notelite.server.integrity;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background loop that keeps integrity checks running.
 * <p>
 * Each tick:
 *  - runs a comprehensive check when one is due (first tick, interval elapsed, or
 *    critical issues still open), otherwise a quick check;
 *  - escalates a quick check with critical findings to a comprehensive check right away;
 *  - hands a critical comprehensive report to the repair handler.
 * <p>
 * One tick at a time: single-threaded scheduler with a fixed delay.
 */
public final class IntegrityDaemon {
    private static final Logger log = Logger.getLogger(IntegrityDaemon.class.getName());

    /** Receives reports with critical issues. Failures are logged by the daemon. */
    @FunctionalInterface
    public interface RepairHandler {
        void repair(IntegrityReport report) throws Exception;
    }

    private final IntegrityMonitor monitor;
    private final Duration quickInterval;
    private final Duration comprehensiveInterval;
    private final RepairHandler repairHandler;
    private final ScheduledExecutorService scheduler;

    public IntegrityDaemon(
            IntegrityMonitor monitor,
            Duration quickInterval,
            Duration comprehensiveInterval,
            RepairHandler repairHandler
    ) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.quickInterval = Objects.requireNonNull(quickInterval, "quickInterval");
        this.comprehensiveInterval = Objects.requireNonNull(comprehensiveInterval, "comprehensiveInterval");
        this.repairHandler = Objects.requireNonNull(repairHandler, "repairHandler");
        if (quickInterval.isZero() || quickInterval.isNegative()) {
            throw new IllegalArgumentException("quickInterval must be > 0");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "integrity-daemon");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(
                this::tickSafe,
                quickInterval.toMillis(),
                quickInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("Integrity daemon started: quick every " + quickInterval.toSeconds()
                + "s, comprehensive every " + comprehensiveInterval.toSeconds() + "s");
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /** One iteration; public so tests can drive it directly. */
    public void tick() throws Exception {
        if (monitor.comprehensiveCheckDue(comprehensiveInterval)) {
            runComprehensive();
            return;
        }
        QuickCheckResult quick = monitor.performQuickCheck();
        if (!quick.healthy()) {
            runComprehensive();
        }
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            log.log(Level.WARNING, "Integrity tick failed", e);
        }
    }

    private void runComprehensive() throws Exception {
        IntegrityReport report = monitor.performComprehensiveCheck();
        if (report.success()) {
            return;
        }
        log.warning("Requesting repair of " + report.criticalIssues().size() + " critical issue(s)");
        repairHandler.repair(report);
    }
}
