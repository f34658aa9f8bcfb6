package io.notelite.server.backup;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires the periodic backup task on a fixed delay.
 * <p>
 * The task decides itself whether a backup is due, so a manual backup taken just
 * before a tick pushes the next periodic one out.
 */
public final class BackupScheduler {
    private static final Logger log = Logger.getLogger(BackupScheduler.class.getName());

    private final Runnable task;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public BackupScheduler(Runnable task, Duration interval) {
        this.task = Objects.requireNonNull(task, "task");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backup-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        // check more often than the interval so a missed slot is caught up quickly
        long period = Math.max(1_000L, interval.toMillis() / 5);
        scheduler.scheduleWithFixedDelay(this::tickSafe, period, period, TimeUnit.MILLISECONDS);
        log.info("Backup scheduler started: every " + interval.toMinutes() + "min");
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    private void tickSafe() {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Periodic backup failed", e);
        }
    }
}
