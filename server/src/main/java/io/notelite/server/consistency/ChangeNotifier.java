package io.notelite.server.consistency;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fire-and-forget delivery of {@link ChangeEvent}s to registered collaborators.
 * <p>
 * Events are delivered in publish order on a dedicated thread. A failing listener is
 * logged and skipped; it never affects the change that produced the event.
 */
public final class ChangeNotifier implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ChangeNotifier.class.getName());

    private final Map<CollaboratorCategory, List<ChangeListener>> listeners = new EnumMap<>(CollaboratorCategory.class);
    private final ExecutorService executor;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public ChangeNotifier() {
        for (CollaboratorCategory c : CollaboratorCategory.values()) {
            listeners.put(c, new CopyOnWriteArrayList<>());
        }
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "change-notifier");
            t.setDaemon(true);
            return t;
        });
    }

    public void register(CollaboratorCategory category, ChangeListener listener) {
        Objects.requireNonNull(category, "category");
        listeners.get(category).add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean unregister(CollaboratorCategory category, ChangeListener listener) {
        return listeners.get(Objects.requireNonNull(category, "category")).remove(listener);
    }

    /** Queue the event for every interested category. Returns immediately. */
    public void publish(ChangeEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warning("Dropping notification for version " + event.versionId() + ": notifier is shut down");
        }
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failureCount() {
        return failures.get();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private void deliver(ChangeEvent event) {
        for (CollaboratorCategory category : CollaboratorCategory.values()) {
            if (!category.interestedIn(event.changeType())) {
                continue;
            }
            for (ChangeListener l : listeners.get(category)) {
                try {
                    l.onChange(event);
                    delivered.incrementAndGet();
                } catch (Exception e) {
                    failures.incrementAndGet();
                    log.log(Level.WARNING, category + " listener failed for version " + event.versionId(), e);
                }
            }
        }
    }
}
