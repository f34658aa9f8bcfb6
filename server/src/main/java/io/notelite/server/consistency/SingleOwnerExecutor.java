package io.notelite.server.consistency;

import io.notelite.core.ConsistencyException;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * The one thread allowed to mutate the store, the history and the conflict window.
 * <p>
 * Tasks submitted from other threads are queued and run in submission order. A task
 * submitted from the owner thread itself runs inline, so owner code may call back into
 * components that hop onto the owner without deadlocking.
 */
public final class SingleOwnerExecutor implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SingleOwnerExecutor.class.getName());

    private final String name;
    private final ExecutorService executor;
    private volatile Thread owner;

    public SingleOwnerExecutor(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            owner = t;
            return t;
        });
    }

    public boolean onOwnerThread() {
        return Thread.currentThread() == owner;
    }

    public <T> CompletableFuture<T> call(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        if (onOwnerThread()) {
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(ConsistencyException.transientFailure(name + " is shut down", e));
        }
        return result;
    }

    public CompletableFuture<Void> run(Runnable task) {
        Objects.requireNonNull(task, "task");
        return call(() -> {
            task.run();
            return null;
        });
    }

    /** Stop accepting work and wait briefly for queued tasks. */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning(name + " did not drain within 5s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
