package com.mixtape.playlist.application.service;

import com.mixtape.playlist.core.engine.BackgroundTasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The single thread that owns all playlists, plus a pool for the slow work they hand off.
 * <p>
 * Everything touching a playlist runs on the owner thread. Background results are posted back to it, so
 * playlists never see concurrent calls.
 */
public class OwnerThread implements BackgroundTasks, Closeable {

    private static final Logger log = LoggerFactory.getLogger(OwnerThread.class);

    private final String name;
    private final ExecutorService owner;
    private final ExecutorService workers;
    private volatile Thread thread;

    /**
     * @param name          name of the owner thread, workers are named after it
     * @param workerThreads size of the background pool
     */
    public OwnerThread(String name, int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("At least one worker thread is required");
        }
        this.name = name;
        NamedThreadFactory ownerFactory = new NamedThreadFactory(r -> name);
        this.owner = Executors.newSingleThreadExecutor(r -> {
            Thread t = ownerFactory.newThread(r);
            thread = t;
            return t;
        });
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerThreads,
                new NamedThreadFactory(r -> name + "-worker-" + counter.incrementAndGet()));
        log.trace("OwnerThread{{}} has started", name);
    }

    public boolean isOwnerThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Runs {@code task} on the owner thread and waits for its result. Runs inline when already on it.
     * Exceptions thrown by the task are rethrown to the caller.
     */
    public <T> T call(Supplier<T> task) {
        if (isOwnerThread()) {
            return task.get();
        }
        Future<T> future = owner.submit(task::get);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    /**
     * Queues {@code task} on the owner thread without waiting.
     */
    public void post(Runnable task) {
        try {
            owner.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException ex) {
                    log.warn("Task on {} failed", name, ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.debug("{} is shut down, dropping task", name);
        }
    }

    @Override
    public <T> void submit(String taskName, Supplier<T> work, Consumer<T> onSuccess,
                           Consumer<RuntimeException> onFailure) {
        try {
            workers.execute(() -> {
                T result;
                try {
                    result = work.get();
                } catch (RuntimeException ex) {
                    log.warn("Background task '{}' failed", taskName, ex);
                    post(() -> onFailure.accept(ex));
                    return;
                }
                post(() -> onSuccess.accept(result));
            });
        } catch (RejectedExecutionException ex) {
            log.debug("{} is shut down, dropping background task '{}'", name, taskName);
        }
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        if (!owner.isShutdown()) {
            throw new IllegalStateException(String.format("OwnerThread{%s} hasn't been shut down yet", name));
        }
        return workers.awaitTermination(timeout, unit) && owner.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        log.trace("OwnerThread{{}} is shutting down", name);
        workers.shutdown();
        owner.shutdown();
    }
}
