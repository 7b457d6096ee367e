package com.mixtape.playlist.core.engine;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs slow work away from the owner thread and delivers its outcome back on the owner thread.
 */
public interface BackgroundTasks {

    /**
     * @param name      short description used for thread names and logging
     * @param work      runs in the background
     * @param onSuccess receives the result on the owner thread
     * @param onFailure receives any exception thrown by {@code work} on the owner thread
     */
    <T> void submit(String name, Supplier<T> work, Consumer<T> onSuccess, Consumer<RuntimeException> onFailure);

    /**
     * Runs everything immediately on the calling thread.
     */
    static BackgroundTasks inline() {
        return new BackgroundTasks() {
            @Override
            public <T> void submit(String name, Supplier<T> work, Consumer<T> onSuccess,
                                   Consumer<RuntimeException> onFailure) {
                T result;
                try {
                    result = work.get();
                } catch (RuntimeException ex) {
                    onFailure.accept(ex);
                    return;
                }
                onSuccess.accept(result);
            }
        };
    }
}
