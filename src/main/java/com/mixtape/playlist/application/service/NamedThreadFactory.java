package com.mixtape.playlist.application.service;

import java.util.concurrent.ThreadFactory;
import java.util.function.Function;

/**
 * Creates daemon threads named by a provider, so that engine threads are recognisable in dumps and logs.
 */
final class NamedThreadFactory implements ThreadFactory {

    private final Function<Runnable, String> nameProvider;

    NamedThreadFactory(Function<Runnable, String> nameProvider) {
        this.nameProvider = nameProvider;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, nameProvider.apply(r));
        t.setDaemon(true);
        if (t.getPriority() != Thread.NORM_PRIORITY) {
            t.setPriority(Thread.NORM_PRIORITY);
        }
        return t;
    }
}
