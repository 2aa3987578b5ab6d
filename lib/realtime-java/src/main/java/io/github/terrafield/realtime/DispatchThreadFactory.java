package io.github.terrafield.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the daemon threads that run the dispatch queue, named {@code realtime-dispatch-N}.
 */
final class DispatchThreadFactory implements ThreadFactory {
    private static final Logger logger = LoggerFactory.getLogger(DispatchThreadFactory.class);

    static final String THREAD_PREFIX = "realtime-dispatch-";

    private final AtomicInteger sequence = new AtomicInteger(1);

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, THREAD_PREFIX + sequence.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> logger.error("Uncaught exception on {}", t.getName(), e));
        return thread;
    }
}
