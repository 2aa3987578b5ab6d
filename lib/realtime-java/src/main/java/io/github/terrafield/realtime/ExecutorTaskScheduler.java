package io.github.terrafield.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single-threaded scheduled executor.
 * <p>
 * A task that throws is logged; periodic tasks keep their schedule. Submissions
 * after {@link #shutdown()} are ignored.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;

    /**
     * Creates a scheduler with one daemon thread named {@code realtime-dispatch-N}.
     */
    public ExecutorTaskScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(new DispatchThreadFactory()));
    }

    ExecutorTaskScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException e) {
            logger.debug("Task rejected, scheduler is shut down");
        }
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        try {
            ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                    guard(task), initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            logger.debug("Task rejected, scheduler is shut down");
            return () -> { };
        }
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                logger.error("Dispatch task failed", t);
            }
        };
    }
}
