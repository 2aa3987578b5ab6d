package io.github.terrafield.realtime;

import java.time.Duration;

/**
 * Single serialized queue that runs every state change of a {@link RealtimeManager}.
 * <p>
 * Implementations must run tasks one at a time in submission order for tasks due
 * at the same instant.
 */
public interface TaskScheduler {

    /**
     * Handle to a scheduled task.
     */
    @FunctionalInterface
    interface Cancellable {
        /**
         * Cancels the task. Running executions complete; no further ones start.
         */
        void cancel();
    }

    /**
     * Runs a task as soon as possible.
     *
     * @param task the task
     */
    void execute(Runnable task);

    /**
     * Runs a task periodically.
     *
     * @param task         the task
     * @param initialDelay delay before the first run
     * @param period       period between run starts
     * @return handle to cancel the task
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Stops the scheduler; pending tasks are dropped.
     */
    void shutdown();
}
