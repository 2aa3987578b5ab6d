package io.github.terrafield.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Republishes the live connection state to listeners on a fixed period, and on demand
 * after transitions. Only changes are published, so listeners see at most one
 * notification per distinct state and never lag by more than one period.
 */
final class StatusReconciler {
    private static final Logger logger = LoggerFactory.getLogger(StatusReconciler.class);

    private final Supplier<ConnectionState> source;
    private final TaskScheduler scheduler;
    private final Duration period;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private ConnectionState published = ConnectionState.INITIAL;
    private TaskScheduler.Cancellable tick;

    StatusReconciler(Supplier<ConnectionState> source, TaskScheduler scheduler, Duration period) {
        this.source = source;
        this.scheduler = scheduler;
        this.period = period;
    }

    void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    void start() {
        if (tick != null) {
            return;
        }
        tick = scheduler.scheduleAtFixedRate(this::reconcile, period, period);
    }

    void stop() {
        if (tick != null) {
            tick.cancel();
            tick = null;
        }
    }

    boolean isRunning() {
        return tick != null;
    }

    ConnectionState published() {
        return published;
    }

    /**
     * @return true if a changed state was published
     */
    boolean reconcile() {
        ConnectionState current = source.get();
        ConnectionState previous = published;
        if (current.equals(previous)) {
            return false;
        }
        published = current;
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnectionChange(previous, current);
            } catch (RuntimeException e) {
                logger.error("Connection listener failed", e);
            }
        }
        return true;
    }
}
