package io.github.terrafield.realtime;

import com.google.gson.JsonElement;
import io.github.terrafield.realtime.errors.InvalidPayloadError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers data into subscription callbacks.
 * <p>
 * Push mode fans each message out to every subscription bound to its event. Polling mode
 * runs one fixed-rate timer per pollable subscription; a tick is skipped while a fetch for
 * the same id is outstanding, and a result whose subscription was removed, replaced, or
 * disarmed in the meantime is discarded. The first tick of a replacement binding that
 * found the old binding's fetch outstanding runs as soon as that fetch settles.
 * <p>
 * All methods run on the dispatch thread.
 */
final class DispatchEngine {
    private static final Logger logger = LoggerFactory.getLogger(DispatchEngine.class);

    private final SubscriptionRegistry registry;
    private final ConnectionStateMachine stateMachine;
    private final MessageCodec codec;
    private final PollingFetcher fetcher;
    private final TaskScheduler scheduler;

    private final Map<String, PollTask> timers = new ConcurrentHashMap<>();
    private final Map<String, PollTask> inFlight = new ConcurrentHashMap<>();

    DispatchEngine(SubscriptionRegistry registry, ConnectionStateMachine stateMachine, MessageCodec codec,
                   PollingFetcher fetcher, TaskScheduler scheduler) {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.codec = codec;
        this.fetcher = fetcher;
        this.scheduler = scheduler;
    }

    /**
     * Fans a push message out to matching subscriptions.
     *
     * @return the number of callbacks invoked
     */
    int deliver(RealtimeMessage message) {
        if (stateMachine.method() != ConnectionMethod.PUSH) {
            logger.debug("Dropping push message for '{}' while polling", message.getEvent());
            return 0;
        }
        try {
            codec.validate(message.getEvent(), message.getPayload());
        } catch (InvalidPayloadError e) {
            logger.warn("Dropping push message: {}", e.getMessage());
            return 0;
        }

        List<Subscription> targets = registry.snapshotForEvent(message.getEvent());
        for (Subscription subscription : targets) {
            invoke(subscription, message.getPayload());
        }
        return targets.size();
    }

    /**
     * Arms the polling timer of a subscription if polling is active and it has an interval.
     * Any previous timer for the same id is cancelled first.
     */
    void arm(Subscription subscription) {
        disarm(subscription.getId());
        if (!stateMachine.isPolling()) {
            return;
        }
        SubscriptionBinding binding = subscription.getBinding();
        if (!binding.isPollable()) {
            logger.debug("Subscription {} has no interval, inert while polling", subscription.getId());
            return;
        }
        PollTask task = new PollTask(subscription);
        task.handle = scheduler.scheduleAtFixedRate(task, Duration.ZERO, binding.getInterval());
        timers.put(subscription.getId(), task);
    }

    void armAll() {
        for (Subscription subscription : registry.snapshot()) {
            arm(subscription);
        }
    }

    void disarm(String id) {
        PollTask task = timers.remove(id);
        if (task != null) {
            task.cancel();
        }
    }

    void disarmAll() {
        for (String id : List.copyOf(timers.keySet())) {
            disarm(id);
        }
    }

    boolean isArmed(String id) {
        return timers.containsKey(id);
    }

    int armedCount() {
        return timers.size();
    }

    private void invoke(Subscription subscription, JsonElement payload) {
        try {
            subscription.getBinding().getCallback().onPayload(payload);
        } catch (RuntimeException e) {
            logger.error("Callback of subscription {} failed", subscription.getId(), e);
        }
    }

    private final class PollTask implements Runnable {
        private final Subscription subscription;
        private volatile TaskScheduler.Cancellable handle;
        private volatile boolean cancelled;
        private boolean fetched;
        private boolean firstTickDeferred;

        PollTask(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void run() {
            if (cancelled) {
                return;
            }
            String id = subscription.getId();
            if (inFlight.putIfAbsent(id, this) != null) {
                if (!fetched) {
                    firstTickDeferred = true;
                }
                logger.debug("Skipping poll of subscription {}, previous fetch outstanding", id);
                return;
            }
            fetched = true;
            firstTickDeferred = false;

            SubscriptionBinding binding = subscription.getBinding();
            CompletableFuture<String> future;
            try {
                future = fetcher.fetch(binding.getEndpoint(), binding.getQueryKey());
            } catch (RuntimeException e) {
                inFlight.remove(id, this);
                logger.warn("Poll of {} for subscription {} failed: {}", binding.getEndpoint(), id, e.getMessage());
                return;
            }
            future.whenComplete((body, error) -> scheduler.execute(() -> complete(body, error)));
        }

        private void complete(String body, Throwable error) {
            String id = subscription.getId();
            inFlight.remove(id, this);
            runDeferredSuccessor(id);

            if (cancelled || timers.get(id) != this || !registry.isCurrent(subscription)) {
                logger.debug("Discarding poll result of subscription {}, no longer armed", id);
                return;
            }
            SubscriptionBinding binding = subscription.getBinding();
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                logger.warn("Poll of {} for subscription {} failed: {}", binding.getEndpoint(), id, cause.getMessage());
                return;
            }

            JsonElement payload = codec.decodeBody(body);
            try {
                codec.validate(binding.getEvent(), payload);
            } catch (InvalidPayloadError e) {
                logger.warn("Dropping poll result of subscription {}: {}", id, e.getMessage());
                return;
            }
            invoke(subscription, payload);
        }

        private void runDeferredSuccessor(String id) {
            PollTask successor = timers.get(id);
            if (successor != null && successor != this && successor.firstTickDeferred) {
                successor.firstTickDeferred = false;
                successor.run();
            }
        }

        void cancel() {
            cancelled = true;
            TaskScheduler.Cancellable h = handle;
            if (h != null) {
                h.cancel();
            }
        }
    }
}
