package io.github.terrafield.realtime;

import io.github.terrafield.realtime.errors.RealtimeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a subscription watches and where its data goes.
 * <p>
 * In push mode the binding is routed by {@link #getEvent()}; in polling mode its
 * {@link #getEndpoint()} is fetched every {@link #getInterval()}. A binding without an
 * interval never fires while polling.
 * <pre>{@code
 * SubscriptionBinding binding = SubscriptionBinding.builder()
 *         .event("property-update")
 *         .endpoint("/api/properties")
 *         .interval(Duration.ofSeconds(10))
 *         .callback(payload -> render(payload))
 *         .build();
 * }</pre>
 */
public final class SubscriptionBinding {

    private final String event;
    private final String endpoint;
    private final List<String> queryKey;
    private final Duration interval;
    private final SubscriptionCallback callback;

    private SubscriptionBinding(Builder builder) {
        this.event = builder.event;
        this.endpoint = builder.endpoint;
        this.queryKey = builder.queryKey.isEmpty()
                ? Collections.singletonList(builder.endpoint)
                : Collections.unmodifiableList(new ArrayList<>(builder.queryKey));
        this.interval = builder.interval;
        this.callback = builder.callback;
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the push event name this binding listens to, or null.
     *
     * @return the event name
     */
    public String getEvent() {
        return event;
    }

    /**
     * Returns the endpoint fetched while polling.
     *
     * @return the endpoint path or absolute URL
     */
    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Returns the query key; defaults to a single element equal to the endpoint.
     *
     * @return the ordered query key elements
     */
    public List<String> getQueryKey() {
        return queryKey;
    }

    /**
     * Returns the polling interval, or null if the binding does not poll.
     *
     * @return the interval
     */
    public Duration getInterval() {
        return interval;
    }

    /**
     * Checks whether the binding fires in polling mode.
     *
     * @return true if an interval is set
     */
    public boolean isPollable() {
        return interval != null;
    }

    /**
     * Checks whether the binding receives push messages.
     *
     * @return true if an event name is set
     */
    public boolean isRoutable() {
        return event != null;
    }

    /**
     * Returns the callback.
     *
     * @return the callback
     */
    public SubscriptionCallback getCallback() {
        return callback;
    }

    @Override
    public String toString() {
        return "SubscriptionBinding{" +
                "event='" + event + '\'' +
                ", endpoint='" + endpoint + '\'' +
                ", queryKey=" + queryKey +
                ", interval=" + interval +
                '}';
    }

    /**
     * Builder for SubscriptionBinding.
     */
    public static final class Builder {
        private String event;
        private String endpoint;
        private final List<String> queryKey = new ArrayList<>();
        private Duration interval;
        private SubscriptionCallback callback;

        private Builder() {
        }

        /**
         * Sets the push event name.
         *
         * @param event the event name
         * @return this builder
         */
        public Builder event(String event) {
            this.event = event == null || event.isEmpty() ? null : event;
            return this;
        }

        /**
         * Sets the endpoint fetched while polling.
         *
         * @param endpoint a path relative to the base URL, or an absolute http(s) URL
         * @return this builder
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Sets a single-element query key.
         *
         * @param key the key
         * @return this builder
         */
        public Builder queryKey(String key) {
            Objects.requireNonNull(key, "queryKey cannot be null");
            this.queryKey.clear();
            this.queryKey.add(key);
            return this;
        }

        /**
         * Sets an ordered query key. When the first element equals the endpoint the
         * rest are appended to it as path segments.
         *
         * @param keys the key elements
         * @return this builder
         */
        public Builder queryKey(List<String> keys) {
            Objects.requireNonNull(keys, "queryKey cannot be null");
            for (String key : keys) {
                Objects.requireNonNull(key, "queryKey element cannot be null");
            }
            this.queryKey.clear();
            this.queryKey.addAll(keys);
            return this;
        }

        /**
         * Sets the polling interval.
         *
         * @param interval the interval, or null to never poll
         * @return this builder
         * @throws RealtimeException if interval is not positive or shorter than 1ms
         */
        public Builder interval(Duration interval) {
            if (interval != null && (interval.isNegative() || interval.isZero())) {
                throw new RealtimeException("interval must be positive");
            }
            if (interval != null && interval.toMillis() < 1) {
                throw new RealtimeException("interval must be at least 1ms");
            }
            this.interval = interval;
            return this;
        }

        /**
         * Sets the polling interval in milliseconds.
         *
         * @param intervalMs the interval in milliseconds
         * @return this builder
         * @throws RealtimeException if intervalMs is not positive
         */
        public Builder intervalMs(long intervalMs) {
            if (intervalMs <= 0) {
                throw new RealtimeException("interval must be positive");
            }
            return interval(Duration.ofMillis(intervalMs));
        }

        /**
         * Sets the callback.
         *
         * @param callback the payload sink
         * @return this builder
         */
        public Builder callback(SubscriptionCallback callback) {
            this.callback = callback;
            return this;
        }

        /**
         * Builds the binding.
         *
         * @return the binding
         * @throws RealtimeException    if endpoint is empty
         * @throws NullPointerException if callback is null
         */
        public SubscriptionBinding build() {
            if (endpoint == null || endpoint.isEmpty()) {
                throw new RealtimeException("endpoint cannot be empty");
            }
            Objects.requireNonNull(callback, "callback cannot be null");
            return new SubscriptionBinding(this);
        }
    }
}
