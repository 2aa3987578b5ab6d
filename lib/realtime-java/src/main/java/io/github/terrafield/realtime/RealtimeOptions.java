package io.github.terrafield.realtime;

import io.github.terrafield.realtime.errors.RealtimeException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration options for the realtime manager.
 * Use {@link #builder()} to create instances.
 */
public final class RealtimeOptions {

    /** default connect and request timeout */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** default push endpoint path */
    public static final String DEFAULT_PUSH_PATH = "/ws";

    /** default period between heartbeat pings */
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    /** default time without a pong after which the push connection is considered dead */
    public static final Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofSeconds(30);

    /** default status reconciler period */
    public static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofSeconds(5);

    private final String token;
    private final Duration timeout;
    private final String pushPath;
    private final boolean heartbeatEnabled;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final Duration reconcileInterval;
    private final Map<String, PayloadValidator> validators;

    private RealtimeOptions(Builder builder) {
        this.token = builder.token;
        this.timeout = builder.timeout;
        this.pushPath = builder.pushPath;
        this.heartbeatEnabled = builder.heartbeatEnabled;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.heartbeatTimeout = builder.heartbeatTimeout;
        this.reconcileInterval = builder.reconcileInterval;
        this.validators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.validators));
    }

    /**
     * Creates a new builder for RealtimeOptions.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the authentication token, or null if not set.
     *
     * @return the token
     */
    public String getToken() {
        return token;
    }

    /**
     * Returns the connect and request timeout.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Returns the push endpoint path.
     *
     * @return the path, starting with '/'
     */
    public String getPushPath() {
        return pushPath;
    }

    /**
     * Checks whether heartbeat pings are sent on push connections.
     *
     * @return true if heartbeats are enabled
     */
    public boolean isHeartbeatEnabled() {
        return heartbeatEnabled;
    }

    /**
     * Returns the period between heartbeat pings.
     *
     * @return the heartbeat interval
     */
    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Returns the time without a pong after which the push connection is considered dead.
     *
     * @return the heartbeat timeout
     */
    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    /**
     * Returns the status reconciler period.
     *
     * @return the reconcile interval
     */
    public Duration getReconcileInterval() {
        return reconcileInterval;
    }

    /**
     * Returns payload validators keyed by event name.
     *
     * @return unmodifiable validator map
     */
    public Map<String, PayloadValidator> getValidators() {
        return validators;
    }

    /**
     * Builder for RealtimeOptions.
     */
    public static final class Builder {
        private String token;
        private Duration timeout = DEFAULT_TIMEOUT;
        private String pushPath = DEFAULT_PUSH_PATH;
        private boolean heartbeatEnabled = true;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration heartbeatTimeout = DEFAULT_HEARTBEAT_TIMEOUT;
        private Duration reconcileInterval = DEFAULT_RECONCILE_INTERVAL;
        private final Map<String, PayloadValidator> validators = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets the authentication token for polling requests and the push handshake.
         *
         * @param token the bearer token
         * @return this builder
         */
        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Sets the connect and request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         * @throws RealtimeException if timeout is not positive
         */
        public Builder timeout(Duration timeout) {
            this.timeout = requirePositive(timeout, "timeout");
            return this;
        }

        /**
         * Sets the push endpoint path.
         *
         * @param pushPath the path, starting with '/'
         * @return this builder
         * @throws RealtimeException if the path does not start with '/'
         */
        public Builder pushPath(String pushPath) {
            Objects.requireNonNull(pushPath, "pushPath cannot be null");
            if (!pushPath.startsWith("/")) {
                throw new RealtimeException("pushPath must start with '/'");
            }
            this.pushPath = pushPath;
            return this;
        }

        /**
         * Enables or disables heartbeat pings on push connections.
         *
         * @param heartbeatEnabled whether to send heartbeats
         * @return this builder
         */
        public Builder heartbeatEnabled(boolean heartbeatEnabled) {
            this.heartbeatEnabled = heartbeatEnabled;
            return this;
        }

        /**
         * Sets the period between heartbeat pings.
         *
         * @param heartbeatInterval the interval
         * @return this builder
         * @throws RealtimeException if the interval is not positive
         */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = requirePositive(heartbeatInterval, "heartbeatInterval");
            return this;
        }

        /**
         * Sets the time without a pong after which the push connection is considered dead.
         *
         * @param heartbeatTimeout the timeout
         * @return this builder
         * @throws RealtimeException if the timeout is not positive
         */
        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = requirePositive(heartbeatTimeout, "heartbeatTimeout");
            return this;
        }

        /**
         * Sets the status reconciler period.
         *
         * @param reconcileInterval the period
         * @return this builder
         * @throws RealtimeException if the period is not positive
         */
        public Builder reconcileInterval(Duration reconcileInterval) {
            this.reconcileInterval = requirePositive(reconcileInterval, "reconcileInterval");
            return this;
        }

        /**
         * Registers a validator for payloads of one event.
         *
         * @param event     the event name
         * @param validator the validator
         * @return this builder
         * @throws RealtimeException if event is empty
         */
        public Builder validator(String event, PayloadValidator validator) {
            if (event == null || event.isEmpty()) {
                throw new RealtimeException("event cannot be empty");
            }
            Objects.requireNonNull(validator, "validator cannot be null");
            validators.put(event, validator);
            return this;
        }

        /**
         * Builds the RealtimeOptions instance.
         *
         * @return the configured options
         * @throws RealtimeException if the heartbeat timeout is shorter than its interval
         */
        public RealtimeOptions build() {
            if (heartbeatTimeout.compareTo(heartbeatInterval) < 0) {
                throw new RealtimeException("heartbeatTimeout must not be shorter than heartbeatInterval");
            }
            return new RealtimeOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " cannot be null");
            if (value.isNegative() || value.isZero()) {
                throw new RealtimeException(name + " must be positive");
            }
            // schedulers work in whole milliseconds
            if (value.toMillis() < 1) {
                throw new RealtimeException(name + " must be at least 1ms");
            }
            return value;
        }
    }
}
