package io.github.terrafield.realtime;

import io.github.terrafield.realtime.errors.InvalidPayloadError;
import io.github.terrafield.realtime.errors.RealtimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps many independent subscriptions fed with live data over a push connection, or
 * by polling when push is unavailable or disallowed.
 * <p>
 * Use {@link #builder(String)} to create instances. One manager is normally built by the
 * application assembly and handed to every consumer.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (RealtimeManager realtime = RealtimeManager.builder("https://app.example.com")
 *         .token("api-token")
 *         .build()) {
 *     realtime.subscribe("props", SubscriptionBinding.builder()
 *             .event("property-update")
 *             .endpoint("/api/properties")
 *             .intervalMs(10_000)
 *             .callback(payload -> render(payload))
 *             .build());
 *     realtime.connect();
 * }
 * }</pre>
 * <p>
 * Lifecycle and subscription calls return immediately; their effects are applied in
 * order on a single dispatch thread, which also runs every callback and listener.
 * Transport failures never surface as exceptions, only as {@link ConnectionStatus} changes.
 */
public final class RealtimeManager implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(RealtimeManager.class);

    private final RealtimeOptions options;
    private final TransportProbe probe;
    private final PushTransportFactory transportFactory;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;

    private final ConnectionStateMachine stateMachine = new ConnectionStateMachine();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final MessageCodec codec;
    private final DispatchEngine engine;
    private final FailoverController failover;
    private final StatusReconciler reconciler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile PushTransport transport;
    private TaskScheduler.Cancellable heartbeat;
    private int missedHeartbeats;

    private RealtimeManager(Builder builder, RealtimeOptions options) {
        this.options = options;
        this.probe = builder.probe != null ? builder.probe : new EnvironmentTransportProbe();
        this.transportFactory = builder.transportFactory != null
                ? builder.transportFactory
                : WebSocketPushTransport.factory(builder.baseUrl, options);
        PollingFetcher fetcher = builder.fetcher != null
                ? builder.fetcher
                : new HttpPollingFetcher(builder.baseUrl, options);
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? new ExecutorTaskScheduler() : builder.scheduler;

        this.codec = new MessageCodec(options.getValidators());
        this.engine = new DispatchEngine(registry, stateMachine, codec, fetcher, scheduler);
        this.failover = new FailoverController(stateMachine, engine, this::publish);
        this.reconciler = new StatusReconciler(stateMachine::current, scheduler, options.getReconcileInterval());
    }

    /**
     * Creates a new builder for the manager.
     *
     * @param baseUrl the http(s) base URL of the server
     * @return a new builder
     */
    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Returns the active delivery path.
     *
     * @return the connection method
     */
    public ConnectionMethod getConnectionMethod() {
        return stateMachine.method();
    }

    /**
     * Returns the connection status; always {@link ConnectionStatus#POLLING} while polling.
     *
     * @return the connection status
     */
    public ConnectionStatus getConnectionStatus() {
        return stateMachine.status();
    }

    /**
     * Returns method and status as one consistent value.
     *
     * @return the connection state
     */
    public ConnectionState getConnectionState() {
        return stateMachine.current();
    }

    /**
     * Checks whether subscriptions are being fed: push connected, or polling.
     *
     * @return true if data is flowing
     */
    public boolean isConnected() {
        return stateMachine.current().isLive();
    }

    /**
     * Returns the ids currently in the registry.
     *
     * @return snapshot of subscription ids
     */
    public Set<String> getSubscriptionIds() {
        return registry.ids();
    }

    /**
     * Registers a connection state observer.
     *
     * @param listener the listener
     */
    public void addConnectionListener(ConnectionListener listener) {
        reconciler.addListener(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Removes a connection state observer.
     *
     * @param listener the listener
     */
    public void removeConnectionListener(ConnectionListener listener) {
        reconciler.removeListener(listener);
    }

    /**
     * Connects using the transport the deployment allows: polling if the probe blocks push,
     * otherwise a push connection that falls back to polling on failure. Clears any manual
     * override. No-op while a push connection is open or opening.
     */
    public void connect() {
        submit(this::doConnect);
    }

    /**
     * Closes the active transport and cancels all polling timers. Subscriptions are kept.
     */
    public void disconnect() {
        submit(this::doDisconnect);
    }

    /**
     * Switches to polling regardless of the probe. No-op if already polling.
     */
    public void forcePolling() {
        submit(this::doForcePolling);
    }

    /**
     * Switches to push regardless of the probe and stays on push if it fails.
     * No-op if a push connection is already open or opening.
     */
    public void forceWebSockets() {
        submit(this::doForceWebSockets);
    }

    /**
     * Adds or replaces a subscription. A replaced binding's timer is cancelled and its
     * callback is not invoked again. While polling, the first fetch fires immediately.
     *
     * @param id      unique subscription id
     * @param binding what to watch and where to deliver it
     * @throws RealtimeException    if id is empty
     * @throws NullPointerException if binding is null
     */
    public void subscribe(String id, SubscriptionBinding binding) {
        if (id == null || id.isEmpty()) {
            throw new RealtimeException("id cannot be empty");
        }
        Objects.requireNonNull(binding, "binding cannot be null");
        submit(() -> {
            Subscription subscription = new Subscription(id, binding);
            if (registry.put(subscription) != null) {
                logger.debug("Replacing subscription {}", id);
            }
            engine.arm(subscription);
        });
    }

    /**
     * Removes a subscription and cancels its timer. Unknown ids are ignored.
     *
     * @param id the subscription id
     */
    public void unsubscribe(String id) {
        if (id == null || id.isEmpty()) {
            return;
        }
        submit(() -> {
            engine.disarm(id);
            if (registry.remove(id) != null) {
                logger.debug("Removed subscription {}", id);
            }
        });
    }

    /**
     * Sends data over the push connection. Strings are sent as-is, anything else as JSON.
     * Never queues and never throws.
     *
     * @param data the data to send
     * @return true iff the data was handed to an open push connection
     */
    public boolean send(Object data) {
        if (closed.get() || !stateMachine.isPushConnected()) {
            return false;
        }
        PushTransport active = transport;
        if (active == null) {
            return false;
        }
        try {
            return active.send(codec.encode(data));
        } catch (RuntimeException e) {
            logger.warn("Push send failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Disconnects, drops all subscriptions and stops the dispatch thread.
     * Safe to call multiple times.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.execute(() -> {
            doDisconnect();
            registry.clear();
            reconciler.stop();
            if (ownsScheduler) {
                scheduler.shutdown();
            }
        });
    }

    private void submit(Runnable action) {
        if (closed.get()) {
            logger.debug("Ignoring call on closed manager");
            return;
        }
        scheduler.execute(action);
    }

    private void doConnect() {
        reconciler.start();
        failover.pinPush(false);

        boolean pushDisallowed;
        try {
            pushDisallowed = probe.isPushDisallowed();
        } catch (RuntimeException e) {
            logger.warn("Transport probe failed, trying push: {}", e.getMessage());
            pushDisallowed = false;
        }

        if (pushDisallowed) {
            closeTransport();
            failover.switchToPolling();
            publish();
            return;
        }
        if (stateMachine.isPushActive()) {
            return;
        }
        startPush();
    }

    private void doDisconnect() {
        closeTransport();
        engine.disarmAll();
        failover.pinPush(false);
        stateMachine.reset();
        publish();
    }

    private void doForcePolling() {
        reconciler.start();
        failover.pinPush(false);
        if (stateMachine.isPolling()) {
            return;
        }
        closeTransport();
        failover.switchToPolling();
        publish();
    }

    private void doForceWebSockets() {
        reconciler.start();
        failover.pinPush(true);
        if (stateMachine.isPushActive()) {
            return;
        }
        startPush();
    }

    private void startPush() {
        closeTransport();
        failover.switchToPush();

        PushTransport created;
        try {
            created = transportFactory.create();
        } catch (RuntimeException e) {
            failover.onPushFailure("transport unavailable: " + e.getMessage());
            publish();
            return;
        }
        transport = created;
        try {
            created.open(new TransportEvents(created));
        } catch (RuntimeException e) {
            onTransportFailure(created, "open failed: " + e.getMessage());
        }
    }

    private void onTransportOpen(PushTransport source) {
        if (!stateMachine.pushConnected()) {
            return;
        }
        startHeartbeat(source);
        publish();
    }

    private void onTransportMessage(String frame) {
        RealtimeMessage message;
        try {
            message = codec.decode(frame);
        } catch (InvalidPayloadError e) {
            logger.warn("Dropping push frame: {}", e.getMessage());
            return;
        }
        if (codec.isHeartbeat(message)) {
            if (codec.isPong(message)) {
                missedHeartbeats = 0;
            }
            return;
        }
        engine.deliver(message);
    }

    private void onTransportFailure(PushTransport source, String reason) {
        if (transport != source) {
            return;
        }
        closeTransport();
        failover.onPushFailure(reason);
        publish();
    }

    private void startHeartbeat(PushTransport source) {
        stopHeartbeat();
        if (!options.isHeartbeatEnabled()) {
            return;
        }
        missedHeartbeats = 0;
        Duration interval = options.getHeartbeatInterval();
        long timeoutMs = options.getHeartbeatTimeout().toMillis();
        heartbeat = scheduler.scheduleAtFixedRate(() -> {
            if (transport != source) {
                return;
            }
            if (missedHeartbeats * interval.toMillis() >= timeoutMs) {
                onTransportFailure(source, "no heartbeat response in " + options.getHeartbeatTimeout());
                return;
            }
            source.send(codec.heartbeatPing(System.currentTimeMillis()));
            missedHeartbeats++;
        }, interval, interval);
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel();
            heartbeat = null;
        }
    }

    private void closeTransport() {
        stopHeartbeat();
        PushTransport active = transport;
        transport = null;
        if (active == null) {
            return;
        }
        try {
            active.close();
        } catch (RuntimeException e) {
            logger.warn("Closing push transport failed: {}", e.getMessage());
        }
    }

    private void publish() {
        reconciler.reconcile();
    }

    /**
     * Moves transport callbacks onto the dispatch thread and drops those of replaced transports.
     */
    private final class TransportEvents implements PushTransport.Listener {
        private final PushTransport source;

        TransportEvents(PushTransport source) {
            this.source = source;
        }

        @Override
        public void onOpen() {
            dispatch("open", () -> onTransportOpen(source));
        }

        @Override
        public void onMessage(String text) {
            dispatch("message", () -> onTransportMessage(text));
        }

        @Override
        public void onError(Throwable error) {
            dispatch("error", () -> onTransportFailure(source, String.valueOf(error.getMessage())));
        }

        @Override
        public void onClosed(int code, String reason) {
            dispatch("close", () -> onTransportFailure(source, "closed with " + code + " " + reason));
        }

        private void dispatch(String kind, Runnable action) {
            scheduler.execute(() -> {
                if (transport != source) {
                    logger.debug("Ignoring {} from a replaced push transport", kind);
                    return;
                }
                action.run();
            });
        }
    }

    /**
     * Builder for creating RealtimeManager instances.
     */
    public static final class Builder {
        private final String baseUrl;
        private final RealtimeOptions.Builder optionsBuilder = RealtimeOptions.builder();
        private TransportProbe probe;
        private PushTransportFactory transportFactory;
        private PollingFetcher fetcher;
        private TaskScheduler scheduler;

        private Builder(String baseUrl) {
            if (baseUrl == null || baseUrl.isEmpty()) {
                throw new RealtimeException("baseUrl cannot be empty");
            }
            if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
                throw new RealtimeException("baseUrl must be an http(s) URL");
            }
            this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }

        /**
         * Sets the authentication token.
         *
         * @param token the bearer token
         * @return this builder
         */
        public Builder token(String token) {
            optionsBuilder.token(token);
            return this;
        }

        /**
         * Sets the connect and request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            optionsBuilder.timeout(timeout);
            return this;
        }

        /**
         * Sets the push endpoint path.
         *
         * @param pushPath the path, starting with '/'
         * @return this builder
         */
        public Builder pushPath(String pushPath) {
            optionsBuilder.pushPath(pushPath);
            return this;
        }

        /**
         * Enables or disables heartbeat pings.
         *
         * @param enabled whether to send heartbeats
         * @return this builder
         */
        public Builder heartbeatEnabled(boolean enabled) {
            optionsBuilder.heartbeatEnabled(enabled);
            return this;
        }

        /**
         * Sets heartbeat period and timeout.
         *
         * @param interval period between pings
         * @param timeout  time without a pong before the connection is considered dead
         * @return this builder
         */
        public Builder heartbeat(Duration interval, Duration timeout) {
            optionsBuilder.heartbeatInterval(interval).heartbeatTimeout(timeout);
            return this;
        }

        /**
         * Sets the status reconciler period.
         *
         * @param interval the period
         * @return this builder
         */
        public Builder reconcileInterval(Duration interval) {
            optionsBuilder.reconcileInterval(interval);
            return this;
        }

        /**
         * Registers a payload validator for one event.
         *
         * @param event     the event name
         * @param validator the validator
         * @return this builder
         */
        public Builder validator(String event, PayloadValidator validator) {
            optionsBuilder.validator(event, validator);
            return this;
        }

        /**
         * Sets the deployment probe. Defaults to {@link EnvironmentTransportProbe}.
         *
         * @param probe the probe
         * @return this builder
         */
        public Builder transportProbe(TransportProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe cannot be null");
            return this;
        }

        /**
         * Sets the push transport factory. Defaults to {@link WebSocketPushTransport}.
         *
         * @param transportFactory the factory
         * @return this builder
         */
        public Builder pushTransportFactory(PushTransportFactory transportFactory) {
            this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory cannot be null");
            return this;
        }

        /**
         * Sets the polling fetcher. Defaults to {@link HttpPollingFetcher}.
         *
         * @param fetcher the fetcher
         * @return this builder
         */
        public Builder pollingFetcher(PollingFetcher fetcher) {
            this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
            return this;
        }

        /**
         * Sets the dispatch scheduler. The caller keeps ownership and shuts it down.
         * Defaults to a private {@link ExecutorTaskScheduler}.
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
            return this;
        }

        /**
         * Builds the manager. No connection is made until {@link RealtimeManager#connect()}.
         *
         * @return the configured manager
         */
        public RealtimeManager build() {
            return new RealtimeManager(this, optionsBuilder.build());
        }
    }
}
