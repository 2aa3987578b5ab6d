package io.github.terrafield.realtime;

import io.github.terrafield.realtime.errors.ConnectionError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PushTransport} over the JDK {@link WebSocket} client.
 * <p>
 * Outbound frames are chained so that at most one send is outstanding, as the JDK
 * client requires.
 */
public final class WebSocketPushTransport implements PushTransport {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketPushTransport.class);

    private final HttpClient httpClient;
    private final URI uri;
    private final String token;
    private final Duration timeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile WebSocket webSocket;
    private CompletableFuture<WebSocket> sendChain;

    /**
     * Creates a transport for one connection attempt.
     *
     * @param httpClient client used for the handshake
     * @param uri        ws:// or wss:// endpoint
     * @param token      bearer token for the handshake, or null
     * @param timeout    connect timeout
     */
    public WebSocketPushTransport(HttpClient httpClient, URI uri, String token, Duration timeout) {
        this.httpClient = httpClient;
        this.uri = uri;
        this.token = token;
        this.timeout = timeout;
    }

    /**
     * Returns a factory creating transports for the given base URL and options.
     *
     * @param baseUrl http(s) base URL of the server
     * @param options client options supplying push path, token and timeout
     * @return the factory
     */
    public static PushTransportFactory factory(String baseUrl, RealtimeOptions options) {
        URI uri = pushUri(baseUrl, options.getPushPath());
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(options.getTimeout())
                .build();
        return () -> new WebSocketPushTransport(httpClient, uri, options.getToken(), options.getTimeout());
    }

    static URI pushUri(String baseUrl, String pushPath) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (base.startsWith("https://")) {
            base = "wss://" + base.substring("https://".length());
        } else if (base.startsWith("http://")) {
            base = "ws://" + base.substring("http://".length());
        }
        return URI.create(base + pushPath);
    }

    @Override
    public void open(Listener listener) {
        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
                .connectTimeout(timeout);
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }

        logger.debug("Opening push connection to {}", uri);
        builder.buildAsync(uri, new FrameListener(listener))
                .whenComplete((ws, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        listener.onError(new ConnectionError("push connection failed", uri.toString(), cause));
                    } else if (closed.get()) {
                        // closed while the handshake was in flight
                        ws.abort();
                    }
                });
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = webSocket;
        return ws != null && !closed.get() && !ws.isOutputClosed() && !ws.isInputClosed();
    }

    @Override
    public synchronized boolean send(String text) {
        if (!isOpen()) {
            return false;
        }
        WebSocket ws = webSocket;
        if (sendChain == null) {
            sendChain = ws.sendText(text, true);
        } else {
            sendChain = sendChain
                    .exceptionally(error -> ws)
                    .thenCompose(previous -> previous.sendText(text, true));
        }
        sendChain.whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("Push send failed: {}", error.getMessage());
            }
        });
        return true;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = webSocket;
        if (ws == null) {
            return;
        }
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect")
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        logger.debug("Close handshake failed, aborting: {}", error.getMessage());
                    }
                    ws.abort();
                });
    }

    private final class FrameListener implements WebSocket.Listener {
        private final Listener listener;
        private final StringBuilder partial = new StringBuilder();

        FrameListener(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket ws) {
            webSocket = ws;
            ws.request(1);
            listener.onOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String frame = partial.toString();
                partial.setLength(0);
                listener.onMessage(frame);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            listener.onError(error);
        }
    }
}
