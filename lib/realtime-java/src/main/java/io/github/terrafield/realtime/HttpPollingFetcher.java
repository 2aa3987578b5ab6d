package io.github.terrafield.realtime;

import io.github.terrafield.realtime.errors.ConnectionError;
import io.github.terrafield.realtime.errors.FetchError;
import io.github.terrafield.realtime.errors.RealtimeException;

import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link PollingFetcher} issuing plain HTTP GET requests with {@link HttpClient}.
 * <p>
 * Query key elements after a leading copy of the endpoint are appended to it as
 * URL-encoded path segments.
 */
public final class HttpPollingFetcher implements PollingFetcher {

    private static final String HEADER_AUTH = "Authorization";
    private static final String HEADER_ACCEPT = "Accept";

    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * Creates a fetcher.
     *
     * @param baseUrl base URL that relative endpoints are resolved against
     * @param options client options supplying token and timeout
     */
    public HttpPollingFetcher(String baseUrl, RealtimeOptions options) {
        this(baseUrl, options, HttpClient.newBuilder()
                .connectTimeout(options.getTimeout())
                .build());
    }

    HttpPollingFetcher(String baseUrl, RealtimeOptions options, HttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = options.getToken();
        this.timeout = options.getTimeout();
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<String> fetch(String endpoint, List<String> queryKey) {
        URI uri;
        try {
            uri = resolve(endpoint, queryKey);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new RealtimeException("invalid endpoint: " + endpoint, e));
        }

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header(HEADER_ACCEPT, "application/json")
                .GET();

        // add auth header if token is set
        if (token != null) {
            requestBuilder.header(HEADER_AUTH, "Bearer " + token);
        }

        return httpClient.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, error) -> {
                    if (error != null) {
                        throw translate(endpoint, error);
                    }
                    int status = response.statusCode();
                    if (status >= 200 && status < 300) {
                        return response.body();
                    }
                    throw new FetchError(status, endpoint, response.body());
                });
    }

    URI resolve(String endpoint, List<String> queryKey) {
        StringBuilder url = new StringBuilder();
        if (endpoint.startsWith("http://") || endpoint.startsWith("https://")) {
            url.append(endpoint);
        } else {
            url.append(baseUrl);
            if (!endpoint.startsWith("/")) {
                url.append('/');
            }
            url.append(endpoint);
        }

        int start = !queryKey.isEmpty() && queryKey.get(0).equals(endpoint) ? 1 : 0;
        for (int i = start; i < queryKey.size(); i++) {
            if (url.charAt(url.length() - 1) != '/') {
                url.append('/');
            }
            url.append(encodeSegment(queryKey.get(i)));
        }
        return URI.create(url.toString());
    }

    private static String encodeSegment(String segment) {
        // URLEncoder produces form encoding, need to fix spaces
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static RealtimeException translate(String endpoint, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RealtimeException) {
            return (RealtimeException) cause;
        }
        if (cause instanceof HttpTimeoutException) {
            return new ConnectionError("request timeout", endpoint, cause);
        }
        if (cause instanceof ConnectException) {
            return new ConnectionError("connection failed", endpoint, cause);
        }
        return new ConnectionError("request failed (" + cause.getMessage() + ")", endpoint, cause);
    }
}
