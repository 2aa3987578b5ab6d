package io.github.terrafield.realtime;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Pull primitive used while polling.
 */
@FunctionalInterface
public interface PollingFetcher {

    /**
     * Fetches the current state of an endpoint without blocking the caller.
     *
     * @param endpoint the endpoint path or absolute URL
     * @param queryKey the query key elements of the subscription
     * @return future completed with the response body, or failed with a
     *         {@link io.github.terrafield.realtime.errors.RealtimeException}
     */
    CompletableFuture<String> fetch(String endpoint, List<String> queryKey);
}
