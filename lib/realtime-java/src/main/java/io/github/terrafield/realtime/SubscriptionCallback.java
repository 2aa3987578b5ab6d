package io.github.terrafield.realtime;

import com.google.gson.JsonElement;

/**
 * Sink for payloads delivered to a subscription.
 */
@FunctionalInterface
public interface SubscriptionCallback {

    /**
     * Receives one payload, either from a push message or from a polling fetch.
     * Invoked on the manager's dispatch thread; exceptions are logged and dropped.
     *
     * @param payload the decoded payload
     */
    void onPayload(JsonElement payload);
}
