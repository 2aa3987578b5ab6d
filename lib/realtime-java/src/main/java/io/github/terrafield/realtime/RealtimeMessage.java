package io.github.terrafield.realtime;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

import java.util.Objects;

/**
 * Decoded push frame: an event name and its payload.
 */
public final class RealtimeMessage {

    private final String event;
    private final JsonElement payload;

    /**
     * Creates a new message.
     *
     * @param event   the event name
     * @param payload the payload, null is stored as JSON null
     */
    public RealtimeMessage(String event, JsonElement payload) {
        this.event = Objects.requireNonNull(event, "event");
        this.payload = payload == null ? JsonNull.INSTANCE : payload;
    }

    /**
     * Returns the event name.
     *
     * @return the event name
     */
    public String getEvent() {
        return event;
    }

    /**
     * Returns the payload.
     *
     * @return the payload, never null
     */
    public JsonElement getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RealtimeMessage that = (RealtimeMessage) o;
        return event.equals(that.event) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, payload);
    }

    @Override
    public String toString() {
        return "RealtimeMessage{" +
                "event='" + event + '\'' +
                ", payload=" + payload +
                '}';
    }
}
