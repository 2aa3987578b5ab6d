package io.github.terrafield.realtime.errors;

/**
 * Thrown when an inbound frame or payload does not have the expected shape.
 */
public class InvalidPayloadError extends RealtimeException {

    private final String event;

    public InvalidPayloadError(String event, String message) {
        super(message);
        this.event = event;
    }

    public InvalidPayloadError(String event, String message, Throwable cause) {
        super(message, cause);
        this.event = event;
    }

    /**
     * Returns the event name the payload was addressed to, or null if the frame had none.
     *
     * @return the event name
     */
    public String getEvent() {
        return event;
    }
}
