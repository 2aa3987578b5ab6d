package io.github.terrafield.realtime.errors;

/**
 * Thrown when a network connection fails, for a polling fetch or the push handshake.
 */
public class ConnectionError extends RealtimeException {

    private final String target;

    /**
     * Creates a new ConnectionError.
     *
     * @param message the error message
     * @param target  the endpoint or push URI that could not be reached
     * @param cause   the underlying cause
     */
    public ConnectionError(String message, String target, Throwable cause) {
        super(message + ": " + target, cause);
        this.target = target;
    }

    /**
     * Returns the endpoint or push URI that could not be reached.
     *
     * @return the target
     */
    public String getTarget() {
        return target;
    }
}
