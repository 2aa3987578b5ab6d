package io.github.terrafield.realtime.errors;

/**
 * Base exception for all realtime client errors.
 */
public class RealtimeException extends RuntimeException {

    /**
     * Creates a new RealtimeException with a message.
     *
     * @param message the error message
     */
    public RealtimeException(String message) {
        super(message);
    }

    /**
     * Creates a new RealtimeException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
