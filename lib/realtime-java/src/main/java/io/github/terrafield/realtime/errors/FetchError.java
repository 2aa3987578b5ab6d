package io.github.terrafield.realtime.errors;

/**
 * Thrown when a polling endpoint answers with a non-success status.
 */
public class FetchError extends RealtimeException {

    private final int statusCode;
    private final String endpoint;

    /**
     * Creates a new FetchError.
     *
     * @param statusCode the HTTP status returned by the server
     * @param endpoint   the endpoint that was fetched
     * @param body       the response body, used in the message
     */
    public FetchError(int statusCode, String endpoint, String body) {
        super("HTTP " + statusCode + " from " + endpoint + (body == null || body.isEmpty() ? "" : ": " + body));
        this.statusCode = statusCode;
        this.endpoint = endpoint;
    }

    /**
     * Returns the HTTP status code.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the endpoint that failed.
     *
     * @return the endpoint
     */
    public String getEndpoint() {
        return endpoint;
    }
}
