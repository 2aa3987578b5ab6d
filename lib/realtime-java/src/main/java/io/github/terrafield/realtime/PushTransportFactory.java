package io.github.terrafield.realtime;

/**
 * Creates a fresh {@link PushTransport} for every connection attempt.
 */
@FunctionalInterface
public interface PushTransportFactory {

    /**
     * Creates an unopened transport.
     *
     * @return the transport
     */
    PushTransport create();
}
