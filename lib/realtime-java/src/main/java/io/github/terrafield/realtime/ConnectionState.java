package io.github.terrafield.realtime;

import java.util.Objects;

/**
 * Immutable pair of connection method and status, published atomically.
 */
public final class ConnectionState {

    /** state before the first connect and after disconnect */
    public static final ConnectionState INITIAL =
            new ConnectionState(ConnectionMethod.PUSH, ConnectionStatus.DISCONNECTED);

    /** state while polling is the active delivery path */
    public static final ConnectionState POLLING =
            new ConnectionState(ConnectionMethod.POLLING, ConnectionStatus.POLLING);

    private final ConnectionMethod method;
    private final ConnectionStatus status;

    /**
     * Creates a new connection state.
     *
     * @param method the connection method
     * @param status the connection status
     * @throws IllegalArgumentException if the status does not belong to the method
     */
    public ConnectionState(ConnectionMethod method, ConnectionStatus status) {
        this.method = Objects.requireNonNull(method, "method");
        this.status = Objects.requireNonNull(status, "status");
        boolean polling = method == ConnectionMethod.POLLING;
        if (polling != (status == ConnectionStatus.POLLING)) {
            throw new IllegalArgumentException("status " + status + " is not valid for method " + method);
        }
    }

    /**
     * Returns the connection method.
     *
     * @return the method
     */
    public ConnectionMethod getMethod() {
        return method;
    }

    /**
     * Returns the connection status.
     *
     * @return the status
     */
    public ConnectionStatus getStatus() {
        return status;
    }

    /**
     * Checks whether data is flowing: push connected, or polling.
     *
     * @return true if subscriptions are being fed
     */
    public boolean isLive() {
        return status == ConnectionStatus.CONNECTED || status == ConnectionStatus.POLLING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectionState that = (ConnectionState) o;
        return method == that.method && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, status);
    }

    @Override
    public String toString() {
        return "ConnectionState{" +
                "method=" + method +
                ", status=" + status +
                '}';
    }
}
