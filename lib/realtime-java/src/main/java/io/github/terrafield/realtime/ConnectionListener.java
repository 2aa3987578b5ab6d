package io.github.terrafield.realtime;

/**
 * Observer of connection state changes, typically a connectivity indicator in the UI.
 * <p>
 * Invoked on the manager's dispatch thread. Consecutive notifications always carry
 * different states.
 */
@FunctionalInterface
public interface ConnectionListener {

    /**
     * Called when the published connection state changes.
     *
     * @param previous the previously published state
     * @param current  the new state
     */
    void onConnectionChange(ConnectionState previous, ConnectionState current);
}
