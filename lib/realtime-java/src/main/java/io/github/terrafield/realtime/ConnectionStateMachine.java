package io.github.terrafield.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the current connection method and status.
 * <p>
 * Transitions run on the dispatch thread; {@link #current()} may be read from any thread.
 * <pre>
 * Disconnected -> Connecting -> Connected | Error
 * any          -> Polling
 * any          -> Disconnected (reset)
 * </pre>
 */
final class ConnectionStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionStateMachine.class);

    private volatile ConnectionState state = ConnectionState.INITIAL;

    ConnectionState current() {
        return state;
    }

    ConnectionMethod method() {
        return state.getMethod();
    }

    ConnectionStatus status() {
        return state.getStatus();
    }

    boolean isPushActive() {
        ConnectionState s = state;
        return s.getMethod() == ConnectionMethod.PUSH
                && (s.getStatus() == ConnectionStatus.CONNECTING || s.getStatus() == ConnectionStatus.CONNECTED);
    }

    boolean isPushConnected() {
        ConnectionState s = state;
        return s.getMethod() == ConnectionMethod.PUSH && s.getStatus() == ConnectionStatus.CONNECTED;
    }

    boolean isPolling() {
        return state.getMethod() == ConnectionMethod.POLLING;
    }

    void beginPush() {
        transition(new ConnectionState(ConnectionMethod.PUSH, ConnectionStatus.CONNECTING));
    }

    /**
     * @return false if no push attempt was in progress
     */
    boolean pushConnected() {
        if (state.getMethod() != ConnectionMethod.PUSH || state.getStatus() != ConnectionStatus.CONNECTING) {
            logger.debug("Ignoring push open in state {}", state);
            return false;
        }
        transition(new ConnectionState(ConnectionMethod.PUSH, ConnectionStatus.CONNECTED));
        return true;
    }

    /**
     * @return false if push was not the active method
     */
    boolean pushFailed() {
        if (state.getMethod() != ConnectionMethod.PUSH || state.getStatus() == ConnectionStatus.DISCONNECTED) {
            logger.debug("Ignoring push failure in state {}", state);
            return false;
        }
        transition(new ConnectionState(ConnectionMethod.PUSH, ConnectionStatus.ERROR));
        return true;
    }

    void enterPolling() {
        transition(ConnectionState.POLLING);
    }

    void reset() {
        transition(ConnectionState.INITIAL);
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous.equals(next)) {
            return;
        }
        state = next;
        logger.info("Connection {} -> {}", describe(previous), describe(next));
    }

    private static String describe(ConnectionState s) {
        return s.getMethod() + "/" + s.getStatus();
    }
}
