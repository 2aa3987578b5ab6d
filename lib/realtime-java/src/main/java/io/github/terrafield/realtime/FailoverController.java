package io.github.terrafield.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the manager between push and polling while keeping every registry entry armed
 * under the active mode.
 * <p>
 * A push failure sets status Error and, unless push was pinned by a manual override,
 * demotes to polling. Push is never retried automatically.
 */
final class FailoverController {
    private static final Logger logger = LoggerFactory.getLogger(FailoverController.class);

    private final ConnectionStateMachine stateMachine;
    private final DispatchEngine engine;
    private final Runnable publisher;

    private boolean pushPinned;

    FailoverController(ConnectionStateMachine stateMachine, DispatchEngine engine, Runnable publisher) {
        this.stateMachine = stateMachine;
        this.engine = engine;
        this.publisher = publisher;
    }

    void pinPush(boolean pinned) {
        this.pushPinned = pinned;
    }

    /**
     * Handles an error or unexpected close of the active push transport.
     *
     * @return true if the manager was demoted to polling
     */
    boolean onPushFailure(String reason) {
        if (!stateMachine.pushFailed()) {
            return false;
        }
        publisher.run();
        if (pushPinned) {
            logger.warn("Push transport failed ({}), staying on push as requested", reason);
            return false;
        }
        logger.warn("Push transport failed ({}), falling back to polling", reason);
        switchToPolling();
        return true;
    }

    /**
     * Tears down every timer and re-arms all pollable registry entries under polling.
     * No-op if polling is already active.
     */
    void switchToPolling() {
        if (stateMachine.isPolling()) {
            return;
        }
        engine.disarmAll();
        stateMachine.enterPolling();
        publisher.run();
        engine.armAll();
    }

    /**
     * Tears down every polling timer before a push attempt. Bindings stay in the
     * registry and are routed by event once push connects.
     */
    void switchToPush() {
        engine.disarmAll();
        stateMachine.beginPush();
        publisher.run();
    }
}
