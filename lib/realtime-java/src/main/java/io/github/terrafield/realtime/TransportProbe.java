package io.github.terrafield.realtime;

/**
 * Classifies the deployment: whether push connections may be attempted at all.
 * Evaluated once per {@link RealtimeManager#connect()}.
 */
@FunctionalInterface
public interface TransportProbe {

    /** probe for deployments where push always may be tried */
    TransportProbe PUSH_ALLOWED = () -> false;

    /** probe for deployments that block push connections */
    TransportProbe PUSH_DISALLOWED = () -> true;

    /**
     * Checks whether push connections are blocked in this deployment.
     *
     * @return true if the manager must go straight to polling
     */
    boolean isPushDisallowed();
}
