package io.github.terrafield.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TransportProbe} that reads the process environment.
 * <p>
 * {@code REALTIME_TRANSPORT=polling} blocks push and {@code REALTIME_TRANSPORT=websocket}
 * allows it. Without that setting, push is blocked when a marker variable of a hosting
 * platform known to drop long-lived sockets is present.
 */
public final class EnvironmentTransportProbe implements TransportProbe {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentTransportProbe.class);

    /** environment variable that selects the transport explicitly */
    public static final String TRANSPORT_VARIABLE = "REALTIME_TRANSPORT";

    /** marker variables of platforms that block push connections */
    public static final List<String> BLOCKING_PLATFORM_MARKERS = List.of("REPL_ID", "VERCEL");

    private final Map<String, String> environment;

    /**
     * Creates a probe over {@link System#getenv()}.
     */
    public EnvironmentTransportProbe() {
        this(System.getenv());
    }

    /**
     * Creates a probe over the given variables.
     *
     * @param environment the environment variables
     */
    public EnvironmentTransportProbe(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public boolean isPushDisallowed() {
        String setting = environment.get(TRANSPORT_VARIABLE);
        if (setting != null && !setting.isBlank()) {
            ConnectionMethod method = ConnectionMethod.fromValue(setting);
            if (method != null) {
                return method == ConnectionMethod.POLLING;
            }
            logger.warn("Ignoring unknown {} value '{}'", TRANSPORT_VARIABLE, setting);
        }
        for (String marker : BLOCKING_PLATFORM_MARKERS) {
            if (environment.containsKey(marker)) {
                logger.info("Push transport disabled, {} detected", marker);
                return true;
            }
        }
        return false;
    }
}
