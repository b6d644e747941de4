package beacon.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the WebSocket broker.
 *
 * <p>Configuration prefix: {@code beacon.broker}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code BEACON_BROKER_PATH} - WebSocket endpoint path</li>
 *   <li>{@code BEACON_BROKER_ALLOWED_ORIGINS} - Comma separated list of allowed origins</li>
 *   <li>{@code BEACON_BROKER_MAX_CONNECTIONS} - Per-instance connection ceiling</li>
 *   <li>{@code BEACON_BROKER_HEARTBEAT_TIMEOUT} - Time to wait for a pong</li>
 * </ul>
 */
@ConfigMapping(prefix = "beacon.broker")
public interface BrokerConfig {

    /**
     * Path clients connect to.
     *
     * @return the WebSocket path (default: /ws)
     */
    @WithDefault("/ws")
    String path();

    /**
     * Origins allowed to open cross-origin connections.
     *
     * <p>Empty (or containing {@code *}) allows any origin. Handshakes without an
     * {@code Origin} header are always accepted.
     *
     * @return allowed origins
     */
    Optional<List<String>> allowedOrigins();

    /**
     * Maximum concurrent connections per broker instance.
     *
     * @return the connection limit (default: 10000)
     */
    @WithDefault("10000")
    int maxConnections();

    /**
     * Maximum accepted inbound frame size in bytes.
     *
     * @return frame size limit (default: 65536)
     */
    @WithDefault("65536")
    int maxFrameBytes();

    /**
     * Connections idle longer than this are reaped.
     *
     * @return stale threshold (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration staleThreshold();

    /**
     * Heartbeat configuration.
     */
    Heartbeat heartbeat();

    /**
     * Background maintenance intervals.
     */
    Maintenance maintenance();

    interface Heartbeat {

        /**
         * Whether the server sends WebSocket pings.
         *
         * @return true if heartbeats are enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Interval between pings.
         *
         * @return ping interval (default: 25 seconds)
         */
        @WithDefault("PT25S")
        Duration interval();

        /**
         * Time to wait for a pong before the transport is considered dead.
         *
         * @return pong timeout (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration timeout();
    }

    interface Maintenance {

        @WithDefault("PT5M")
        Duration reapInterval();

        @WithDefault("PT1M")
        Duration rateLimitCleanupInterval();

        @WithDefault("PT1M")
        Duration storeHealthInterval();

        @WithDefault("PT10M")
        Duration statsInterval();
    }
}
