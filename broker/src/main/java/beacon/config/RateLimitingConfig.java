package beacon.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code beacon.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code BEACON_RATE_LIMITING_ENABLED} - Enable/disable all limits</li>
 *   <li>{@code BEACON_RATE_LIMITING_CONNECT_MAX_REQUESTS} - Connection attempts per identity per window</li>
 * </ul>
 *
 * <p>Per-event limits are declared by each handler and may be overridden, e.g.
 * {@code beacon.rate-limiting.events."send_message".max-requests=200}.
 */
@ConfigMapping(prefix = "beacon.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Limit applied to handshakes per identity.
     */
    Limit connect();

    /**
     * Overrides keyed by event name.
     *
     * @return per-event overrides
     */
    Map<String, EventLimit> events();

    interface Limit {

        @WithDefault("100")
        int maxRequests();

        @WithDefault("PT60S")
        Duration window();
    }

    interface EventLimit {

        Optional<Integer> maxRequests();

        Optional<Duration> window();
    }
}
