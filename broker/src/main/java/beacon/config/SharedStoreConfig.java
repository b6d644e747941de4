package beacon.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared store (Redis).
 *
 * <p>Configuration prefix: {@code beacon.shared-store}
 *
 * <p>The Redis connection itself is configured through {@code quarkus.redis.hosts}
 * ({@code QUARKUS_REDIS_HOSTS}). When the store is disabled or unreachable the broker
 * runs in single-process mode.
 */
@ConfigMapping(prefix = "beacon.shared-store")
public interface SharedStoreConfig {

    /**
     * Use Redis for replication, rate-limit counters and history.
     *
     * @return true if the shared store is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Upper bound on every store call.
     *
     * @return operation timeout (default: 500ms)
     */
    @WithDefault("PT0.5S")
    Duration timeout();

    /**
     * Messages kept per channel in the rolling history.
     *
     * @return history length (default: 100)
     */
    @WithDefault("100")
    int channelHistorySize();

    /**
     * Emergency alerts kept in the rolling alert log.
     *
     * @return alert log length (default: 1000)
     */
    @WithDefault("1000")
    int alertLogSize();
}
