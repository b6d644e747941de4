package beacon.adapter.out.ratelimit;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import beacon.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import beacon.adapter.out.ratelimit.redis.RedisRateLimiter;
import beacon.adapter.out.storage.redis.RedisTimeoutHelper;
import beacon.config.RateLimitingConfig;
import beacon.config.SharedStoreConfig;
import beacon.core.port.out.Metrics;
import beacon.core.port.out.RateLimiter;
import beacon.core.service.SharedStoreState;

/**
 * CDI producer for the rate limiter.
 *
 * <p>Selects the implementation based on configuration and availability:
 * <ul>
 *   <li>Redis with in-memory failover - when the shared store is enabled and Redis is available</li>
 *   <li>In-memory - otherwise</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimiterProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimiterProviderLoader.class);

    private final RateLimitingConfig config;
    private final SharedStoreConfig storeConfig;
    private final SharedStoreState storeState;
    private final Metrics metrics;
    private final Instance<ReactiveRedisDataSource> redisDataSource;

    @Inject
    public RateLimiterProviderLoader(
            RateLimitingConfig config,
            SharedStoreConfig storeConfig,
            SharedStoreState storeState,
            Metrics metrics,
            Instance<ReactiveRedisDataSource> redisDataSource) {
        this.config = config;
        this.storeConfig = storeConfig;
        this.storeState = storeState;
        this.metrics = metrics;
        this.redisDataSource = redisDataSource;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        final var local = new InMemoryRateLimiter();
        final var rateLimiter = createRedisRateLimiter()
                .<RateLimiter>map(redis -> new FailoverRateLimiter(redis, local, storeState))
                .orElse(local);

        if (config.enabled()) {
            LOG.infov(
                    "Rate limiting enabled using {0}, connection limit {1}/{2}",
                    rateLimiter.name(),
                    config.connect().maxRequests(),
                    config.connect().window());
        } else {
            LOG.info("Rate limiting is disabled");
        }
        return rateLimiter;
    }

    private Optional<RateLimiter> createRedisRateLimiter() {
        if (!storeConfig.enabled()) {
            LOG.debug("Shared store not enabled, using in-memory rate limiting");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Shared store enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var helper = new RedisTimeoutHelper(storeConfig.timeout(), metrics, storeState, "rate-limiter");
            return Optional.of(new RedisRateLimiter(redisDataSource.get(), helper));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis rate limiter, falling back to in-memory");
            return Optional.empty();
        }
    }
}
