package beacon.core.port.out;

import io.smallrye.mutiny.Uni;

import beacon.core.model.ratelimit.RateLimitDecision;
import beacon.core.model.ratelimit.RateLimitKey;
import beacon.core.model.ratelimit.RateLimitPolicy;

/**
 * Port interface for fixed-window rate limiting.
 *
 * <p>All operations are non-blocking and return reactive types.
 */
public interface RateLimiter {

    /**
     * Count an event against its window.
     *
     * <p>If the window already holds {@code maxRequests} events the event is rejected and the
     * counter is left unchanged. Otherwise the counter is incremented, created with a
     * time-to-live of one window when absent.
     *
     * @param key    the counter key
     * @param policy the limit to apply
     * @return the decision
     */
    Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, RateLimitPolicy policy);

    /**
     * Remove expired counters.
     *
     * @return number of counters removed
     */
    Uni<Long> cleanupExpired();

    /**
     * Name used in logs and status reports.
     */
    String name();
}
