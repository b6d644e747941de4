package beacon.adapter.out.ratelimit.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import beacon.adapter.out.storage.redis.RedisTimeoutHelper;
import beacon.core.model.ratelimit.RateLimitDecision;
import beacon.core.model.ratelimit.RateLimitKey;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.RateLimiter;

/**
 * Redis-based fixed-window rate limiter, shared by every broker instance.
 *
 * <p>Uses a Lua script so the read, the limit comparison and the increment are atomic. The
 * counter is created with a time-to-live of one window, so windows expire on their own.
 *
 * <p>Failures and timeouts propagate; callers decide how to degrade.
 *
 * <p>Key format: {@code ratelimit:{identityId}:{eventName}:{windowIndex}}
 */
public final class RedisRateLimiter implements RateLimiter {

    /**
     * Lua script for an atomic fixed-window check.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - maximum events per window</li>
     *   <li>ARGV[2] - window length in milliseconds (for TTL)</li>
     * </ol>
     *
     * <p>Returns array: [allowed (0/1), count]
     */
    static final String FIXED_WINDOW_SCRIPT =
            """
            local key = KEYS[1]
            local max_requests = tonumber(ARGV[1])
            local window_ms = tonumber(ARGV[2])

            local current = tonumber(redis.call('GET', key) or '0')
            if current >= max_requests then
                return {0, current}
            end

            local count = redis.call('INCR', key)
            if count == 1 then
                redis.call('PEXPIRE', key, window_ms)
            end
            return {1, count}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisRateLimiter(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, RateLimitPolicy policy) {
        // EVAL script numkeys key [key...] arg [arg...]
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        FIXED_WINDOW_SCRIPT,
                        "1", // numkeys
                        key.toStoreKey(), // KEYS[1]
                        String.valueOf(policy.maxRequests()), // ARGV[1]
                        String.valueOf(policy.windowMillis()) // ARGV[2]
                        )
                .map(response -> parseDecision(response, key, policy));
        return timeoutHelper.withTimeout(operation, "checkAndIncrement");
    }

    /**
     * Nothing to do: every counter carries a time-to-live of one window and Redis evicts it.
     *
     * @return always 0
     */
    @Override
    public Uni<Long> cleanupExpired() {
        return Uni.createFrom().item(0L);
    }

    @Override
    public String name() {
        return "redis";
    }

    private static RateLimitDecision parseDecision(Response response, RateLimitKey key, RateLimitPolicy policy) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from rate limit script");
        }

        final var allowed = response.get(0).toLong() == 1;
        final var count = response.get(1).toLong();
        return allowed
                ? RateLimitDecision.allow(count, policy.maxRequests(), key.windowEnd())
                : RateLimitDecision.rejected(count, policy.maxRequests(), key.windowEnd());
    }
}
