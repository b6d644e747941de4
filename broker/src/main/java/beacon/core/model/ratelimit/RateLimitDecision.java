package beacon.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed whether the event may proceed
 * @param count   events counted in the current window, including this one when allowed
 * @param limit   configured maximum for the window
 * @param resetAt when the current window ends
 */
public record RateLimitDecision(boolean allowed, long count, int limit, Instant resetAt) {

    public static RateLimitDecision allow(long count, int limit, Instant resetAt) {
        return new RateLimitDecision(true, count, limit, resetAt);
    }

    public static RateLimitDecision rejected(long count, int limit, Instant resetAt) {
        return new RateLimitDecision(false, count, limit, resetAt);
    }

    /**
     * Decision used when limiting is disabled.
     */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, 0, Integer.MAX_VALUE, Instant.EPOCH);
    }

    public long remaining() {
        return Math.max(0, limit - count);
    }

    public long retryAfterSeconds(Instant now) {
        final var millis = resetAt.toEpochMilli() - now.toEpochMilli();
        return Math.max(1, (millis + 999) / 1000);
    }
}
