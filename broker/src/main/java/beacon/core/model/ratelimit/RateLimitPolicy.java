package beacon.core.model.ratelimit;

import java.time.Duration;

/**
 * Fixed-window limit: at most {@code maxRequests} events per {@code window}.
 *
 * @param maxRequests maximum accepted events per window
 * @param window      window duration
 */
public record RateLimitPolicy(int maxRequests, Duration window) {

    public RateLimitPolicy {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.toMillis() <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RateLimitPolicy perMinute(int maxRequests) {
        return new RateLimitPolicy(maxRequests, Duration.ofMinutes(1));
    }

    public static RateLimitPolicy of(int maxRequests, Duration window) {
        return new RateLimitPolicy(maxRequests, window);
    }

    public long windowMillis() {
        return window.toMillis();
    }
}
