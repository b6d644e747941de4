package beacon.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;

import beacon.core.model.ratelimit.RateLimitDecision;
import beacon.core.model.ratelimit.RateLimitKey;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.RateLimiter;

/**
 * In-memory fixed-window rate limiter.
 *
 * <p>Stores counters in a concurrent hash map; each check-and-increment is atomic per key.
 * Suitable for single-instance deployments and as the local side of the failover limiter.
 *
 * <p>Limitations:
 * <ul>
 *   <li>State is not shared across instances</li>
 *   <li>State is lost on restart</li>
 * </ul>
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimiter() {
        this(Clock.systemUTC());
    }

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, RateLimitPolicy policy) {
        final var resetAt = key.windowEnd();
        final var decision = new AtomicReference<RateLimitDecision>();

        windows.compute(key.toStoreKey(), (storeKey, existing) -> {
            final var current = existing != null && existing.expiresAt().isAfter(clock.instant()) ? existing : null;
            final var count = current != null ? current.count() : 0L;
            if (count >= policy.maxRequests()) {
                decision.set(RateLimitDecision.rejected(count, policy.maxRequests(), resetAt));
                return current;
            }
            decision.set(RateLimitDecision.allow(count + 1, policy.maxRequests(), resetAt));
            return new Window(count + 1, resetAt);
        });

        return Uni.createFrom().item(decision.get());
    }

    @Override
    public Uni<Long> cleanupExpired() {
        final var now = clock.instant();
        final var before = windows.size();
        windows.entrySet().removeIf(entry -> !entry.getValue().expiresAt().isAfter(now));
        return Uni.createFrom().item((long) Math.max(0, before - windows.size()));
    }

    @Override
    public String name() {
        return "memory";
    }

    int trackedWindows() {
        return windows.size();
    }

    private record Window(long count, Instant expiresAt) {}
}
