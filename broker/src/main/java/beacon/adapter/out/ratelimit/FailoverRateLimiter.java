package beacon.adapter.out.ratelimit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import beacon.core.model.ratelimit.RateLimitDecision;
import beacon.core.model.ratelimit.RateLimitKey;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.RateLimiter;
import beacon.core.service.SharedStoreState;

/**
 * Uses the shared limiter while the shared store is available and the local limiter otherwise.
 *
 * <p>A failed or timed-out shared check is answered by the local limiter, so limits keep
 * holding per instance in single-process mode.
 */
public final class FailoverRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(FailoverRateLimiter.class);

    private final RateLimiter shared;
    private final RateLimiter local;
    private final SharedStoreState storeState;

    public FailoverRateLimiter(RateLimiter shared, RateLimiter local, SharedStoreState storeState) {
        this.shared = shared;
        this.local = local;
        this.storeState = storeState;
    }

    @Override
    public Uni<RateLimitDecision> checkAndIncrement(RateLimitKey key, RateLimitPolicy policy) {
        if (!storeState.isAvailable()) {
            return local.checkAndIncrement(key, policy);
        }
        return shared.checkAndIncrement(key, policy).onFailure().recoverWithUni(error -> {
            LOG.debugv("Shared rate limit check failed, using {0}: {1}", local.name(), error.getMessage());
            return local.checkAndIncrement(key, policy);
        });
    }

    @Override
    public Uni<Long> cleanupExpired() {
        final var localCleanup = local.cleanupExpired();
        if (!storeState.isAvailable()) {
            return localCleanup;
        }
        final var sharedCleanup = shared.cleanupExpired().onFailure().recoverWithItem(0L);
        return Uni.combine()
                .all()
                .unis(localCleanup, sharedCleanup)
                .with((fromLocal, fromShared) -> fromLocal + fromShared);
    }

    @Override
    public String name() {
        return shared.name() + "+" + local.name();
    }
}
