package beacon.core.service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

/**
 * Tracks whether the shared store is currently usable.
 *
 * <p>Starts unavailable; the broker flips it after the first successful check. Any component
 * that observes a store failure may mark it unavailable, and only the periodic health check
 * marks it available again. There is no re-synchronisation of local state on recovery:
 * entries written while the store was down are replicated as connections churn.
 */
@ApplicationScoped
public class SharedStoreState {

    private static final Logger LOG = Logger.getLogger(SharedStoreState.class);

    private final AtomicBoolean available = new AtomicBoolean(false);
    private volatile Instant lastCheckAt;

    public boolean isAvailable() {
        return available.get();
    }

    public Optional<Instant> lastCheckAt() {
        return Optional.ofNullable(lastCheckAt);
    }

    /**
     * Record the result of a health check.
     *
     * @param reachable whether the store answered
     * @param at        check time
     */
    public void recordCheck(boolean reachable, Instant at) {
        lastCheckAt = at;
        if (reachable) {
            markAvailable();
        } else {
            markUnavailable("health check failed");
        }
    }

    public void markAvailable() {
        if (available.compareAndSet(false, true)) {
            LOG.info("Shared store available, cross-process replication enabled");
        }
    }

    public void markUnavailable(String reason) {
        if (available.compareAndSet(true, false)) {
            LOG.warnv("Shared store unavailable ({0}), running in single-process mode", reason);
        }
    }
}
