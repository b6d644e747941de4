package beacon.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for checking shared store reachability.
 */
public interface SharedStoreMonitor {

    /**
     * Ping the store.
     *
     * @return true if the store answered within its timeout; never fails
     */
    Uni<Boolean> ping();

    /**
     * Whether this monitor targets an external store at all.
     *
     * @return false for the local-only implementation
     */
    boolean isShared();
}
