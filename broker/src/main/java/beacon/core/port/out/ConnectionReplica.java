package beacon.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import beacon.core.model.connection.ConnectionRecord;
import beacon.core.model.connection.PresenceStatus;

/**
 * Port interface for replicating the connection table to the shared store.
 *
 * <p>Replication is best effort. Write operations must complete (never fail) within a
 * bounded time even when the store is unreachable.
 */
public interface ConnectionReplica {

    /**
     * Replace the replicated connection list of an identity.
     */
    Uni<Void> saveConnections(String userId, List<ConnectionRecord> connections);

    /**
     * Remove the replicated connection list of an identity.
     */
    Uni<Void> removeConnections(String userId);

    /**
     * Read the replicated connection list of an identity, possibly written by another instance.
     */
    Uni<List<ConnectionRecord>> connectionsOf(String userId);

    /**
     * Store the presence status of an identity.
     */
    Uni<Void> saveStatus(String userId, PresenceStatus status, Instant at);

    /**
     * Read the replicated presence status of an identity.
     *
     * @return the status, empty if unknown or the store is unreachable
     */
    Uni<Optional<PresenceStatus>> statusOf(String userId);
}
