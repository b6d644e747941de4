package beacon.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import beacon.core.model.connection.ConnectionRecord;
import beacon.core.model.connection.PresenceStatus;
import beacon.core.port.out.ConnectionReplica;

/**
 * In-memory connection replica.
 *
 * <p>Used when no shared store is configured. Holds only this instance's connections, so it
 * adds no cross-process visibility.
 */
public class InMemoryConnectionReplica implements ConnectionReplica {

    private final ConcurrentMap<String, List<ConnectionRecord>> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PresenceStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> saveConnections(String userId, List<ConnectionRecord> records) {
        connections.put(userId, List.copyOf(records));
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> removeConnections(String userId) {
        connections.remove(userId);
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<List<ConnectionRecord>> connectionsOf(String userId) {
        return Uni.createFrom().item(connections.getOrDefault(userId, List.of()));
    }

    @Override
    public Uni<Void> saveStatus(String userId, PresenceStatus status, Instant at) {
        statuses.put(userId, status);
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Optional<PresenceStatus>> statusOf(String userId) {
        return Uni.createFrom().item(Optional.ofNullable(statuses.get(userId)));
    }
}
