package beacon.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.core.model.connection.Connection;
import beacon.core.model.connection.ConnectionRecord;
import beacon.core.model.connection.ConnectionStats;
import beacon.core.model.connection.Departure;
import beacon.core.model.connection.DeviceType;
import beacon.core.model.connection.PresenceStatus;
import beacon.core.model.event.OutboundEvent;
import beacon.core.port.out.ConnectionReplica;

/**
 * Tracks every live connection of this broker instance, per identity.
 *
 * <p>The in-memory table is the source of truth for local delivery. Each identity's list, and
 * the session index entries that belong to it, are replaced atomically inside
 * {@link ConcurrentHashMap#compute}, so concurrent register and unregister calls never lose
 * updates. After every change the full list
 * is replicated to the shared store, fire-and-forget, while the store is available.
 *
 * <p>Presence changes (first connection, last disconnection) are announced to every local
 * connection as {@code user_status_change}.
 */
@ApplicationScoped
public class ConnectionRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    static final Duration ACTIVITY_REPLICATION_INTERVAL = Duration.ofSeconds(30);

    private final ConcurrentHashMap<String, List<Connection>> connectionsByIdentity = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Connection> connectionsBySession = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> activityReplicatedAt = new ConcurrentHashMap<>();

    private final ConnectionReplica replica;
    private final SharedStoreState storeState;
    private final Clock clock;

    @Inject
    public ConnectionRegistry(ConnectionReplica replica, SharedStoreState storeState) {
        this(replica, storeState, Clock.systemUTC());
    }

    ConnectionRegistry(ConnectionReplica replica, SharedStoreState storeState, Clock clock) {
        this.replica = replica;
        this.storeState = storeState;
        this.clock = clock;
    }

    /**
     * Add a connection.
     *
     * @param connection the connection
     * @return true if this is the identity's first live connection
     */
    public boolean register(Connection connection) {
        final var userId = connection.userId();
        final var first = new AtomicBoolean(false);

        connectionsByIdentity.compute(userId, (id, existing) -> {
            connectionsBySession.put(connection.sessionId(), connection);
            if (existing == null || existing.isEmpty()) {
                first.set(true);
                return List.of(connection);
            }
            final var updated = new ArrayList<>(existing);
            updated.add(connection);
            return List.copyOf(updated);
        });

        replicate(userId);
        if (first.get()) {
            announce(userId, PresenceStatus.ONLINE);
        }

        LOG.debugv(
                "Registered session {0} for user {1} (first={2})", connection.sessionId(), userId, first.get());
        return first.get();
    }

    /**
     * Remove a connection.
     *
     * @param sessionId the transport session id
     * @return the departure, or empty if the session is unknown
     */
    public Optional<Departure> unregister(String sessionId) {
        final var connection = connectionsBySession.get(sessionId);
        if (connection == null) {
            return Optional.empty();
        }

        final var userId = connection.userId();
        final var removed = new AtomicBoolean(false);
        final var last = new AtomicBoolean(false);
        connectionsByIdentity.computeIfPresent(userId, (id, existing) -> {
            if (connectionsBySession.remove(sessionId) == null) {
                return existing;
            }
            removed.set(true);
            final var remaining = new ArrayList<>(existing);
            remaining.removeIf(c -> c.sessionId().equals(sessionId));
            if (remaining.isEmpty()) {
                last.set(true);
                return null;
            }
            return List.copyOf(remaining);
        });
        if (!removed.get()) {
            return Optional.empty();
        }

        if (last.get()) {
            activityReplicatedAt.remove(userId);
            if (storeState.isAvailable()) {
                fireAndForget(replica.removeConnections(userId), "removeConnections");
            }
            announce(userId, PresenceStatus.OFFLINE);
        } else {
            replicate(userId);
        }

        LOG.debugv("Unregistered session {0} for user {1} (last={2})", sessionId, userId, last.get());
        return Optional.of(new Departure(connection, last.get()));
    }

    public List<Connection> connectionsFor(String userId) {
        return connectionsByIdentity.getOrDefault(userId, List.of());
    }

    public boolean isOnline(String userId) {
        return connectionsByIdentity.containsKey(userId);
    }

    public Optional<Connection> find(String sessionId) {
        return Optional.ofNullable(connectionsBySession.get(sessionId));
    }

    /**
     * Record activity on a connection.
     *
     * <p>The new activity time reaches the shared store at most once per
     * {@link #ACTIVITY_REPLICATION_INTERVAL} per identity.
     *
     * @param sessionId the transport session id
     */
    public void touch(String sessionId) {
        final var connection = connectionsBySession.get(sessionId);
        if (connection == null) {
            return;
        }
        final var now = clock.instant();
        connection.touch(now);
        if (storeState.isAvailable() && claimActivityReplication(connection.userId(), now)) {
            replicate(connection.userId());
        }
    }

    /**
     * Send an event to every live connection of an identity.
     *
     * @return number of sockets written
     */
    public int deliverToIdentity(String userId, OutboundEvent event) {
        var delivered = 0;
        for (var connection : connectionsFor(userId)) {
            if (connection.send(event)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Send an event to every live connection on this instance.
     *
     * @return number of sockets written
     */
    public int broadcastToAll(OutboundEvent event) {
        var delivered = 0;
        for (var connection : snapshot()) {
            if (connection.send(event)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Copy of all live connections.
     */
    public List<Connection> snapshot() {
        return List.copyOf(connectionsBySession.values());
    }

    public int connectionCount() {
        return connectionsBySession.size();
    }

    public ConnectionStats stats() {
        final var connections = snapshot();
        final Map<String, Integer> byRole = new HashMap<>();
        final Map<DeviceType, Integer> byDevice = new EnumMap<>(DeviceType.class);
        for (var connection : connections) {
            byRole.merge(connection.identity().role(), 1, Integer::sum);
            byDevice.merge(connection.device(), 1, Integer::sum);
        }
        return new ConnectionStats(connections.size(), connectionsByIdentity.size(), byRole, byDevice);
    }

    /**
     * Remove connections idle for longer than the threshold.
     *
     * <p>Works from a snapshot so no lock is held while scanning. Closing the transports and
     * channel cleanup are left to the caller.
     *
     * @param threshold maximum idle time
     * @return the departures, in no particular order
     */
    public List<Departure> reapStale(Duration threshold) {
        final var now = clock.instant();
        final var departures = new ArrayList<Departure>();
        for (var connection : snapshot()) {
            if (connection.isStaleAt(now, threshold)) {
                unregister(connection.sessionId()).ifPresent(departures::add);
            }
        }
        if (!departures.isEmpty()) {
            LOG.infov("Reaped {0} stale connections (threshold {1})", departures.size(), threshold);
        }
        return departures;
    }

    /**
     * Presence of an identity across broker instances.
     *
     * <p>A local connection is authoritative. Otherwise the replicated status written by other
     * instances is consulted; anything unknown is reported offline.
     *
     * @param userId the identity
     * @return the presence status
     */
    public Uni<PresenceStatus> presence(String userId) {
        if (isOnline(userId)) {
            return Uni.createFrom().item(PresenceStatus.ONLINE);
        }
        if (!storeState.isAvailable()) {
            return Uni.createFrom().item(PresenceStatus.OFFLINE);
        }
        return replica.statusOf(userId).map(status -> status.orElse(PresenceStatus.OFFLINE));
    }

    /**
     * Replicated connections of an identity, as seen by every broker instance.
     */
    public Uni<List<ConnectionRecord>> replicatedConnections(String userId) {
        if (!storeState.isAvailable()) {
            return Uni.createFrom().item(connectionsFor(userId).stream().map(Connection::toRecord).toList());
        }
        return replica.connectionsOf(userId);
    }

    /**
     * Remove every connection without announcing presence changes. Used on shutdown.
     *
     * @return the removed connections
     */
    public List<Connection> drain() {
        final var connections = snapshot();
        connectionsBySession.clear();
        connectionsByIdentity.clear();
        activityReplicatedAt.clear();
        return connections;
    }

    /**
     * Store a presence status set explicitly by the client.
     */
    public void recordStatus(String userId, PresenceStatus status) {
        if (storeState.isAvailable()) {
            fireAndForget(replica.saveStatus(userId, status, clock.instant()), "saveStatus");
        }
    }

    private boolean claimActivityReplication(String userId, Instant now) {
        final var claimed = new AtomicBoolean(false);
        activityReplicatedAt.compute(userId, (id, previous) -> {
            if (previous != null && previous.plus(ACTIVITY_REPLICATION_INTERVAL).isAfter(now)) {
                return previous;
            }
            claimed.set(true);
            return now;
        });
        return claimed.get();
    }

    private void replicate(String userId) {
        if (!storeState.isAvailable()) {
            return;
        }
        final var records = connectionsFor(userId).stream().map(Connection::toRecord).toList();
        if (records.isEmpty()) {
            fireAndForget(replica.removeConnections(userId), "removeConnections");
        } else {
            fireAndForget(replica.saveConnections(userId, records), "saveConnections");
        }
    }

    private void announce(String userId, PresenceStatus status) {
        final var now = clock.instant();
        recordStatus(userId, status);
        final var event = OutboundEvent.of(
                OutboundEvent.USER_STATUS_CHANGE,
                new JsonObject()
                        .put("userId", userId)
                        .put("status", status.wireValue())
                        .put("timestamp", now.toString()));
        broadcastToAll(event);
    }

    private void fireAndForget(Uni<Void> operation, String operationName) {
        operation
                .subscribe()
                .with(
                        ignored -> {},
                        error -> LOG.warnv("Connection replication {0} failed: {1}", operationName, error.getMessage()));
    }
}
