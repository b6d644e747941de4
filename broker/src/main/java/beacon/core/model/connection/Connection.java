package beacon.core.model.connection;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Identity;
import beacon.core.port.out.ClientSocket;

/**
 * One live transport session belonging to an identity.
 *
 * <p>A connection is always bound to exactly one identity and one socket. The identity is
 * fixed for the lifetime of the session. Activity timestamps are written by the connection's
 * own event processing and read by maintenance tasks, so they are kept volatile.
 */
public final class Connection {

    private static final Logger LOG = Logger.getLogger(Connection.class);

    private final String sessionId;
    private final Identity identity;
    private final ClientInfo client;
    private final ClientSocket socket;
    private final Instant connectedAt;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.REGISTERED);
    private volatile Instant lastActivity;

    public Connection(String sessionId, Identity identity, ClientInfo client, ClientSocket socket, Instant connectedAt) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id cannot be blank");
        }
        if (identity == null) {
            throw new IllegalArgumentException("Identity cannot be null");
        }
        if (socket == null) {
            throw new IllegalArgumentException("Socket cannot be null");
        }
        this.sessionId = sessionId;
        this.identity = identity;
        this.client = client != null ? client : ClientInfo.unknown();
        this.socket = socket;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public Identity identity() {
        return identity;
    }

    public String userId() {
        return identity.userId();
    }

    public ClientInfo client() {
        return client;
    }

    public DeviceType device() {
        return client.device();
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public ConnectionState state() {
        return state.get();
    }

    public void touch(Instant now) {
        lastActivity = now;
    }

    public boolean isStaleAt(Instant now, Duration threshold) {
        return lastActivity.plus(threshold).isBefore(now);
    }

    /**
     * Move the connection to the next lifecycle state.
     *
     * @param next the target state
     * @return true if the transition happened, false if it is not allowed from the current state
     */
    public boolean advanceTo(ConnectionState next) {
        while (true) {
            final var current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * Mark the connection as disconnected.
     *
     * @return true only for the first call
     */
    public boolean markDisconnected() {
        return advanceTo(ConnectionState.DISCONNECTED);
    }

    /**
     * Whether the connection still carries its authenticated session.
     *
     * @return false once the connection is disconnected
     */
    public boolean isAuthenticated() {
        return identity != null && !isDisconnected();
    }

    public boolean isDisconnected() {
        return state.get() == ConnectionState.DISCONNECTED;
    }

    /**
     * Write an event to this connection's socket.
     *
     * @param event the event
     * @return true if the frame was handed to the transport
     */
    public boolean send(OutboundEvent event) {
        if (isDisconnected() || !socket.isOpen()) {
            return false;
        }
        try {
            return socket.send(event.encode());
        } catch (RuntimeException e) {
            LOG.debugv("Write to session {0} failed: {1}", sessionId, e.getMessage());
            return false;
        }
    }

    /**
     * Close the underlying transport. Safe to call more than once.
     *
     * @param code   WebSocket close code
     * @param reason close reason
     */
    public void close(short code, String reason) {
        if (socket.isOpen()) {
            socket.close(code, reason);
        }
    }

    /**
     * Build the replicated form of this connection.
     *
     * @return the connection record
     */
    public ConnectionRecord toRecord() {
        return new ConnectionRecord(
                sessionId,
                identity.userId(),
                identity.displayName(),
                identity.role(),
                identity.organizationId().orElse(null),
                client.device().name(),
                client.userAgent(),
                connectedAt.toEpochMilli(),
                lastActivity.toEpochMilli());
    }

    @Override
    public String toString() {
        return "Connection[" + sessionId + ", user=" + identity.userId() + ", state=" + state.get() + "]";
    }
}
