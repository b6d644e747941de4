package beacon.core.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.config.BrokerConfig;
import beacon.config.RateLimitingConfig;
import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.ClientInfo;
import beacon.core.model.connection.Connection;
import beacon.core.model.connection.ConnectionState;
import beacon.core.model.connection.Departure;
import beacon.core.model.event.BrokerError;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Identity;
import beacon.core.model.identity.IdentityResolution;
import beacon.core.model.lifecycle.Admission;
import beacon.core.model.lifecycle.BrokerStatus;
import beacon.core.model.ratelimit.RateLimitKey;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.ClientSocket;
import beacon.core.port.out.Metrics;
import beacon.core.port.out.RateLimiter;
import beacon.core.port.out.SharedStoreMonitor;

/**
 * Owns the connection lifecycle of a broker instance.
 *
 * <p>Lifecycle of a connection:
 * <ol>
 *   <li>{@link #admit}: identity resolution, then the per-identity connection-attempt limit</li>
 *   <li>{@link #activate}: registration, default channel enrollment, {@code connected} reply</li>
 *   <li>{@link #disconnect}: unregistration, and channel cleanup once the identity's last
 *       connection is gone</li>
 * </ol>
 *
 * <p>Registration plus enrollment, and unregistration plus channel cleanup, run under a
 * per-identity lock so a reconnect racing a disconnect never leaves a live connection without
 * its default channels.
 */
@ApplicationScoped
public class BrokerOrchestrator {

    private static final Logger LOG = Logger.getLogger(BrokerOrchestrator.class);

    static final short CLOSE_NORMAL = 1000;
    static final short CLOSE_GOING_AWAY = 1001;
    static final short CLOSE_INTERNAL_ERROR = 1011;

    private static final int LOCK_STRIPES = 64;

    private final IdentityGate identityGate;
    private final ConnectionRegistry registry;
    private final ChannelManager channelManager;
    private final EventRouter router;
    private final RateLimiter rateLimiter;
    private final SharedStoreMonitor storeMonitor;
    private final SharedStoreState storeState;
    private final Metrics metrics;
    private final Optional<RateLimitPolicy> connectLimit;
    private final Duration staleThreshold;
    private final Clock clock;

    private final Object[] identityLocks = new Object[LOCK_STRIPES];
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Instant startedAt;

    @Inject
    public BrokerOrchestrator(
            IdentityGate identityGate,
            ConnectionRegistry registry,
            ChannelManager channelManager,
            EventRouter router,
            RateLimiter rateLimiter,
            SharedStoreMonitor storeMonitor,
            SharedStoreState storeState,
            Metrics metrics,
            BrokerConfig brokerConfig,
            RateLimitingConfig rateLimitingConfig) {
        this(
                identityGate,
                registry,
                channelManager,
                router,
                rateLimiter,
                storeMonitor,
                storeState,
                metrics,
                rateLimitingConfig.enabled()
                        ? Optional.of(RateLimitPolicy.of(
                                rateLimitingConfig.connect().maxRequests(),
                                rateLimitingConfig.connect().window()))
                        : Optional.empty(),
                brokerConfig.staleThreshold(),
                Clock.systemUTC());
    }

    BrokerOrchestrator(
            IdentityGate identityGate,
            ConnectionRegistry registry,
            ChannelManager channelManager,
            EventRouter router,
            RateLimiter rateLimiter,
            SharedStoreMonitor storeMonitor,
            SharedStoreState storeState,
            Metrics metrics,
            Optional<RateLimitPolicy> connectLimit,
            Duration staleThreshold,
            Clock clock) {
        this.identityGate = identityGate;
        this.registry = registry;
        this.channelManager = channelManager;
        this.router = router;
        this.rateLimiter = rateLimiter;
        this.storeMonitor = storeMonitor;
        this.storeState = storeState;
        this.metrics = metrics;
        this.connectLimit = connectLimit;
        this.staleThreshold = staleThreshold;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            identityLocks[i] = new Object();
        }
    }

    /**
     * Start the broker: check the shared store and enable maintenance.
     *
     * <p>An unreachable store is not an error; the broker runs in single-process mode until a
     * later check succeeds. Calling this more than once has no effect.
     *
     * @return completion; never fails
     */
    public Uni<Void> initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return Uni.createFrom().voidItem();
        }
        startedAt = clock.instant();

        return checkSharedStore()
                .invoke(reachable -> {
                    if (!reachable) {
                        LOG.warn("Shared store unreachable at startup, running in single-process mode");
                    }
                    running.set(true);
                    LOG.infov(
                            "Broker initialized (rate limiter: {0}, shared store: {1})",
                            rateLimiter.name(),
                            reachable ? "available" : "unavailable");
                })
                .replaceWithVoid();
    }

    /**
     * Decide whether a handshake may be upgraded.
     *
     * @param token the bearer credential, if any
     * @return the admission; never fails
     */
    public Uni<Admission> admit(Optional<String> token) {
        return identityGate.resolve(token).flatMap(resolution -> {
            if (resolution instanceof IdentityResolution.Unauthenticated unauthenticated) {
                return Uni.createFrom().item(reject(BrokerError.UNAUTHENTICATED, unauthenticated.reason(), 0));
            }
            if (resolution instanceof IdentityResolution.IdentityNotFound notFound) {
                return Uni.createFrom()
                        .item(reject(BrokerError.IDENTITY_NOT_FOUND, "User " + notFound.userId() + " not found", 0));
            }
            return checkConnectLimit(((IdentityResolution.Resolved) resolution).identity());
        });
    }

    /**
     * Bind an admitted identity to its transport.
     *
     * @param identity   the admitted identity
     * @param socket     the upgraded transport
     * @param clientInfo handshake metadata
     * @return the active connection
     * @throws RuntimeException if the connection could not be set up; it is then unregistered
     *                          and its transport closed
     */
    public Connection activate(Identity identity, ClientSocket socket, ClientInfo clientInfo) {
        final var connection =
                new Connection(UUID.randomUUID().toString(), identity, clientInfo, socket, clock.instant());

        final List<ChannelId> rooms;
        try {
            ChannelManager.defaultChannelsFor(identity);
            synchronized (lockFor(identity.userId())) {
                registry.register(connection);
                rooms = channelManager.joinDefaultChannels(connection);
            }
        } catch (RuntimeException e) {
            abandon(connection, e);
            throw e;
        }
        connection.advanceTo(ConnectionState.ACTIVE);
        metrics.connectionOpened();

        final var roomIds = new JsonArray();
        rooms.forEach(room -> roomIds.add(room.value()));
        connection.send(OutboundEvent.of(
                OutboundEvent.CONNECTED,
                new JsonObject()
                        .put("userId", identity.userId())
                        .put("sessionId", connection.sessionId())
                        .put("connectedAt", connection.connectedAt().toString())
                        .put("rooms", roomIds)));

        LOG.infov(
                "User {0} ({1}) connected on session {2} from {3}",
                identity.userId(),
                identity.role(),
                connection.sessionId(),
                connection.device());
        return connection;
    }

    /**
     * Tear down a connection. Safe to call more than once.
     *
     * @param connection the connection
     * @param reason     why it ended, for logs
     * @return true if this call performed the teardown
     */
    public boolean disconnect(Connection connection, String reason) {
        if (!connection.markDisconnected()) {
            return false;
        }

        final Optional<Departure> departure;
        synchronized (lockFor(connection.userId())) {
            departure = registry.unregister(connection.sessionId());
            if (departure.map(Departure::lastForIdentity).orElse(false)) {
                channelManager.removeIdentityFromAllChannels(connection.userId());
            }
        }

        if (departure.isPresent()) {
            metrics.connectionClosed();
            LOG.infov(
                    "User {0} disconnected from session {1}: {2}",
                    connection.userId(),
                    connection.sessionId(),
                    reason);
        }
        return true;
    }

    /**
     * Close and remove connections idle for longer than the stale threshold.
     *
     * @return number of connections reaped
     */
    public int reapStaleConnections() {
        final var departures = registry.reapStale(staleThreshold);
        for (var departure : departures) {
            final var connection = departure.connection();
            connection.markDisconnected();
            metrics.connectionClosed();
            if (departure.lastForIdentity()) {
                synchronized (lockFor(connection.userId())) {
                    if (!registry.isOnline(connection.userId())) {
                        channelManager.removeIdentityFromAllChannels(connection.userId());
                    }
                }
            }
            connection.close(CLOSE_NORMAL, "Connection idle");
        }
        return departures.size();
    }

    /**
     * Remove expired rate-limit windows.
     *
     * @return number of windows removed; never fails
     */
    public Uni<Long> cleanupRateLimits() {
        return rateLimiter
                .cleanupExpired()
                .invoke(removed -> {
                    if (removed > 0) {
                        LOG.debugv("Removed {0} expired rate limit windows", removed);
                    }
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Rate limit cleanup failed: {0}", error.getMessage());
                    return 0L;
                });
    }

    /**
     * Check the shared store and update its availability.
     *
     * @return whether the store answered; never fails
     */
    public Uni<Boolean> checkSharedStore() {
        if (!storeMonitor.isShared()) {
            return Uni.createFrom().item(false);
        }
        return storeMonitor
                .ping()
                .onFailure()
                .recoverWithItem(false)
                .invoke(reachable -> storeState.recordCheck(reachable, clock.instant()));
    }

    public void logStatistics() {
        final var connections = registry.stats();
        final var channels = channelManager.stats();
        final var events = router.metrics();
        LOG.infov(
                "Broker statistics: {0} connections ({1} users), {2} channels, {3} events, {4} errors, "
                        + "{5} rate limited, shared store {6}",
                connections.totalConnections(),
                connections.uniqueIdentities(),
                channels.totalChannels(),
                events.totalEvents(),
                events.errorCount(),
                events.rateLimitHits(),
                storeState.isAvailable() ? "available" : "unavailable");
    }

    /**
     * Stop maintenance and close every transport.
     */
    public void shutdown() {
        running.set(false);
        final var connections = registry.drain();
        final var identities = new LinkedHashSet<String>();
        for (var connection : connections) {
            identities.add(connection.userId());
            if (connection.markDisconnected()) {
                metrics.connectionClosed();
            }
            connection.close(CLOSE_GOING_AWAY, "Server shutting down");
        }
        identities.forEach(channelManager::removeIdentityFromAllChannels);
        LOG.infov("Broker shut down, closed {0} connections", connections.size());
    }

    /**
     * Whether maintenance tasks should run.
     */
    public boolean isRunning() {
        return running.get();
    }

    public BrokerStatus status() {
        final var started = startedAt;
        return new BrokerStatus(
                initialized.get(),
                registry.connectionCount(),
                channelManager.channelCount(),
                started != null ? Duration.between(started, clock.instant()) : Duration.ZERO,
                storeState.isAvailable());
    }

    private Uni<Admission> checkConnectLimit(Identity identity) {
        if (connectLimit.isEmpty()) {
            return Uni.createFrom().item(new Admission.Admitted(identity));
        }

        final var policy = connectLimit.get();
        final var now = clock.instant();
        final var key = RateLimitKey.forWindow(identity.userId(), RateLimitKey.CONNECT_EVENT, policy, now);
        return rateLimiter
                .checkAndIncrement(key, policy)
                .map(decision -> {
                    if (decision.allowed()) {
                        return (Admission) new Admission.Admitted(identity);
                    }
                    metrics.recordRateLimitExceeded(RateLimitKey.CONNECT_EVENT);
                    return reject(
                            BrokerError.RATE_LIMITED,
                            "Too many connection attempts",
                            decision.retryAfterSeconds(now));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Connection rate check failed for user {0}: {1}", identity.userId(), error.getMessage());
                    return new Admission.Admitted(identity);
                });
    }

    private void abandon(Connection connection, RuntimeException cause) {
        LOG.errorv(cause, "Activation failed for user {0} on session {1}", connection.userId(), connection.sessionId());
        connection.markDisconnected();
        synchronized (lockFor(connection.userId())) {
            final var departure = registry.unregister(connection.sessionId());
            if (departure.map(Departure::lastForIdentity).orElse(false)) {
                channelManager.removeIdentityFromAllChannels(connection.userId());
            }
        }
        connection.close(CLOSE_INTERNAL_ERROR, "Connection setup failed");
    }

    private Admission reject(BrokerError error, String reason, long retryAfterSeconds) {
        LOG.warnv("Handshake rejected ({0}): {1}", error, reason);
        metrics.recordConnectionRejected(error);
        return new Admission.Rejected(error, reason, retryAfterSeconds);
    }

    private Object lockFor(String userId) {
        return identityLocks[Math.floorMod(userId.hashCode(), LOCK_STRIPES)];
    }
}
