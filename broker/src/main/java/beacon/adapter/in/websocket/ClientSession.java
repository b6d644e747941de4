package beacon.adapter.in.websocket;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

import io.vertx.core.Context;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.ServerWebSocket;
import org.jboss.logging.Logger;

import beacon.core.model.connection.ClientInfo;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Identity;
import beacon.core.service.BrokerOrchestrator;
import beacon.core.service.EventRouter;

/**
 * Binds one upgraded WebSocket to its broker connection.
 *
 * <p>Inbound text frames are decoded and routed strictly in arrival order: the next frame is
 * taken only once the previous event's handling has completed. All queue access happens on the
 * socket's Vert.x context.
 *
 * <p>The server pings the client periodically; a missing pong closes the socket. Whatever the
 * cause, a closed socket goes through {@link BrokerOrchestrator#disconnect} exactly once, including
 * a socket that closes while its connection is being activated.
 */
public class ClientSession {

    private static final Logger LOG = Logger.getLogger(ClientSession.class);

    static final int MAX_PENDING_EVENTS = 256;

    private final ServerWebSocket socket;
    private final BrokerOrchestrator orchestrator;
    private final EventRouter router;
    private final Vertx vertx;
    private final Context context;
    private final int maxFrameBytes;
    private final boolean heartbeatEnabled;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;

    private Connection connection;
    private final Deque<String> pending = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private boolean processing;
    private long pingTimerId = -1;
    private long pongTimeoutTimerId = -1;

    public ClientSession(
            ServerWebSocket socket,
            BrokerOrchestrator orchestrator,
            EventRouter router,
            Vertx vertx,
            int maxFrameBytes,
            boolean heartbeatEnabled,
            Duration heartbeatInterval,
            Duration heartbeatTimeout) {
        this.socket = socket;
        this.orchestrator = orchestrator;
        this.router = router;
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
        this.maxFrameBytes = maxFrameBytes;
        this.heartbeatEnabled = heartbeatEnabled;
        this.heartbeatInterval = heartbeatInterval;
        this.heartbeatTimeout = heartbeatTimeout;
    }

    /**
     * Activate the connection for an admitted identity, install the socket handlers and start the
     * heartbeat.
     *
     * <p>Close and error handlers are installed before activation so a socket lost during setup
     * is still torn down.
     *
     * @param identity   the admitted identity
     * @param clientInfo handshake metadata
     * @return the active connection, or null if activation failed or the socket closed meanwhile
     */
    public Connection start(Identity identity, ClientInfo clientInfo) {
        socket.closeHandler(v -> onClosed("Client disconnected"));
        socket.exceptionHandler(error -> {
            LOG.debugv("Socket error on session {0}: {1}", sessionId(), error.getMessage());
            socket.close((short) 1011, "Socket error");
            onClosed("Socket error: " + error.getMessage());
        });

        try {
            connection = orchestrator.activate(identity, new VertxClientSocket(socket), clientInfo);
        } catch (RuntimeException e) {
            LOG.warnv("Session setup failed for user {0}: {1}", identity.userId(), e.getMessage());
            closed.set(true);
            return null;
        }

        if (closed.get()) {
            orchestrator.disconnect(connection, "Closed during setup");
            return null;
        }
        if (socket.isClosed()) {
            onClosed("Client disconnected");
            return null;
        }

        socket.textMessageHandler(this::onText);
        socket.binaryMessageHandler(buffer -> reply(BrokerError.INVALID_PAYLOAD, "Binary frames are not supported"));
        socket.pongHandler(buffer -> cancelPongTimeout());

        if (heartbeatEnabled) {
            startPingTimer();
        }
        return connection;
    }

    void onText(String frame) {
        if (closed.get()) {
            return;
        }
        if (frame.getBytes(StandardCharsets.UTF_8).length > maxFrameBytes) {
            reply(BrokerError.INVALID_PAYLOAD, "Frame exceeds " + maxFrameBytes + " bytes");
            return;
        }
        if (pending.size() >= MAX_PENDING_EVENTS) {
            LOG.warnv("Session {0} has too many pending events, closing", connection.sessionId());
            socket.close((short) 1008, "Too many pending events");
            onClosed("Too many pending events");
            return;
        }

        pending.add(frame);
        if (!processing) {
            processNext();
        }
    }

    private void processNext() {
        final var frame = pending.poll();
        if (frame == null || closed.get()) {
            processing = false;
            return;
        }
        processing = true;

        final InboundEvent event;
        try {
            event = InboundEvent.decode(frame);
        } catch (BrokerException e) {
            reply(e.getError(), e.getMessage());
            processNext();
            return;
        }

        router.route(connection, event)
                .subscribe()
                .with(
                        ignored -> context.runOnContext(v -> processNext()),
                        error -> {
                            LOG.errorv(
                                    error, "Routing {0} failed on session {1}", event.name(), connection.sessionId());
                            context.runOnContext(v -> processNext());
                        });
    }

    private void reply(BrokerError error, String message) {
        connection.send(OutboundEvent.error(error, message, null, Instant.now()));
    }

    private void startPingTimer() {
        pingTimerId = vertx.setPeriodic(heartbeatInterval.toMillis(), id -> {
            if (closed.get()) {
                return;
            }
            socket.writePing(Buffer.buffer("ping"));
            if (pongTimeoutTimerId == -1) {
                startPongTimeout();
            }
        });
    }

    private void startPongTimeout() {
        pongTimeoutTimerId = vertx.setTimer(heartbeatTimeout.toMillis(), id -> {
            pongTimeoutTimerId = -1;
            LOG.debugv("No pong from session {0} within {1}", connection.sessionId(), heartbeatTimeout);
            socket.close((short) 1002, "Ping timeout - no pong received");
            onClosed("Heartbeat timeout");
        });
    }

    private void cancelPongTimeout() {
        if (pongTimeoutTimerId != -1) {
            vertx.cancelTimer(pongTimeoutTimerId);
            pongTimeoutTimerId = -1;
        }
    }

    private void onClosed(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (pingTimerId != -1) {
            vertx.cancelTimer(pingTimerId);
        }
        cancelPongTimeout();
        pending.clear();
        if (connection != null) {
            orchestrator.disconnect(connection, reason);
        }
    }

    private String sessionId() {
        return connection != null ? connection.sessionId() : "(activating)";
    }

    boolean isClosed() {
        return closed.get();
    }
}
