package beacon.core.service.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.time.Duration;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import beacon.adapter.out.storage.memory.InMemoryConnectionReplica;
import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.InboundEvent;
import beacon.core.port.out.Metrics;
import beacon.core.service.ChannelManager;
import beacon.core.service.ConnectionRegistry;
import beacon.core.service.SharedStoreState;
import beacon.support.Connections;
import beacon.support.RecordingClientSocket;

@DisplayName("Typing indicator relays")
class TypingRelaysTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final ChannelId LOBBY = ChannelId.parse("room:lobby");

    private ConnectionRegistry registry;
    private ChannelManager channelManager;
    private TypingStartedRelay startedRelay;
    private TypingStoppedRelay stoppedRelay;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(new InMemoryConnectionReplica(), new SharedStoreState());
        channelManager = new ChannelManager(registry, mock(Metrics.class));
        startedRelay = new TypingStartedRelay(channelManager);
        stoppedRelay = new TypingStoppedRelay(channelManager);
    }

    private Connection connect(String userId, RecordingClientSocket socket, boolean inLobby) {
        var connection = Connections.connection(Connections.identity(userId, "volunteer"), socket);
        registry.register(connection);
        channelManager.joinDefaultChannels(connection);
        if (inLobby) {
            channelManager.join(connection, LOBBY);
        }
        return connection;
    }

    private static InboundEvent typing(String eventName, String room) {
        return InboundEvent.of(eventName, new JsonObject().put("room", room));
    }

    @Test
    @DisplayName("should tell the other members who started typing")
    void shouldRelayTypingStarted() {
        var senderSocket = new RecordingClientSocket();
        var peerSocket = new RecordingClientSocket();
        var outsiderSocket = new RecordingClientSocket();
        var sender = connect("alice", senderSocket, true);
        connect("bob", peerSocket, true);
        connect("carol", outsiderSocket, false);
        senderSocket.clear();
        peerSocket.clear();
        outsiderSocket.clear();

        startedRelay.handle(sender, typing("typing:start", "room:lobby")).await().atMost(TIMEOUT);

        var started = peerSocket.eventsNamed("typing:user_started");
        assertEquals(1, started.size());
        var data = started.get(0).getJsonObject("data");
        assertEquals("alice", data.getString("userId"));
        assertEquals("alice@example.org", data.getString("userName"));
        assertEquals("room:lobby", data.getString("room"));
        assertTrue(senderSocket.eventsNamed("typing:user_started").isEmpty());
        assertEquals(0, outsiderSocket.frameCount());
    }

    @Test
    @DisplayName("should relay typing stopped without the display name")
    void shouldRelayTypingStopped() {
        var sender = connect("alice", new RecordingClientSocket(), true);
        var peerSocket = new RecordingClientSocket();
        connect("bob", peerSocket, true);
        peerSocket.clear();

        stoppedRelay.handle(sender, typing("typing:stop", "room:lobby")).await().atMost(TIMEOUT);

        var data = peerSocket.eventsNamed("typing:user_stopped").get(0).getJsonObject("data");
        assertEquals("alice", data.getString("userId"));
        assertFalse(data.containsKey("userName"));
    }

    @Test
    @DisplayName("should refuse indicators for a channel the sender is not in")
    void shouldRefuseNonMembers() {
        var outsider = connect("carol", new RecordingClientSocket(), false);
        connect("bob", new RecordingClientSocket(), true);

        var error = assertThrows(
                BrokerException.class, () -> startedRelay.handle(outsider, typing("typing:start", "room:lobby")));

        assertEquals(BrokerError.FORBIDDEN, error.getError());
    }

    @Test
    @DisplayName("should require a room")
    void shouldRequireRoom() {
        var sender = connect("alice", new RecordingClientSocket(), true);

        assertThrows(
                BrokerException.class,
                () -> startedRelay.handle(sender, InboundEvent.of("typing:start", new JsonObject())));
    }
}
