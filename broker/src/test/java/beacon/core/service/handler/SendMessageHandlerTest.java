package beacon.core.service.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.time.Duration;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import beacon.adapter.out.storage.memory.InMemoryChannelHistory;
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

@DisplayName("SendMessageHandler")
class SendMessageHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final ChannelId LOBBY = ChannelId.parse("room:lobby");

    private ConnectionRegistry registry;
    private ChannelManager channelManager;
    private InMemoryChannelHistory history;
    private SendMessageHandler handler;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(new InMemoryConnectionReplica(), new SharedStoreState());
        channelManager = new ChannelManager(registry, mock(Metrics.class));
        history = new InMemoryChannelHistory(100);
        handler = new SendMessageHandler(channelManager, history);
    }

    private Connection connect(String userId, String role, RecordingClientSocket socket) {
        var connection = Connections.connection(Connections.identity(userId, role), socket);
        registry.register(connection);
        channelManager.joinDefaultChannels(connection);
        return connection;
    }

    private static InboundEvent message(String roomId, String text) {
        return InboundEvent.of("send_message", new JsonObject().put("roomId", roomId).put("message", text));
    }

    @Test
    @DisplayName("should store the message and broadcast it to every member including the sender")
    void shouldStoreAndBroadcast() {
        var senderSocket = new RecordingClientSocket();
        var readerSocket = new RecordingClientSocket();
        var sender = connect("alice", "donor", senderSocket);
        var reader = connect("bob", "donor", readerSocket);
        channelManager.join(sender, LOBBY);
        channelManager.join(reader, LOBBY);

        handler.handle(sender, message("room:lobby", "hello")).await().atMost(TIMEOUT);

        var received = readerSocket.eventsNamed("new_message");
        assertEquals(1, received.size());
        var data = received.get(0).getJsonObject("data");
        assertEquals("alice", data.getString("senderId"));
        assertEquals("hello", data.getString("message"));
        assertEquals("text", data.getString("messageType"));
        assertEquals("room:lobby", data.getString("roomId"));
        assertEquals(1, senderSocket.eventsNamed("new_message").size());

        var stored = history.recent(LOBBY, 10).await().atMost(TIMEOUT);
        assertEquals(1, stored.size());
        assertEquals(data.getString("id"), stored.get(0).getString("id"));
    }

    @Test
    @DisplayName("should refuse messages from non-members")
    void shouldRefuseNonMembers() {
        var outsider = connect("mallory", "donor", new RecordingClientSocket());

        var error = assertThrows(BrokerException.class, () -> handler.handle(outsider, message("room:lobby", "hi")));

        assertEquals(BrokerError.FORBIDDEN, error.getError());
        assertTrue(history.recent(LOBBY, 10).await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should refuse messages over the length limit")
    void shouldRefuseLongMessages() {
        var sender = connect("alice", "donor", new RecordingClientSocket());
        channelManager.join(sender, LOBBY);

        var error = assertThrows(
                BrokerException.class,
                () -> handler.handle(sender, message("room:lobby", "x".repeat(SendMessageHandler.MAX_MESSAGE_LENGTH + 1))));

        assertEquals(BrokerError.INVALID_PAYLOAD, error.getError());
    }

    @Test
    @DisplayName("should reserve system channels for administrators")
    void shouldReserveSystemChannels() {
        var donor = connect("alice", "donor", new RecordingClientSocket());
        var adminSocket = new RecordingClientSocket();
        var admin = connect("root", "admin", adminSocket);

        var error = assertThrows(
                BrokerException.class, () -> handler.handle(donor, message("system:notifications", "spam")));
        assertEquals(BrokerError.FORBIDDEN, error.getError());

        handler.handle(admin, message("system:notifications", "maintenance at noon")).await().atMost(TIMEOUT);
        assertEquals(1, adminSocket.eventsNamed("new_message").size());
    }

    @Test
    @DisplayName("should reject malformed room ids")
    void shouldRejectMalformedRoomIds() {
        var sender = connect("alice", "donor", new RecordingClientSocket());

        var error = assertThrows(BrokerException.class, () -> handler.handle(sender, message("lobby", "hi")));

        assertEquals(BrokerError.INVALID_CHANNEL, error.getError());
    }
}
