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
import org.junit.jupiter.api.Nested;
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

@DisplayName("Room handlers")
class RoomHandlersTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final ChannelId LOBBY = ChannelId.parse("room:lobby");

    private ConnectionRegistry registry;
    private ChannelManager channelManager;
    private InMemoryChannelHistory history;
    private JoinRoomHandler joinHandler;
    private LeaveRoomHandler leaveHandler;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(new InMemoryConnectionReplica(), new SharedStoreState());
        channelManager = new ChannelManager(registry, mock(Metrics.class));
        history = new InMemoryChannelHistory(100);
        joinHandler = new JoinRoomHandler(channelManager, history);
        leaveHandler = new LeaveRoomHandler(channelManager);
    }

    private Connection connect(String userId, String role, RecordingClientSocket socket) {
        var connection = Connections.connection(Connections.identity(userId, role), socket);
        registry.register(connection);
        channelManager.joinDefaultChannels(connection);
        socket.clear();
        return connection;
    }

    private static InboundEvent room(String eventName, String roomId) {
        return InboundEvent.of(eventName, new JsonObject().put("roomId", roomId));
    }

    @Nested
    @DisplayName("join_room")
    class JoinTests {

        @Test
        @DisplayName("should confirm the join with recent history")
        void shouldConfirmJoinWithHistory() {
            for (int i = 0; i < 25; i++) {
                history.append(LOBBY, new JsonObject().put("id", "m" + i)).await().atMost(TIMEOUT);
            }
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);

            joinHandler.handle(connection, room("join_room", "room:lobby")).await().atMost(TIMEOUT);

            var joined = socket.eventsNamed("room_joined").get(0).getJsonObject("data");
            assertEquals("room:lobby", joined.getString("roomId"));
            assertEquals(1, joined.getInteger("members"));
            assertEquals(JoinRoomHandler.HISTORY_ON_JOIN, joined.getJsonArray("recentMessages").size());
            assertEquals("m24", joined.getJsonArray("recentMessages").getJsonObject(0).getString("id"));
        }

        @Test
        @DisplayName("should succeed when joining twice")
        void shouldSucceedWhenJoiningTwice() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);

            joinHandler.handle(connection, room("join_room", "room:lobby")).await().atMost(TIMEOUT);
            joinHandler.handle(connection, room("join_room", "room:lobby")).await().atMost(TIMEOUT);

            assertEquals(2, socket.eventsNamed("room_joined").size());
            assertEquals(1, channelManager.membersOf(LOBBY).size());
        }

        @Test
        @DisplayName("should forbid joining another organization")
        void shouldForbidOtherOrganization() {
            var connection = connect("u1", "donor", new RecordingClientSocket());

            var error = assertThrows(
                    BrokerException.class, () -> joinHandler.handle(connection, room("join_room", "ngo:99")));

            assertEquals(BrokerError.FORBIDDEN, error.getError());
        }
    }

    @Nested
    @DisplayName("leave_room")
    class LeaveTests {

        @Test
        @DisplayName("should confirm leaving a joined room")
        void shouldConfirmLeave() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            channelManager.join(connection, LOBBY);

            leaveHandler.handle(connection, room("leave_room", "room:lobby")).await().atMost(TIMEOUT);

            var left = socket.eventsNamed("room_left").get(0).getJsonObject("data");
            assertTrue(left.getBoolean("wasMember"));
            assertFalse(channelManager.isMember("u1", LOBBY));
        }

        @Test
        @DisplayName("should report leaving a room that was never joined")
        void shouldReportNonMembership() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);

            leaveHandler.handle(connection, room("leave_room", "room:lobby")).await().atMost(TIMEOUT);

            assertFalse(socket.eventsNamed("room_left").get(0).getJsonObject("data").getBoolean("wasMember"));
        }
    }
}
