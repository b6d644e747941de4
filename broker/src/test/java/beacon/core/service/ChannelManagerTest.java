package beacon.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import beacon.adapter.out.storage.memory.InMemoryConnectionReplica;
import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Identity;
import beacon.core.port.out.Metrics;
import beacon.support.Connections;
import beacon.support.MutableClock;
import beacon.support.RecordingClientSocket;

@DisplayName("ChannelManager")
class ChannelManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final ChannelId LOBBY = ChannelId.parse("room:lobby");

    private ConnectionRegistry registry;
    private Metrics metrics;
    private ChannelManager channelManager;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock(T0);
        registry = new ConnectionRegistry(new InMemoryConnectionReplica(), new SharedStoreState(), clock);
        metrics = mock(Metrics.class);
        channelManager = new ChannelManager(registry, metrics, clock);
    }

    private Connection connect(Identity identity, RecordingClientSocket socket) {
        var connection = Connections.connection(identity, socket, T0);
        registry.register(connection);
        channelManager.joinDefaultChannels(connection);
        socket.clear();
        return connection;
    }

    @Nested
    @DisplayName("Default channels")
    class DefaultChannelTests {

        @Test
        @DisplayName("should enroll role, organization, personal and system channels")
        void shouldEnrollDefaultChannels() {
            var identity = Connections.identity("u1", "ngo_admin", "42");

            var joined = channelManager.joinDefaultChannels(Connections.connection(identity, new RecordingClientSocket()));

            assertEquals(
                    List.of(
                            ChannelId.role("ngo_admin"),
                            ChannelId.organization("42"),
                            ChannelId.user("u1"),
                            ChannelId.SYSTEM_NOTIFICATIONS),
                    joined);
            assertEquals(Set.copyOf(joined), channelManager.channelsOf("u1"));
        }

        @Test
        @DisplayName("should skip the organization channel when the identity has none")
        void shouldSkipOrganizationChannel() {
            var joined = ChannelManager.defaultChannelsFor(Connections.identity("u1", "donor"));

            assertEquals(3, joined.size());
            assertFalse(joined.contains(ChannelId.organization("42")));
        }

        @Test
        @DisplayName("should refuse to leave a default channel")
        void shouldRefuseToLeaveDefaultChannel() {
            var connection = connect(Connections.identity("u1", "donor"), new RecordingClientSocket());

            var error = assertThrows(
                    BrokerException.class, () -> channelManager.leave(connection, ChannelId.role("donor")));

            assertEquals(BrokerError.FORBIDDEN, error.getError());
            assertTrue(channelManager.isMember("u1", ChannelId.role("donor")));
        }
    }

    @Nested
    @DisplayName("Join and leave")
    class JoinLeaveTests {

        @Test
        @DisplayName("should treat a repeated join as a no-op")
        void shouldTreatRepeatedJoinAsNoOp() {
            var connection = connect(Connections.identity("u1", "donor"), new RecordingClientSocket());

            assertTrue(channelManager.join(connection, LOBBY));
            assertFalse(channelManager.join(connection, LOBBY));

            assertEquals(Set.of("u1"), channelManager.membersOf(LOBBY));
        }

        @Test
        @DisplayName("should forbid joining another role's channel")
        void shouldForbidOtherRoleChannel() {
            var connection = connect(Connections.identity("u1", "donor"), new RecordingClientSocket());

            var error = assertThrows(
                    BrokerException.class, () -> channelManager.join(connection, ChannelId.role("volunteer")));

            assertEquals(BrokerError.FORBIDDEN, error.getError());
        }

        @Test
        @DisplayName("should forbid joining another user's personal channel")
        void shouldForbidOtherPersonalChannel() {
            var connection = connect(Connections.identity("u1", "donor"), new RecordingClientSocket());

            assertThrows(BrokerException.class, () -> channelManager.join(connection, ChannelId.user("u2")));
        }

        @Test
        @DisplayName("should let platform administrators join any channel")
        void shouldLetAdminsJoinAnyChannel() {
            var connection = connect(Connections.identity("root", "super_admin"), new RecordingClientSocket());

            assertTrue(channelManager.join(connection, ChannelId.role("donor")));
            assertTrue(channelManager.join(connection, ChannelId.organization("7")));
        }

        @Test
        @DisplayName("should announce room joins to existing members")
        void shouldAnnounceRoomJoins() {
            var aliceSocket = new RecordingClientSocket();
            var alice = connect(Connections.identity("alice", "donor"), aliceSocket);
            var bob = connect(Connections.identity("bob", "donor"), new RecordingClientSocket());
            channelManager.join(alice, LOBBY);
            aliceSocket.clear();

            channelManager.join(bob, LOBBY);

            var roomEvents = aliceSocket.eventsNamed(OutboundEvent.ROOM_EVENT);
            assertEquals(1, roomEvents.size());
            assertEquals("user_joined", roomEvents.get(0).getJsonObject("data").getString("type"));
            assertEquals("bob", roomEvents.get(0).getJsonObject("data").getString("userId"));
        }

        @Test
        @DisplayName("should discard a channel when its last member leaves")
        void shouldDiscardEmptyChannel() {
            var connection = connect(Connections.identity("u1", "donor"), new RecordingClientSocket());
            channelManager.join(connection, LOBBY);

            assertTrue(channelManager.leave(connection, LOBBY));
            assertFalse(channelManager.leave(connection, LOBBY));

            assertTrue(channelManager.createdAt(LOBBY).isEmpty());
        }
    }

    @Nested
    @DisplayName("Broadcast")
    class BroadcastTests {

        @Test
        @DisplayName("should deliver to every member except the excluded identity")
        void shouldHonourExclusion() {
            var senderSocket = new RecordingClientSocket();
            var receiverSocket = new RecordingClientSocket();
            var sender = connect(Connections.identity("sender", "donor"), senderSocket);
            var receiver = connect(Connections.identity("receiver", "donor"), receiverSocket);
            channelManager.join(sender, LOBBY);
            channelManager.join(receiver, LOBBY);
            senderSocket.clear();
            receiverSocket.clear();

            var delivered = channelManager.broadcast(
                    LOBBY, OutboundEvent.of("new_message", new JsonObject()), Optional.of("sender"));

            assertEquals(1, delivered);
            assertEquals(0, senderSocket.frameCount());
            assertEquals(1, receiverSocket.eventsNamed("new_message").size());
        }

        @Test
        @DisplayName("should deliver once per connection across overlapping channels")
        void shouldDeduplicateAcrossChannels() {
            var socket = new RecordingClientSocket();
            connect(Connections.identity("a1", "admin", "42"), socket);

            var delivered = channelManager.broadcastToChannels(
                    List.of(ChannelId.role("admin"), ChannelId.organization("42")),
                    OutboundEvent.of("program_updated", new JsonObject()),
                    Optional.empty());

            assertEquals(1, delivered);
            assertEquals(1, socket.eventsNamed("program_updated").size());
        }

        @Test
        @DisplayName("should return zero for a channel without members")
        void shouldReturnZeroForEmptyChannel() {
            assertEquals(0, channelManager.broadcast(LOBBY, OutboundEvent.of("x", null), Optional.empty()));
            verify(metrics).recordBroadcast("room", 0);
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class CleanupTests {

        @Test
        @DisplayName("should remove the identity everywhere and tell remaining room members")
        void shouldRemoveIdentityFromAllChannels() {
            var stayingSocket = new RecordingClientSocket();
            var leaving = connect(Connections.identity("leaving", "donor"), new RecordingClientSocket());
            var staying = connect(Connections.identity("staying", "donor"), stayingSocket);
            channelManager.join(leaving, LOBBY);
            channelManager.join(staying, LOBBY);
            stayingSocket.clear();

            var removed = channelManager.removeIdentityFromAllChannels("leaving");

            assertTrue(removed.contains(LOBBY));
            assertTrue(removed.contains(ChannelId.user("leaving")));
            assertTrue(channelManager.channelsOf("leaving").isEmpty());
            assertEquals(Set.of("staying"), channelManager.membersOf(LOBBY));
            assertTrue(channelManager.createdAt(ChannelId.user("leaving")).isEmpty());

            var roomEvents = stayingSocket.eventsNamed(OutboundEvent.ROOM_EVENT);
            assertEquals(1, roomEvents.size());
            assertEquals("user_left", roomEvents.get(0).getJsonObject("data").getString("type"));
        }

        @Test
        @DisplayName("should be a no-op for an identity without memberships")
        void shouldIgnoreUnknownIdentity() {
            assertTrue(channelManager.removeIdentityFromAllChannels("nobody").isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should keep channel and identity indexes in agreement under concurrent join and leave")
        void shouldKeepIndexesInAgreement() throws Exception {
            var users = List.of("a", "b", "c");
            var rooms = List.of(LOBBY, ChannelId.parse("room:stage"), ChannelId.parse("room:backstage"));
            var connections = new ArrayList<Connection>();
            for (var user : users) {
                connections.add(connect(Connections.identity(user, "donor"), new RecordingClientSocket()));
                connections.add(connect(Connections.identity(user, "donor"), new RecordingClientSocket()));
            }

            var start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(connections.size());
            try {
                var futures = new ArrayList<Future<?>>();
                for (var connection : connections) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        var random = ThreadLocalRandom.current();
                        for (int i = 0; i < 2_000; i++) {
                            var room = rooms.get(random.nextInt(rooms.size()));
                            if (random.nextBoolean()) {
                                channelManager.join(connection, room);
                            } else {
                                channelManager.leave(connection, room);
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (var future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            var liveRooms = new HashSet<ChannelId>();
            for (var user : users) {
                for (var room : rooms) {
                    var indexed = channelManager.channelsOf(user).contains(room);
                    assertEquals(channelManager.isMember(user, room), indexed, user + " in " + room);
                    if (indexed) {
                        liveRooms.add(room);
                    }
                }
            }
            for (var room : rooms) {
                assertEquals(liveRooms.contains(room), channelManager.createdAt(room).isPresent(), room.value());
            }
        }
    }
}
