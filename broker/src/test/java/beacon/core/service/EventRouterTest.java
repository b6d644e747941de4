package beacon.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import beacon.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import beacon.adapter.out.storage.memory.InMemoryConnectionReplica;
import beacon.config.RateLimitingConfig;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.Metrics;
import beacon.core.service.handler.DashboardMetricsHandler;
import beacon.core.service.handler.PingHandler;
import beacon.support.Connections;
import beacon.support.MutableClock;
import beacon.support.RecordingClientSocket;

@DisplayName("EventRouter")
class EventRouterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private ConnectionRegistry registry;
    private ChannelManager channelManager;
    private Metrics metrics;
    private InMemoryRateLimiter rateLimiter;
    private RecordingHandler echo;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        metrics = mock(Metrics.class);
        registry = new ConnectionRegistry(new InMemoryConnectionReplica(), new SharedStoreState(), clock);
        channelManager = new ChannelManager(registry, metrics, clock);
        rateLimiter = new InMemoryRateLimiter(clock);
        echo = new RecordingHandler(
                "echo", HandlerPolicy.authenticated(RateLimitPolicy.of(3, Duration.ofMillis(1000))), null);
    }

    private EventRouter router(EventHandler... handlers) {
        return router(true, Map.of(), handlers);
    }

    private EventRouter router(
            boolean rateLimiting, Map<String, RateLimitingConfig.EventLimit> overrides, EventHandler... handlers) {
        return new EventRouter(List.of(handlers), rateLimiter, registry, metrics, rateLimiting, overrides, clock);
    }

    private Connection connect(String userId, String role, RecordingClientSocket socket) {
        var connection = Connections.connection(Connections.identity(userId, role), socket, T0);
        registry.register(connection);
        socket.clear();
        return connection;
    }

    private static InboundEvent event(String name) {
        return InboundEvent.of(name, new JsonObject());
    }

    private static String errorCode(JsonObject frame) {
        return frame.getJsonObject("data").getString("code");
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("should reply UNKNOWN_EVENT for unregistered names and keep counters unchanged")
        void shouldRejectUnknownEvents() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var router = router(echo);

            router.route(connection, event("teleport")).await().atMost(TIMEOUT);

            var reply = socket.lastEvent();
            assertEquals(OutboundEvent.ERROR, reply.getString("event"));
            assertEquals("UNKNOWN_EVENT", errorCode(reply));
            assertEquals("teleport", reply.getJsonObject("data").getString("eventType"));
            assertEquals(0, router.metrics().totalEvents());
            assertEquals(0, router.metrics().errorCount());
        }

        @Test
        @DisplayName("should invoke the handler and count the event")
        void shouldInvokeHandler() {
            var connection = connect("u1", "donor", new RecordingClientSocket());
            var router = router(echo);

            router.route(connection, event("echo")).await().atMost(TIMEOUT);

            assertEquals(1, echo.invocations.size());
            assertEquals(1, router.metrics().totalEvents());
            assertEquals(1L, router.metrics().eventsByType().get("echo"));
            verify(metrics).recordEvent("echo", "ok");
        }

        @Test
        @DisplayName("should record activity on the sending connection")
        void shouldRecordActivity() {
            var connection = connect("u1", "donor", new RecordingClientSocket());
            var router = router(echo);
            clock.advance(Duration.ofMinutes(5));

            router.route(connection, event("echo")).await().atMost(TIMEOUT);

            assertEquals(T0.plus(Duration.ofMinutes(5)), connection.lastActivity());
        }

        @Test
        @DisplayName("should reject duplicate handler registrations")
        void shouldRejectDuplicateHandlers() {
            var duplicate = new RecordingHandler("echo", HandlerPolicy.open(), null);

            assertThrows(IllegalStateException.class, () -> router(echo, duplicate));
        }
    }

    @Nested
    @DisplayName("Access control")
    class AccessControlTests {

        @Test
        @DisplayName("should forbid donors from requesting dashboard metrics")
        void shouldForbidDonorDashboard() {
            var socket = new RecordingClientSocket();
            var connection = connect("donor-1", "donor", socket);
            var router = router(new DashboardMetricsHandler(registry, channelManager));

            router.route(connection, event("dashboard_metrics_request")).await().atMost(TIMEOUT);

            assertEquals("FORBIDDEN", errorCode(socket.lastEvent()));
            assertTrue(socket.eventsNamed("dashboard_metrics_response").isEmpty());
        }

        @Test
        @DisplayName("should require an authenticated connection for protected events")
        void shouldRequireAuthentication() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var router = router(echo);
            connection.markDisconnected();

            router.route(connection, event("echo")).await().atMost(TIMEOUT);

            assertTrue(echo.invocations.isEmpty());
        }

        @Test
        @DisplayName("should serve open events without rate limiting")
        void shouldServeOpenEvents() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var router = router(new PingHandler());

            for (int i = 0; i < 20; i++) {
                router.route(connection, event("ping")).await().atMost(TIMEOUT);
            }

            assertEquals(20, socket.eventsNamed(OutboundEvent.PONG).size());
        }
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimitingTests {

        @Test
        @DisplayName("should allow three events per second and reject the fourth")
        void shouldRejectFourthEventInWindow() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var router = router(echo);

            for (int i = 0; i < 4; i++) {
                router.route(connection, event("echo")).await().atMost(TIMEOUT);
            }

            assertEquals(3, echo.invocations.size());
            assertEquals("RATE_LIMITED", errorCode(socket.lastEvent()));
            assertEquals(1, router.metrics().rateLimitHits());
            verify(metrics).recordRateLimitExceeded("echo");
        }

        @Test
        @DisplayName("should accept events again in the next window")
        void shouldResetInNextWindow() {
            var connection = connect("u1", "donor", new RecordingClientSocket());
            var router = router(echo);
            for (int i = 0; i < 4; i++) {
                router.route(connection, event("echo")).await().atMost(TIMEOUT);
            }

            clock.advance(Duration.ofMillis(1000));
            router.route(connection, event("echo")).await().atMost(TIMEOUT);

            assertEquals(4, echo.invocations.size());
        }

        @Test
        @DisplayName("should count each identity separately")
        void shouldCountIdentitiesSeparately() {
            var alice = connect("alice", "donor", new RecordingClientSocket());
            var bob = connect("bob", "donor", new RecordingClientSocket());
            var router = router(echo);

            for (int i = 0; i < 3; i++) {
                router.route(alice, event("echo")).await().atMost(TIMEOUT);
                router.route(bob, event("echo")).await().atMost(TIMEOUT);
            }

            assertEquals(6, echo.invocations.size());
        }

        @Test
        @DisplayName("should apply configured overrides")
        void shouldApplyOverrides() {
            var connection = connect("u1", "donor", new RecordingClientSocket());
            RateLimitingConfig.EventLimit oneAllowed = new RateLimitingConfig.EventLimit() {
                @Override
                public Optional<Integer> maxRequests() {
                    return Optional.of(1);
                }

                @Override
                public Optional<Duration> window() {
                    return Optional.empty();
                }
            };
            var router = router(true, Map.of("echo", oneAllowed), echo);

            router.route(connection, event("echo")).await().atMost(TIMEOUT);
            router.route(connection, event("echo")).await().atMost(TIMEOUT);

            assertEquals(1, echo.invocations.size());
            assertEquals(Duration.ofMillis(1000), router.policyFor("echo").orElseThrow().rateLimit().orElseThrow().window());
        }

        @Test
        @DisplayName("should not limit when rate limiting is disabled")
        void shouldNotLimitWhenDisabled() {
            var connection = connect("u1", "donor", new RecordingClientSocket());
            var router = router(false, Map.of(), echo);

            for (int i = 0; i < 10; i++) {
                router.route(connection, event("echo")).await().atMost(TIMEOUT);
            }

            assertEquals(10, echo.invocations.size());
            assertTrue(router.policyFor("echo").orElseThrow().rateLimit().isEmpty());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should report broker exceptions with their error code")
        void shouldReportBrokerExceptions() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var failing = new RecordingHandler(
                    "fail", HandlerPolicy.open(), BrokerException.invalidPayload("roomId is required"));
            var router = router(failing);

            router.route(connection, event("fail")).await().atMost(TIMEOUT);

            var reply = socket.lastEvent().getJsonObject("data");
            assertEquals("INVALID_PAYLOAD", reply.getString("code"));
            assertEquals("roomId is required", reply.getString("message"));
            assertEquals(1, router.metrics().errorCount());
            assertEquals(0, router.metrics().totalEvents());
        }

        @Test
        @DisplayName("should hide unexpected failures behind INTERNAL_ERROR")
        void shouldHideUnexpectedFailures() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var failing = new RecordingHandler("fail", HandlerPolicy.open(), new IllegalStateException("boom"));
            var router = router(failing);

            router.route(connection, event("fail")).await().atMost(TIMEOUT);

            var reply = socket.lastEvent().getJsonObject("data");
            assertEquals(BrokerError.INTERNAL_ERROR.name(), reply.getString("code"));
            assertEquals(BrokerError.INTERNAL_ERROR.defaultMessage(), reply.getString("message"));
        }

        @Test
        @DisplayName("should keep routing after a failure")
        void shouldKeepRoutingAfterFailure() {
            var socket = new RecordingClientSocket();
            var connection = connect("u1", "donor", socket);
            var failing = new RecordingHandler("fail", HandlerPolicy.open(), new IllegalStateException("boom"));
            var router = router(failing, new PingHandler());

            router.route(connection, event("fail")).await().atMost(TIMEOUT);
            router.route(connection, event("ping")).await().atMost(TIMEOUT);

            assertEquals(OutboundEvent.PONG, socket.lastEvent().getString("event"));
        }

        @Test
        @DisplayName("should reset counters on request")
        void shouldResetCounters() {
            var connection = connect("u1", "donor", new RecordingClientSocket());
            var router = router(echo);
            router.route(connection, event("echo")).await().atMost(TIMEOUT);

            router.resetMetrics();

            assertEquals(0, router.metrics().totalEvents());
            assertTrue(router.metrics().eventsByType().isEmpty());
            assertEquals(Set.of("echo"), router.eventNames());
        }
    }

    private static final class RecordingHandler implements EventHandler {

        private final String name;
        private final HandlerPolicy policy;
        private final RuntimeException failure;
        private final List<InboundEvent> invocations = new ArrayList<>();

        private RecordingHandler(String name, HandlerPolicy policy, RuntimeException failure) {
            this.name = name;
            this.policy = policy;
            this.failure = failure;
        }

        @Override
        public String eventName() {
            return name;
        }

        @Override
        public HandlerPolicy policy() {
            return policy;
        }

        @Override
        public Uni<Void> handle(Connection connection, InboundEvent event) {
            if (failure != null) {
                throw failure;
            }
            invocations.add(event);
            return Uni.createFrom().voidItem();
        }
    }
}
