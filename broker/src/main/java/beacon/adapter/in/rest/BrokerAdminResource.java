package beacon.adapter.in.rest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.adapter.in.problem.BrokerProblem;
import beacon.config.AdminConfig;
import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.ConnectionRecord;
import beacon.core.port.in.PublishNotificationUseCase;
import beacon.core.service.BrokerOrchestrator;
import beacon.core.service.ChannelManager;
import beacon.core.service.ConnectionRegistry;
import beacon.core.service.EventRouter;

/**
 * Operational endpoints for a broker instance.
 *
 * <p>Every request must carry the configured key in {@code X-Broker-Admin-Key}. Without a
 * configured key the endpoints are disabled and answer 404.
 */
@Path("/admin/broker")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class BrokerAdminResource {

    private static final Logger LOG = Logger.getLogger(BrokerAdminResource.class);

    static final String ADMIN_KEY_HEADER = "X-Broker-Admin-Key";

    private final BrokerOrchestrator orchestrator;
    private final ConnectionRegistry registry;
    private final ChannelManager channelManager;
    private final EventRouter router;
    private final PublishNotificationUseCase publisher;
    private final Optional<String> adminKey;

    @Inject
    public BrokerAdminResource(
            BrokerOrchestrator orchestrator,
            ConnectionRegistry registry,
            ChannelManager channelManager,
            EventRouter router,
            PublishNotificationUseCase publisher,
            AdminConfig config) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.channelManager = channelManager;
        this.router = router;
        this.publisher = publisher;
        this.adminKey = config.apiKey().filter(key -> !key.isBlank());
    }

    @GET
    @Path("/status")
    public Map<String, Object> status(@HeaderParam(ADMIN_KEY_HEADER) String key) {
        authorize(key);
        final var status = orchestrator.status();
        final var body = new LinkedHashMap<String, Object>();
        body.put("initialized", status.initialized());
        body.put("connections", status.connections());
        body.put("channels", status.channels());
        body.put("uptimeSeconds", status.uptime().toSeconds());
        body.put("sharedStoreAvailable", status.sharedStoreAvailable());
        return body;
    }

    @GET
    @Path("/stats")
    public Map<String, Object> stats(@HeaderParam(ADMIN_KEY_HEADER) String key) {
        authorize(key);
        final var body = new LinkedHashMap<String, Object>();
        body.put("connections", registry.stats());
        body.put("channels", channelManager.stats());
        body.put("events", router.metrics());
        body.put("generatedAt", Instant.now().toString());
        return body;
    }

    @POST
    @Path("/metrics/reset")
    public Map<String, Object> resetMetrics(@HeaderParam(ADMIN_KEY_HEADER) String key) {
        authorize(key);
        router.resetMetrics();
        LOG.info("Event metrics reset");
        return Map.of("reset", true);
    }

    @GET
    @Path("/presence/{userId}")
    public Uni<Map<String, Object>> presence(
            @HeaderParam(ADMIN_KEY_HEADER) String key, @PathParam("userId") String userId) {
        authorize(key);
        return registry.presence(userId)
                .flatMap(status -> registry.replicatedConnections(userId).map(records -> {
                    final var body = new LinkedHashMap<String, Object>();
                    body.put("userId", userId);
                    body.put("status", status.wireValue());
                    body.put("localConnections", registry.connectionsFor(userId).size());
                    body.put("connections", records.stream().map(ConnectionRecord::sessionId).toList());
                    body.put("channels", channelManager.channelsOf(userId).stream()
                            .map(ChannelId::value)
                            .sorted()
                            .toList());
                    return (Map<String, Object>) body;
                }));
    }

    @GET
    @Path("/channels/{channelId}")
    public Map<String, Object> channel(
            @HeaderParam(ADMIN_KEY_HEADER) String key, @PathParam("channelId") String channelId) {
        authorize(key);
        final var id = ChannelId.parse(channelId);
        final var members = channelManager.membersOf(id);
        if (members.isEmpty()) {
            throw BrokerProblem.notFound("Channel has no members: " + id.value());
        }
        final var body = new LinkedHashMap<String, Object>();
        body.put("channelId", id.value());
        body.put("kind", id.kind().name());
        body.put("members", members.stream().sorted().toList());
        channelManager.createdAt(id).ifPresent(created -> body.put("createdAt", created.toString()));
        return body;
    }

    @POST
    @Path("/publish")
    public Uni<Map<String, Object>> publish(@HeaderParam(ADMIN_KEY_HEADER) String key, PublishRequest request) {
        authorize(key);
        if (request == null || request.target() == null || request.event() == null) {
            throw BrokerProblem.badRequest("target and event are required");
        }
        final var payload = request.payload() != null ? new JsonObject(request.payload()) : new JsonObject();
        return publisher.publish(request.target(), request.event(), payload).map(delivered -> {
            LOG.debugv("Published {0} to {1}: {2} deliveries", request.event(), request.target(), delivered);
            return Map.<String, Object>of("target", request.target(), "event", request.event(), "delivered", delivered);
        });
    }

    private void authorize(String presented) {
        if (adminKey.isEmpty()) {
            throw BrokerProblem.featureDisabled("Broker administration");
        }
        if (presented == null || !constantTimeEquals(adminKey.get(), presented)) {
            throw BrokerProblem.unauthorized("Missing or invalid " + ADMIN_KEY_HEADER);
        }
    }

    private static boolean constantTimeEquals(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }
}
