package beacon.core.service.handler;

import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Roles;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.service.ChannelManager;
import beacon.core.service.ConnectionRegistry;
import beacon.core.service.EventHandler;

/**
 * Answers {@code dashboard_metrics_request} with live broker figures.
 *
 * <p>Platform administrators see instance-wide connection and channel statistics;
 * organization administrators see their organization's channel only.
 */
@ApplicationScoped
public class DashboardMetricsHandler implements EventHandler {

    private final ConnectionRegistry registry;
    private final ChannelManager channelManager;

    @Inject
    public DashboardMetricsHandler(ConnectionRegistry registry, ChannelManager channelManager) {
        this.registry = registry;
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "dashboard_metrics_request";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.restricted(Roles.MANAGERS, RateLimitPolicy.perMinute(30));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var identity = connection.identity();
        final var metricsType = event.optionalString("metricsType", "overview");
        final var filters = event.data().getJsonObject("filters", new JsonObject());

        final var response = new JsonObject()
                .put("metricsType", metricsType)
                .put("filters", filters)
                .put("generatedAt", Instant.now().toString());

        if (identity.isPlatformAdmin()) {
            final var connections = registry.stats();
            final var channels = channelManager.stats();
            response.put(
                            "connections",
                            new JsonObject()
                                    .put("total", connections.totalConnections())
                                    .put("uniqueUsers", connections.uniqueIdentities())
                                    .put("byRole", toJson(connections.byRole()))
                                    .put("byDevice", toJson(connections.byDevice())))
                    .put(
                            "channels",
                            new JsonObject()
                                    .put("total", channels.totalChannels())
                                    .put("memberships", channels.totalMemberships()));
        }

        identity.organizationId().ifPresent(org -> {
            final var members = channelManager.membersOf(ChannelId.organization(org));
            final var online = members.stream().filter(registry::isOnline).count();
            response.put(
                    "organization",
                    new JsonObject().put("id", org).put("members", members.size()).put("online", online));
        });

        connection.send(OutboundEvent.of("dashboard_metrics_response", response));
        return Uni.createFrom().voidItem();
    }

    private static JsonObject toJson(Map<?, Integer> counts) {
        final var json = new JsonObject();
        counts.forEach((key, value) -> json.put(key.toString(), value));
        return json;
    }
}
