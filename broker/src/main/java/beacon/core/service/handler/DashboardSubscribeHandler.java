package beacon.core.service.handler;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Subscribes the sender to the live dashboard feed of its role and pushes a first
 * {@code dashboard:update} right away.
 *
 * <p>Later updates are published to {@code dashboard:{role}} by the back end.
 */
@ApplicationScoped
public class DashboardSubscribeHandler implements EventHandler {

    static final String UPDATE_EVENT = "dashboard:update";

    private final ChannelManager channelManager;

    @Inject
    public DashboardSubscribeHandler(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "dashboard:subscribe";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var identity = connection.identity();
        final var channelId = ChannelId.dashboard(identity.role());
        channelManager.join(connection, channelId);

        final var stats = new JsonObject()
                .put("onlineInRole", channelManager.membersOf(ChannelId.role(identity.role())).size())
                .put("dashboardSubscribers", channelManager.membersOf(channelId).size());
        identity.organizationId().ifPresent(org -> stats.put(
                "onlineInOrganization", channelManager.membersOf(ChannelId.organization(org)).size()));

        connection.send(OutboundEvent.of(
                UPDATE_EVENT,
                new JsonObject()
                        .put("role", identity.role())
                        .put("userId", identity.userId())
                        .put("channel", channelId.value())
                        .put("stats", stats)
                        .put("timestamp", Instant.now().toString())));
        return Uni.createFrom().voidItem();
    }
}
