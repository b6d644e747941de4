package beacon.core.service.handler;

import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.connection.Connection;
import beacon.core.model.connection.PresenceStatus;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.service.ChannelManager;
import beacon.core.service.ConnectionRegistry;
import beacon.core.service.EventHandler;

/**
 * Lets a client announce its presence ({@code online}, {@code away}, {@code busy},
 * {@code offline}) to everyone sharing a channel with it.
 */
@ApplicationScoped
public class StatusChangeHandler implements EventHandler {

    private final ConnectionRegistry registry;
    private final ChannelManager channelManager;

    @Inject
    public StatusChangeHandler(ConnectionRegistry registry, ChannelManager channelManager) {
        this.registry = registry;
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "user_status_change";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(5));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var requested = event.requireString("status");
        final var status = PresenceStatus.fromWire(requested)
                .orElseThrow(() -> BrokerException.invalidPayload("Invalid status: " + requested));
        final var userId = connection.userId();

        registry.recordStatus(userId, status);
        channelManager.broadcastToChannels(
                channelManager.channelsOf(userId),
                OutboundEvent.of(
                        "user_status_changed",
                        new JsonObject()
                                .put("userId", userId)
                                .put("status", status.wireValue())
                                .put("timestamp", Instant.now().toString())),
                Optional.of(userId));
        return Uni.createFrom().voidItem();
    }
}
