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
 * Confirms the channel personal notifications arrive on.
 *
 * <p>Notifications are published to the personal channel, which every identity joins at connect
 * time, so this only re-asserts that membership.
 */
@ApplicationScoped
public class NotificationsSubscribeHandler implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public NotificationsSubscribeHandler(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "notifications:subscribe";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var channelId = ChannelId.user(connection.userId());
        channelManager.join(connection, channelId);
        connection.send(OutboundEvent.of(
                "notifications:subscribed",
                new JsonObject().put("channel", channelId.value()).put("timestamp", Instant.now().toString())));
        return Uni.createFrom().voidItem();
    }
}
