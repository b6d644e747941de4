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
 * Leaves a channel and replies {@code room_left}.
 */
@ApplicationScoped
public class LeaveRoomHandler implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public LeaveRoomHandler(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "leave_room";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var channelId = ChannelId.parse(event.requireString("roomId"));
        final var wasMember = channelManager.leave(connection, channelId);
        connection.send(OutboundEvent.of(
                "room_left",
                new JsonObject()
                        .put("roomId", channelId.value())
                        .put("wasMember", wasMember)
                        .put("timestamp", Instant.now().toString())));
        return Uni.createFrom().voidItem();
    }
}
