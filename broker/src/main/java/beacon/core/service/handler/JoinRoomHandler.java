package beacon.core.service.handler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.channel.ChannelKind;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.ChannelHistory;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Joins a channel and replies {@code room_joined} with the member count and, for ad hoc rooms,
 * the recent message history.
 */
@ApplicationScoped
public class JoinRoomHandler implements EventHandler {

    static final int HISTORY_ON_JOIN = 20;

    private final ChannelManager channelManager;
    private final ChannelHistory history;

    @Inject
    public JoinRoomHandler(ChannelManager channelManager, ChannelHistory history) {
        this.channelManager = channelManager;
        this.history = history;
    }

    @Override
    public String eventName() {
        return "join_room";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var channelId = ChannelId.parse(event.requireString("roomId"));
        channelManager.join(connection, channelId);

        final var recent = channelId.kind() == ChannelKind.ROOM
                ? history.recent(channelId, HISTORY_ON_JOIN)
                : Uni.createFrom().item(List.<JsonObject>of());

        return recent.invoke(messages -> connection.send(OutboundEvent.of(
                        "room_joined",
                        new JsonObject()
                                .put("roomId", channelId.value())
                                .put("members", channelManager.membersOf(channelId).size())
                                .put("recentMessages", new JsonArray(new ArrayList<>(messages)))
                                .put("timestamp", Instant.now().toString()))))
                .replaceWithVoid();
    }
}
