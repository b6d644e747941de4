package beacon.core.service.handler;

import java.time.Instant;
import java.util.ArrayList;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
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
 * Subscribes the sender to the activity feeds of its role and, if it has one, its organization.
 */
@ApplicationScoped
public class ActivitySubscribeHandler implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public ActivitySubscribeHandler(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "activity:subscribe";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var identity = connection.identity();
        final var feeds = new ArrayList<ChannelId>(2);
        feeds.add(ChannelId.roleActivity(identity.role()));
        identity.organizationId().ifPresent(org -> feeds.add(ChannelId.organizationActivity(org)));

        final var joined = new JsonArray();
        for (var feed : feeds) {
            channelManager.join(connection, feed);
            joined.add(feed.value());
        }
        connection.send(OutboundEvent.of(
                "activity:subscribed",
                new JsonObject().put("channels", joined).put("timestamp", Instant.now().toString())));
        return Uni.createFrom().voidItem();
    }
}
