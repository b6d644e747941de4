package beacon.core.service.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Leaves the dashboard feed of the sender's role. Silent, like the subscription it undoes.
 */
@ApplicationScoped
public class DashboardUnsubscribeHandler implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public DashboardUnsubscribeHandler(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "dashboard:unsubscribe";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        channelManager.leave(connection, ChannelId.dashboard(connection.identity().role()));
        return Uni.createFrom().voidItem();
    }
}
