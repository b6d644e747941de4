package beacon.core.service.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Tells the other members of a channel that the sender started typing.
 */
@ApplicationScoped
public class TypingStartedRelay implements EventHandler {

    static final String RELAYED_EVENT = "typing:user_started";

    private final ChannelManager channelManager;

    @Inject
    public TypingStartedRelay(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "typing:start";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(120));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        TypingIndicators.relay(channelManager, connection, event, RELAYED_EVENT, true);
        return Uni.createFrom().voidItem();
    }
}
