package beacon.core.service.handler;

import java.util.Optional;

import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.service.ChannelManager;

/**
 * Shared relay for typing indicators: only channel members may signal, and the sender never
 * receives its own indicator.
 */
final class TypingIndicators {

    private TypingIndicators() {}

    static void relay(
            ChannelManager channelManager,
            Connection connection,
            InboundEvent event,
            String relayedEvent,
            boolean includeName) {
        final var identity = connection.identity();
        final var channelId = ChannelId.parse(event.requireString("room"));
        if (!channelManager.isMember(identity.userId(), channelId)) {
            throw BrokerException.forbidden("Not a member of " + channelId);
        }

        final var indicator = new JsonObject().put("userId", identity.userId());
        if (includeName) {
            indicator.put("userName", identity.displayName());
        }
        indicator.put("room", channelId.value());
        channelManager.broadcast(channelId, OutboundEvent.of(relayedEvent, indicator), Optional.of(identity.userId()));
    }
}
