package beacon.core.service.handler;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.channel.ChannelKind;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.ChannelHistory;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Relays a chat-style message to a channel the sender belongs to.
 *
 * <p>The message is appended to the channel's rolling history and broadcast as
 * {@code new_message} to every member, the sender included. Only platform administrators may
 * post to {@code system:} channels.
 */
@ApplicationScoped
public class SendMessageHandler implements EventHandler {

    static final int MAX_MESSAGE_LENGTH = 4000;

    private final ChannelManager channelManager;
    private final ChannelHistory history;

    @Inject
    public SendMessageHandler(ChannelManager channelManager, ChannelHistory history) {
        this.channelManager = channelManager;
        this.history = history;
    }

    @Override
    public String eventName() {
        return "send_message";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(100));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var channelId = ChannelId.parse(event.requireString("roomId"));
        final var text = event.requireString("message");
        final var messageType = event.optionalString("messageType", "text");
        final var identity = connection.identity();

        if (text.length() > MAX_MESSAGE_LENGTH) {
            throw BrokerException.invalidPayload("Message exceeds " + MAX_MESSAGE_LENGTH + " characters");
        }
        if (!channelManager.isMember(identity.userId(), channelId)) {
            throw BrokerException.forbidden("Not a member of " + channelId);
        }
        if (channelId.kind() == ChannelKind.SYSTEM && !identity.isPlatformAdmin()) {
            throw BrokerException.forbidden("Only administrators may post to " + channelId);
        }

        final var message = new JsonObject()
                .put("id", UUID.randomUUID().toString())
                .put("roomId", channelId.value())
                .put("senderId", identity.userId())
                .put("senderName", identity.displayName())
                .put("message", text)
                .put("messageType", messageType)
                .put("timestamp", Instant.now().toString());

        return history.append(channelId, message)
                .invoke(() -> channelManager.broadcast(
                        channelId, OutboundEvent.of("new_message", message), Optional.empty()));
    }
}
