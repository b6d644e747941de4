package beacon.core.service;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.channel.ChannelKind;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.OutboundEvent;
import beacon.core.port.in.PublishNotificationUseCase;
import beacon.core.port.out.Metrics;

/**
 * Delivers domain events (donations, program changes, ...) raised outside the broker to
 * connected clients.
 */
@ApplicationScoped
public class NotificationPublisher implements PublishNotificationUseCase {

    private static final Logger LOG = Logger.getLogger(NotificationPublisher.class);

    private final ConnectionRegistry registry;
    private final ChannelManager channelManager;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public NotificationPublisher(ConnectionRegistry registry, ChannelManager channelManager, Metrics metrics) {
        this(registry, channelManager, metrics, Clock.systemUTC());
    }

    NotificationPublisher(ConnectionRegistry registry, ChannelManager channelManager, Metrics metrics, Clock clock) {
        this.registry = registry;
        this.channelManager = channelManager;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<Integer> publish(String target, String eventName, JsonObject payload) {
        if (eventName == null || eventName.isBlank()) {
            return Uni.createFrom().failure(BrokerException.invalidPayload("Event name is required"));
        }
        if (target == null || target.isBlank()) {
            return Uni.createFrom().failure(BrokerException.invalidPayload("Target is required"));
        }

        final var data = payload != null ? payload.copy() : new JsonObject();
        if (!data.containsKey("timestamp")) {
            data.put("timestamp", clock.instant().toString());
        }
        final var event = OutboundEvent.of(eventName, data);

        if (TARGET_ALL.equals(target)) {
            final var delivered = registry.broadcastToAll(event);
            metrics.recordBroadcast(TARGET_ALL, delivered);
            LOG.debugv("Published {0} to all connections ({1} deliveries)", eventName, delivered);
            return Uni.createFrom().item(delivered);
        }

        final ChannelId channelId;
        try {
            channelId = ChannelId.parse(target);
        } catch (BrokerException e) {
            return Uni.createFrom().failure(e);
        }

        final int delivered;
        if (channelId.kind() == ChannelKind.USER) {
            delivered = registry.deliverToIdentity(channelId.name(), event);
            metrics.recordBroadcast("identity", delivered);
        } else {
            delivered = channelManager.broadcast(channelId, event, Optional.empty());
        }
        LOG.debugv("Published {0} to {1} ({2} deliveries)", eventName, channelId, delivered);
        return Uni.createFrom().item(delivered);
    }
}
