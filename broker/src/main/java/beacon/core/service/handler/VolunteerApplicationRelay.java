package beacon.core.service.handler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Roles;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Relays a volunteer application decision to the volunteer and to platform administrators.
 */
@ApplicationScoped
public class VolunteerApplicationRelay implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public VolunteerApplicationRelay(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "volunteer_application_update";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(15));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var change = new JsonObject()
                .put("applicationId", event.requireString("applicationId"))
                .put("status", event.requireString("status"))
                .put("updatedBy", connection.userId())
                .put("timestamp", Instant.now().toString());
        final var volunteerId = event.optionalString("volunteerId", null);
        if (volunteerId != null) {
            change.put("volunteerId", volunteerId);
        }

        final var targets = new ArrayList<ChannelId>(2);
        if (volunteerId != null) {
            targets.add(ChannelId.user(volunteerId));
        }
        targets.add(ChannelId.role(Roles.ADMIN));

        channelManager.broadcastToChannels(
                targets, OutboundEvent.of("volunteer_application_updated", change), Optional.empty());
        return Uni.createFrom().voidItem();
    }
}
