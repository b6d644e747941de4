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
 * Relays a donation status change to the donor and to platform administrators.
 */
@ApplicationScoped
public class DonationStatusRelay implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public DonationStatusRelay(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "donation_status_update";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(10));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var change = new JsonObject()
                .put("donationId", event.requireString("donationId"))
                .put("status", event.requireString("status"))
                .put("updatedBy", connection.userId())
                .put("timestamp", Instant.now().toString());
        final var donorId = event.optionalString("donorId", null);
        if (donorId != null) {
            change.put("donorId", donorId);
        }

        final var targets = new ArrayList<ChannelId>(2);
        if (donorId != null) {
            targets.add(ChannelId.user(donorId));
        }
        targets.add(ChannelId.role(Roles.ADMIN));

        channelManager.broadcastToChannels(targets, OutboundEvent.of("donation_status_changed", change), Optional.empty());
        return Uni.createFrom().voidItem();
    }
}
