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
 * Relays program changes made by a manager to platform administrators and the manager's
 * organization.
 */
@ApplicationScoped
public class ProgramUpdateRelay implements EventHandler {

    private final ChannelManager channelManager;

    @Inject
    public ProgramUpdateRelay(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @Override
    public String eventName() {
        return "program_update";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.restricted(Roles.MANAGERS, RateLimitPolicy.perMinute(20));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var identity = connection.identity();
        final var update = new JsonObject()
                .put("programId", event.requireString("programId"))
                .put("updateType", event.requireString("updateType"))
                .put("updateData", event.data().getJsonObject("updateData", new JsonObject()))
                .put("updatedBy", identity.userId())
                .put("timestamp", Instant.now().toString());

        final var targets = new ArrayList<ChannelId>(2);
        targets.add(ChannelId.role(Roles.ADMIN));
        identity.organizationId().ifPresent(org -> targets.add(ChannelId.organization(org)));

        channelManager.broadcastToChannels(targets, OutboundEvent.of("program_updated", update), Optional.empty());
        return Uni.createFrom().voidItem();
    }
}
