package beacon.core.service.handler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import beacon.core.model.channel.ChannelId;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.identity.Roles;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.AlertLog;
import beacon.core.service.ChannelManager;
import beacon.core.service.EventHandler;

/**
 * Records an emergency alert and pushes it to platform administrators and the sender's
 * organization.
 *
 * <p>Alerts are appended to a rolling log before delivery; if the log cannot be written the
 * alert is still delivered.
 */
@ApplicationScoped
public class EmergencyAlertRelay implements EventHandler {

    private static final Logger LOG = Logger.getLogger(EmergencyAlertRelay.class);

    static final Set<String> SEVERITIES = Set.of("low", "medium", "high", "critical");

    private final ChannelManager channelManager;
    private final AlertLog alertLog;

    @Inject
    public EmergencyAlertRelay(ChannelManager channelManager, AlertLog alertLog) {
        this.channelManager = channelManager;
        this.alertLog = alertLog;
    }

    @Override
    public String eventName() {
        return "emergency_alert";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.restricted(Roles.MANAGERS, RateLimitPolicy.of(5, Duration.ofMinutes(5)));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var identity = connection.identity();
        final var severity = event.optionalString("severity", "high");
        if (!SEVERITIES.contains(severity)) {
            throw BrokerException.invalidPayload("Unknown severity: " + severity);
        }

        final var now = Instant.now();
        final var alert = new JsonObject()
                .put("id", "alert_" + now.toEpochMilli() + "_" + identity.userId())
                .put("alertType", event.requireString("alertType"))
                .put("message", event.requireString("message"))
                .put("severity", severity)
                .put("senderId", identity.userId())
                .put("senderName", identity.displayName())
                .put("timestamp", now.toString());
        final var location = event.data().getValue("location");
        if (location != null) {
            alert.put("location", location);
        }
        identity.organizationId().ifPresent(org -> alert.put("organizationId", org));

        final var targets = new ArrayList<ChannelId>(3);
        targets.add(ChannelId.role(Roles.ADMIN));
        targets.add(ChannelId.role(Roles.SUPER_ADMIN));
        identity.organizationId().ifPresent(org -> targets.add(ChannelId.organization(org)));

        LOG.warnv("Emergency alert {0} ({1}) raised by {2}", alert.getString("id"), severity, identity.userId());
        return alertLog.append(alert)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Failed to record emergency alert {0}", alert.getString("id"));
                    return null;
                })
                .invoke(() -> channelManager.broadcastToChannels(
                        targets, OutboundEvent.of("emergency_alert", alert), Optional.empty()));
    }
}
