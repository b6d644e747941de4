package beacon.core.service.handler;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.NotificationReceipts;
import beacon.core.service.EventHandler;

/**
 * Stores a read receipt for one of the sender's notifications.
 */
@ApplicationScoped
public class MarkNotificationReadHandler implements EventHandler {

    private final NotificationReceipts receipts;

    @Inject
    public MarkNotificationReadHandler(NotificationReceipts receipts) {
        this.receipts = receipts;
    }

    @Override
    public String eventName() {
        return "mark_notification_read";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.authenticated(RateLimitPolicy.perMinute(50));
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        final var notificationId = event.requireString("notificationId");
        return receipts.markRead(connection.userId(), notificationId)
                .invoke(() -> connection.send(OutboundEvent.of(
                        "notification_marked_read",
                        new JsonObject()
                                .put("notificationId", notificationId)
                                .put("timestamp", Instant.now().toString()))));
    }
}
