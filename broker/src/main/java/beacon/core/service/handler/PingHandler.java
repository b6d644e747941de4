package beacon.core.service.handler;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.service.EventHandler;

/**
 * Application-level heartbeat: replies {@code pong} with the server time.
 */
@ApplicationScoped
public class PingHandler implements EventHandler {

    @Override
    public String eventName() {
        return "ping";
    }

    @Override
    public HandlerPolicy policy() {
        return HandlerPolicy.open();
    }

    @Override
    public Uni<Void> handle(Connection connection, InboundEvent event) {
        connection.send(OutboundEvent.of(OutboundEvent.PONG, new JsonObject().put("timestamp", Instant.now().toString())));
        return Uni.createFrom().voidItem();
    }
}
