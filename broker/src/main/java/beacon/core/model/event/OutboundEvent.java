package beacon.core.model.event;

import java.time.Instant;

import io.vertx.core.json.JsonObject;

/**
 * An event sent to clients.
 *
 * @param name the event name
 * @param data the event payload
 */
public record OutboundEvent(String name, JsonObject data) {

    public static final String CONNECTED = "connected";
    public static final String ERROR = "error";
    public static final String PONG = "pong";
    public static final String USER_STATUS_CHANGE = "user_status_change";
    public static final String ROOM_EVENT = "room_event";

    public OutboundEvent {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be blank");
        }
        data = data != null ? data : new JsonObject();
    }

    public static OutboundEvent of(String name, JsonObject data) {
        return new OutboundEvent(name, data);
    }

    /**
     * Build an error reply.
     *
     * @param error     the error kind
     * @param message   message for the client; the error's default message when null
     * @param eventType the event that failed, or null for frame-level errors
     * @param now       timestamp
     * @return the {@code error} event
     */
    public static OutboundEvent error(BrokerError error, String message, String eventType, Instant now) {
        final var data = new JsonObject()
                .put("code", error.name())
                .put("message", message != null ? message : error.defaultMessage())
                .put("timestamp", now.toString());
        if (eventType != null) {
            data.put("eventType", eventType);
        }
        return new OutboundEvent(ERROR, data);
    }

    /**
     * Encode as a text frame.
     *
     * @return {@code {"event": name, "data": {...}}}
     */
    public String encode() {
        return new JsonObject().put("event", name).put("data", data).encode();
    }
}
