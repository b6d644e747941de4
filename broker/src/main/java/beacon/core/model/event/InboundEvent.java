package beacon.core.model.event;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * An event received from a client.
 *
 * <p>Wire form: {@code {"event": "<name>", "data": {...}}}. {@code data} is optional.
 *
 * @param name the event name
 * @param data the event payload
 */
public record InboundEvent(String name, JsonObject data) {

    public InboundEvent {
        if (name == null || name.isBlank()) {
            throw BrokerException.invalidPayload("Event name is required");
        }
        data = data != null ? data : new JsonObject();
    }

    public static InboundEvent of(String name, JsonObject data) {
        return new InboundEvent(name, data);
    }

    /**
     * Decode a text frame.
     *
     * @param frame the raw frame
     * @return the event
     * @throws BrokerException with {@link BrokerError#INVALID_PAYLOAD} if the frame is malformed
     */
    public static InboundEvent decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw BrokerException.invalidPayload("Empty frame");
        }
        final JsonObject json;
        try {
            json = new JsonObject(frame);
        } catch (DecodeException | ClassCastException e) {
            throw BrokerException.invalidPayload("Frame is not a JSON object");
        }

        final var name = json.getValue("event");
        if (!(name instanceof String eventName)) {
            throw BrokerException.invalidPayload("Frame has no event name");
        }

        final var data = json.getValue("data");
        if (data == null) {
            return new InboundEvent(eventName, new JsonObject());
        }
        if (!(data instanceof JsonObject payload)) {
            throw BrokerException.invalidPayload("Event data must be a JSON object");
        }
        return new InboundEvent(eventName, payload);
    }

    /**
     * Read a required, non-blank string field.
     *
     * @param field field name
     * @return the value
     * @throws BrokerException if the field is missing or blank
     */
    public String requireString(String field) {
        final var value = data.getValue(field);
        if (value == null || value.toString().isBlank()) {
            throw BrokerException.invalidPayload(field + " is required");
        }
        return value.toString();
    }

    public String optionalString(String field, String defaultValue) {
        final var value = data.getValue(field);
        return value != null && !value.toString().isBlank() ? value.toString() : defaultValue;
    }
}
