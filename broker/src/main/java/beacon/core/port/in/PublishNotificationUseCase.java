package beacon.core.port.in;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;

/**
 * Use case for delivering domain events published by the surrounding system.
 */
public interface PublishNotificationUseCase {

    /** Target addressing every local connection. */
    String TARGET_ALL = "all";

    /**
     * Deliver an event.
     *
     * @param target    {@code all} or a channel id ({@code user:..}, {@code role:..}, {@code ngo:..}, ...)
     * @param eventName the event name, e.g. {@code donation_completed}
     * @param payload   the event payload
     * @return number of sockets written
     */
    Uni<Integer> publish(String target, String eventName, JsonObject payload);
}
