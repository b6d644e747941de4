package beacon.core.service;

import io.smallrye.mutiny.Uni;

import beacon.core.model.connection.Connection;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;

/**
 * A named handler for one client event.
 *
 * <p>Access checks are declared through {@link #policy()} and enforced by the
 * {@link EventRouter}; handler bodies contain no permission logic of their own beyond
 * resource-specific rules. Handlers must not block.
 */
public interface EventHandler {

    /**
     * The client event this handler serves.
     */
    String eventName();

    /**
     * Authentication, role and rate-limit policy.
     */
    HandlerPolicy policy();

    /**
     * Handle an event. Failures are converted to {@code error} replies by the router.
     *
     * @param connection the sending connection
     * @param event      the event
     * @return completion of the handler
     */
    Uni<Void> handle(Connection connection, InboundEvent event);
}
