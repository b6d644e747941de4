package beacon.core.service;

import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import beacon.config.RateLimitingConfig;
import beacon.core.model.connection.Connection;
import beacon.core.model.event.BrokerError;
import beacon.core.model.event.BrokerException;
import beacon.core.model.event.EventMetricsSnapshot;
import beacon.core.model.event.HandlerPolicy;
import beacon.core.model.event.InboundEvent;
import beacon.core.model.event.OutboundEvent;
import beacon.core.model.ratelimit.RateLimitKey;
import beacon.core.model.ratelimit.RateLimitPolicy;
import beacon.core.port.out.Metrics;
import beacon.core.port.out.RateLimiter;

/**
 * Dispatches inbound client events to registered handlers.
 *
 * <p>For every event the router, in order:
 * <ol>
 *   <li>rejects unknown event names with {@code UNKNOWN_EVENT}</li>
 *   <li>records activity on the connection</li>
 *   <li>checks authentication, then the handler's role allow-list</li>
 *   <li>consults the rate limiter when the handler declares a limit</li>
 *   <li>invokes the handler, converting any failure to an {@code error} reply</li>
 * </ol>
 *
 * <p>Rejections and failures are reported to the sending connection only; the router and the
 * connection keep working. The handler table is fixed at construction.
 */
@ApplicationScoped
public class EventRouter {

    private static final Logger LOG = Logger.getLogger(EventRouter.class);

    private final Map<String, Registration> registrations;
    private final RateLimiter rateLimiter;
    private final ConnectionRegistry registry;
    private final Metrics metrics;
    private final Clock clock;

    private final AtomicLong totalEvents = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong rateLimitHits = new AtomicLong();
    private final ConcurrentHashMap<String, LongAdder> eventsByType = new ConcurrentHashMap<>();

    @Inject
    public EventRouter(
            Instance<EventHandler> handlers,
            RateLimiter rateLimiter,
            ConnectionRegistry registry,
            Metrics metrics,
            RateLimitingConfig rateLimitingConfig) {
        this(
                StreamSupport.stream(handlers.spliterator(), false).collect(Collectors.toList()),
                rateLimiter,
                registry,
                metrics,
                rateLimitingConfig.enabled(),
                rateLimitingConfig.events(),
                Clock.systemUTC());
    }

    EventRouter(
            Collection<EventHandler> handlers,
            RateLimiter rateLimiter,
            ConnectionRegistry registry,
            Metrics metrics,
            boolean rateLimitingEnabled,
            Map<String, RateLimitingConfig.EventLimit> overrides,
            Clock clock) {
        this.rateLimiter = rateLimiter;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.registrations = register(handlers, rateLimitingEnabled, overrides);
        LOG.infov("Event router ready with {0} handlers: {1}", registrations.size(), registrations.keySet());
    }

    /**
     * Route one inbound event.
     *
     * @param connection the sending connection
     * @param event      the event
     * @return completion; never fails
     */
    public Uni<Void> route(Connection connection, InboundEvent event) {
        final var eventName = event.name();
        final var registration = registrations.get(eventName);
        if (registration == null) {
            LOG.debugv("Unknown event {0} from session {1}", eventName, connection.sessionId());
            reply(connection, BrokerError.UNKNOWN_EVENT, "Unknown event: " + eventName, eventName);
            return Uni.createFrom().voidItem();
        }

        registry.touch(connection.sessionId());

        final var policy = registration.policy();
        if (policy.requiresAuthentication() && !connection.isAuthenticated()) {
            reject(connection, eventName, BrokerError.AUTHENTICATION_REQUIRED, null);
            return Uni.createFrom().voidItem();
        }
        if (!policy.allowsRole(connection.identity().role())) {
            reject(connection, eventName, BrokerError.FORBIDDEN, null);
            return Uni.createFrom().voidItem();
        }

        if (policy.rateLimit().isEmpty()) {
            return invoke(registration, connection, event);
        }

        final var limit = policy.rateLimit().get();
        final var key = RateLimitKey.forWindow(connection.userId(), eventName, limit, clock.instant());
        return rateLimiter
                .checkAndIncrement(key, limit)
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        rateLimitHits.incrementAndGet();
                        metrics.recordRateLimitExceeded(eventName);
                        reject(
                                connection,
                                eventName,
                                BrokerError.RATE_LIMITED,
                                "Rate limit exceeded, retry in " + decision.retryAfterSeconds(clock.instant()) + "s");
                        return Uni.createFrom().voidItem();
                    }
                    return invoke(registration, connection, event);
                })
                .onFailure()
                .recoverWithItem(error -> fail(connection, eventName, error));
    }

    /**
     * Whether a handler is registered for an event.
     */
    public boolean handles(String eventName) {
        return registrations.containsKey(eventName);
    }

    /**
     * Effective policy of a registered event, after configuration overrides.
     */
    public Optional<HandlerPolicy> policyFor(String eventName) {
        return Optional.ofNullable(registrations.get(eventName)).map(Registration::policy);
    }

    public Set<String> eventNames() {
        return registrations.keySet();
    }

    public EventMetricsSnapshot metrics() {
        final Map<String, Long> byType = new HashMap<>();
        eventsByType.forEach((name, count) -> byType.put(name, count.sum()));
        return new EventMetricsSnapshot(totalEvents.get(), byType, errorCount.get(), rateLimitHits.get());
    }

    public void resetMetrics() {
        totalEvents.set(0);
        errorCount.set(0);
        rateLimitHits.set(0);
        eventsByType.clear();
        LOG.info("Event metrics reset");
    }

    private Uni<Void> invoke(Registration registration, Connection connection, InboundEvent event) {
        final var eventName = event.name();
        return Uni.createFrom()
                .deferred(() -> registration.handler().handle(connection, event))
                .onItem()
                .invoke(() -> {
                    totalEvents.incrementAndGet();
                    eventsByType.computeIfAbsent(eventName, name -> new LongAdder()).increment();
                    metrics.recordEvent(eventName, "ok");
                })
                .onFailure()
                .recoverWithItem(error -> fail(connection, eventName, error));
    }

    private Void fail(Connection connection, String eventName, Throwable error) {
        errorCount.incrementAndGet();
        if (error instanceof BrokerException brokerError) {
            LOG.debugv("Event {0} rejected by handler: {1}", eventName, brokerError.getMessage());
            reply(connection, brokerError.getError(), brokerError.getMessage(), eventName);
            metrics.recordEvent(eventName, brokerError.getError().name());
        } else {
            LOG.errorv(error, "Handler for {0} failed on session {1}", eventName, connection.sessionId());
            reply(connection, BrokerError.INTERNAL_ERROR, null, eventName);
            metrics.recordEvent(eventName, BrokerError.INTERNAL_ERROR.name());
        }
        return null;
    }

    private void reject(Connection connection, String eventName, BrokerError error, String message) {
        LOG.debugv("Event {0} from user {1} rejected: {2}", eventName, connection.userId(), error);
        metrics.recordEvent(eventName, error.name());
        reply(connection, error, message, eventName);
    }

    private void reply(Connection connection, BrokerError error, String message, String eventName) {
        connection.send(OutboundEvent.error(error, message, eventName, clock.instant()));
    }

    private static Map<String, Registration> register(
            Collection<EventHandler> handlers,
            boolean rateLimitingEnabled,
            Map<String, RateLimitingConfig.EventLimit> overrides) {
        final var table = new LinkedHashMap<String, Registration>();
        for (var handler : handlers) {
            final var policy = effectivePolicy(handler, rateLimitingEnabled, overrides);
            if (table.putIfAbsent(handler.eventName(), new Registration(handler, policy)) != null) {
                throw new IllegalStateException("Duplicate handler for event " + handler.eventName());
            }
        }
        return Map.copyOf(table);
    }

    private static HandlerPolicy effectivePolicy(
            EventHandler handler, boolean rateLimitingEnabled, Map<String, RateLimitingConfig.EventLimit> overrides) {
        final var declared = handler.policy();
        if (!rateLimitingEnabled) {
            return declared.withRateLimit(null);
        }

        final var override = overrides != null ? overrides.get(handler.eventName()) : null;
        if (override == null || declared.rateLimit().isEmpty()) {
            return declared;
        }

        final var base = declared.rateLimit().get();
        final var adjusted = RateLimitPolicy.of(
                override.maxRequests().orElse(base.maxRequests()), override.window().orElse(base.window()));
        LOG.infov("Rate limit for {0} overridden: {1}/{2}", handler.eventName(), adjusted.maxRequests(), adjusted.window());
        return declared.withRateLimit(adjusted);
    }

    private record Registration(EventHandler handler, HandlerPolicy policy) {}
}
