package beacon.adapter.out.telemetry;

import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import beacon.config.TelemetryConfig;
import beacon.core.model.event.BrokerError;
import beacon.core.port.out.Metrics;

/**
 * Records broker metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code beacon.connections.active} - Live connections gauge</li>
 *   <li>{@code beacon.connections.rejected} - Refused handshakes by reason</li>
 *   <li>{@code beacon.events.total} - Inbound events by name and outcome</li>
 *   <li>{@code beacon.ratelimit.exceeded} - Rate limit rejections by event</li>
 *   <li>{@code beacon.broadcast.deliveries} - Sockets written per fan-out</li>
 *   <li>{@code beacon.store.timeouts} - Shared store operation timeouts</li>
 *   <li>{@code beacon.store.failures} - Shared store operation failures</li>
 * </ul>
 */
@ApplicationScoped
public class BrokerMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    private final AtomicLong activeConnections = new AtomicLong(0);

    @Inject
    public BrokerMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("beacon.connections.active", activeConnections, AtomicLong::get)
                .description("Number of live WebSocket connections on this instance")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    @Override
    public void connectionClosed() {
        activeConnections.updateAndGet(current -> Math.max(0, current - 1));
    }

    @Override
    public void recordConnectionRejected(BrokerError error) {
        if (!enabled) {
            return;
        }

        Counter.builder("beacon.connections.rejected")
                .description("Handshakes refused before upgrade")
                .tag("reason", error.name())
                .register(registry)
                .increment();
    }

    @Override
    public void recordEvent(String eventName, String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("beacon.events.total")
                .description("Inbound client events processed")
                .tag("event", nullSafe(eventName))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimitExceeded(String eventName) {
        if (!enabled) {
            return;
        }

        Counter.builder("beacon.ratelimit.exceeded")
                .description("Events or handshakes rejected by rate limiting")
                .tag("event", nullSafe(eventName))
                .register(registry)
                .increment();
    }

    @Override
    public void recordBroadcast(String target, int deliveries) {
        if (!enabled) {
            return;
        }

        DistributionSummary.builder("beacon.broadcast.deliveries")
                .description("Sockets written per fan-out")
                .tag("target", nullSafe(target))
                .register(registry)
                .record(deliveries);
    }

    @Override
    public void recordStoreTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("beacon.store.timeouts")
                .description("Shared store operations that timed out")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("beacon.store.failures")
                .description("Shared store operations that failed")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    long activeConnections() {
        return activeConnections.get();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
