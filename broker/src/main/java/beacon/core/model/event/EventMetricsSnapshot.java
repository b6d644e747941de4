package beacon.core.model.event;

import java.util.Map;

/**
 * Aggregate event counters.
 *
 * @param totalEvents   events dispatched successfully
 * @param eventsByType  successful dispatches per event name
 * @param errorCount    handler failures
 * @param rateLimitHits events rejected by rate limiting
 */
public record EventMetricsSnapshot(
        long totalEvents, Map<String, Long> eventsByType, long errorCount, long rateLimitHits) {

    public EventMetricsSnapshot {
        eventsByType = eventsByType != null ? Map.copyOf(eventsByType) : Map.of();
    }

    public static EventMetricsSnapshot empty() {
        return new EventMetricsSnapshot(0, Map.of(), 0, 0);
    }
}
