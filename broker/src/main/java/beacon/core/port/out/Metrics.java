package beacon.core.port.out;

import beacon.core.model.event.BrokerError;

/**
 * Port interface for recording broker metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    void connectionOpened();

    void connectionClosed();

    /**
     * Record a refused handshake.
     *
     * @param error the rejection kind
     */
    void recordConnectionRejected(BrokerError error);

    /**
     * Record the outcome of an inbound event.
     *
     * @param eventName the event name
     * @param outcome   {@code ok} or the {@link BrokerError} name
     */
    void recordEvent(String eventName, String outcome);

    void recordRateLimitExceeded(String eventName);

    /**
     * Record a fan-out.
     *
     * @param target     channel kind or {@code identity}
     * @param deliveries sockets written
     */
    void recordBroadcast(String target, int deliveries);

    void recordStoreTimeout(String repository, String operation);

    void recordStoreFailure(String repository, String operation);
}
