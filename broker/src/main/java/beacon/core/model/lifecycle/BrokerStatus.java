package beacon.core.model.lifecycle;

import java.time.Duration;

/**
 * Health summary of a broker instance.
 *
 * @param initialized          whether initialization completed
 * @param connections          live connections on this instance
 * @param channels             channels with at least one member
 * @param uptime               time since initialization
 * @param sharedStoreAvailable whether the shared store answered the last health check
 */
public record BrokerStatus(
        boolean initialized, int connections, int channels, Duration uptime, boolean sharedStoreAvailable) {}
