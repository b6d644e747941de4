package beacon.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for broker metrics.
 *
 * <p>Configuration prefix: {@code beacon.telemetry}
 */
@ConfigMapping(prefix = "beacon.telemetry")
public interface TelemetryConfig {

    /**
     * Record Micrometer metrics.
     *
     * @return true if metrics are recorded (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
