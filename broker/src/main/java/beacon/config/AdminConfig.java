package beacon.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;

/**
 * Configuration mapping for the administrative REST surface.
 *
 * <p>Configuration prefix: {@code beacon.admin}
 *
 * <p>When {@code BEACON_ADMIN_API_KEY} is not set the admin endpoints are disabled.
 */
@ConfigMapping(prefix = "beacon.admin")
public interface AdminConfig {

    /**
     * Key expected in the {@code X-Broker-Admin-Key} header.
     *
     * @return the admin key
     */
    Optional<String> apiKey();
}
