package beacon.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for handshake authentication.
 *
 * <p>Configuration prefix: {@code beacon.auth}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code BEACON_AUTH_JWT_SECRET} - HMAC secret, at least 32 characters</li>
 *   <li>{@code BEACON_AUTH_DIRECTORY_MODE} - {@code claims} or {@code remote}</li>
 *   <li>{@code BEACON_AUTH_DIRECTORY_URL} - Base URL of the remote identity directory</li>
 * </ul>
 */
@ConfigMapping(prefix = "beacon.auth")
public interface AuthConfig {

    /**
     * Secret used to verify HS256 credentials.
     *
     * @return the signing secret
     */
    String jwtSecret();

    /**
     * Expected {@code iss} claim. Not checked when absent.
     *
     * @return the expected issuer
     */
    Optional<String> issuer();

    /**
     * Allowed clock skew when checking {@code exp} and {@code nbf}.
     *
     * @return clock skew (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Claim names used to build an identity.
     */
    Claims claims();

    /**
     * Identity directory settings.
     */
    Directory directory();

    interface Claims {

        @WithDefault("userId")
        String userId();

        @WithDefault("email")
        String email();

        @WithDefault("role")
        String role();

        @WithDefault("ngoId")
        String organizationId();
    }

    interface Directory {

        /**
         * Where identities are looked up.
         *
         * @return the directory mode (default: claims)
         */
        @WithDefault("claims")
        Mode mode();

        /**
         * Base URL for {@link Mode#remote}; the user id is appended as a path segment.
         *
         * @return the directory URL
         */
        Optional<String> url();

        @WithDefault("PT2S")
        Duration timeout();

        enum Mode {
            claims,
            remote
        }
    }
}
