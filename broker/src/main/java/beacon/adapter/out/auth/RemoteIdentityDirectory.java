package beacon.adapter.out.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import beacon.core.model.identity.CredentialCheck;
import beacon.core.model.identity.Identity;
import beacon.core.port.out.IdentityDirectory;

/**
 * Looks identities up in the user service over HTTP.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * GET {url}/{userId}
 * Accept: application/json
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "userId": "user-123",
 *   "email": "jane@example.org",
 *   "role": "donor",
 *   "ngoId": "ngo-7",
 *   "active": true
 * }
 * }</pre>
 *
 * <p>404 or {@code "active": false} means the identity does not exist any more. Any other
 * status, and timeouts, fail the lookup.
 */
public class RemoteIdentityDirectory implements IdentityDirectory {

    private static final Logger LOG = Logger.getLogger(RemoteIdentityDirectory.class);

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;

    public RemoteIdentityDirectory(WebClient webClient, String baseUrl, Duration timeout) {
        this.webClient = webClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public Uni<Optional<Identity>> findActive(CredentialCheck.Valid credential) {
        final var userId = credential.userId();
        final var url = baseUrl + "/" + URLEncoder.encode(userId, StandardCharsets.UTF_8);
        final var startTime = System.currentTimeMillis();

        return webClient
                .getAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    if (response.statusCode() == 404) {
                        LOG.debugf("User %s not found in directory (%dms)", userId, duration);
                        return Optional.<Identity>empty();
                    }
                    if (response.statusCode() != 200) {
                        throw new DirectoryLookupException(
                                "Identity directory returned status " + response.statusCode());
                    }
                    LOG.debugf("Directory lookup for %s succeeded (%dms)", userId, duration);
                    return parseIdentity(userId, response.bodyAsJsonObject());
                })
                .onFailure(error -> !(error instanceof DirectoryLookupException))
                .transform(error -> new DirectoryLookupException(
                        "Identity directory unavailable: " + error.getMessage(), error));
    }

    static Optional<Identity> parseIdentity(String userId, JsonObject body) {
        if (body == null || !body.getBoolean("active", true)) {
            return Optional.empty();
        }
        final var role = body.getString("role");
        if (role == null || role.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Identity.of(
                body.getString("userId", userId),
                body.getString("email"),
                role,
                body.getString("ngoId", body.getString("organizationId"))));
    }

    /**
     * Thrown when the directory cannot answer.
     */
    public static class DirectoryLookupException extends RuntimeException {
        public DirectoryLookupException(String message) {
            super(message);
        }

        public DirectoryLookupException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
