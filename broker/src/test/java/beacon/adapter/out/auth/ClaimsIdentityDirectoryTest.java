package beacon.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import beacon.config.AuthConfig;
import beacon.core.model.identity.CredentialCheck;

@DisplayName("Identity directories")
class ClaimsIdentityDirectoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private static final AuthConfig.Claims CLAIM_NAMES = new AuthConfig.Claims() {
        @Override
        public String userId() {
            return "userId";
        }

        @Override
        public String email() {
            return "email";
        }

        @Override
        public String role() {
            return "role";
        }

        @Override
        public String organizationId() {
            return "ngoId";
        }
    };

    @Nested
    @DisplayName("ClaimsIdentityDirectory")
    class ClaimsTests {

        private final ClaimsIdentityDirectory directory = new ClaimsIdentityDirectory(CLAIM_NAMES);

        @Test
        @DisplayName("should build the identity from token claims")
        void shouldBuildIdentity() {
            var credential = new CredentialCheck.Valid(
                    "u1", Map.of("email", "u1@example.org", "role", "ngo_admin", "ngoId", 42));

            var identity = directory.findActive(credential).await().atMost(TIMEOUT).orElseThrow();

            assertEquals("u1", identity.userId());
            assertEquals("u1@example.org", identity.displayName());
            assertEquals("ngo_admin", identity.role());
            assertEquals(Optional.of("42"), identity.organizationId());
        }

        @Test
        @DisplayName("should resolve to not found without a role claim")
        void shouldRequireRole() {
            var credential = new CredentialCheck.Valid("u1", Map.of("email", "u1@example.org"));

            assertTrue(directory.findActive(credential).await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("RemoteIdentityDirectory.parseIdentity")
    class RemoteTests {

        @Test
        @DisplayName("should map the directory record")
        void shouldMapRecord() {
            var body = new JsonObject()
                    .put("userId", "u7")
                    .put("email", "u7@example.org")
                    .put("role", "volunteer")
                    .put("ngoId", "9")
                    .put("active", true);

            var identity = RemoteIdentityDirectory.parseIdentity("u7", body).orElseThrow();

            assertEquals("volunteer", identity.role());
            assertEquals(Optional.of("9"), identity.organizationId());
        }

        @Test
        @DisplayName("should treat inactive or role-less records as not found")
        void shouldRejectInactive() {
            var inactive = new JsonObject().put("role", "donor").put("active", false);

            assertTrue(RemoteIdentityDirectory.parseIdentity("u7", inactive).isEmpty());
            assertTrue(RemoteIdentityDirectory.parseIdentity("u7", new JsonObject()).isEmpty());
            assertTrue(RemoteIdentityDirectory.parseIdentity("u7", null).isEmpty());
        }

        @Test
        @DisplayName("should fall back to the requested user id and the organizationId field")
        void shouldFallBack() {
            var identity = RemoteIdentityDirectory.parseIdentity(
                            "u8", new JsonObject().put("role", "donor").put("organizationId", "3"))
                    .orElseThrow();

            assertEquals("u8", identity.userId());
            assertEquals(Optional.of("3"), identity.organizationId());
        }
    }
}
