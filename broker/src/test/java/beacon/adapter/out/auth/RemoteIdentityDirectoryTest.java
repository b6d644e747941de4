package beacon.adapter.out.auth;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import beacon.adapter.out.auth.RemoteIdentityDirectory.DirectoryLookupException;
import beacon.core.model.identity.CredentialCheck;

@DisplayName("RemoteIdentityDirectory")
class RemoteIdentityDirectoryTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);
    private static final Duration DIRECTORY_TIMEOUT = Duration.ofSeconds(2);

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private RemoteIdentityDirectory directory;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        directory = new RemoteIdentityDirectory(
                WebClient.create(vertx), wireMockServer.baseUrl() + "/users/", DIRECTORY_TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private static CredentialCheck.Valid credential(String userId) {
        return new CredentialCheck.Valid(userId, Map.of());
    }

    private void respond(String path, int status, String body) {
        wireMockServer.stubFor(get(urlEqualTo(path))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Nested
    @DisplayName("Successful lookups")
    class SuccessTests {

        @Test
        @DisplayName("should resolve an active user")
        void shouldResolveActiveUser() {
            respond(
                    "/users/u-1",
                    200,
                    """
                    {"userId": "u-1", "email": "u1@example.org", "role": "ngo_admin", "ngoId": "7", "active": true}
                    """);

            var identity = directory.findActive(credential("u-1")).await().atMost(AWAIT).orElseThrow();

            assertEquals("ngo_admin", identity.role());
            assertEquals(Optional.of("7"), identity.organizationId());
            wireMockServer.verify(
                    getRequestedFor(urlEqualTo("/users/u-1")).withHeader("Accept", equalTo("application/json")));
        }

        @Test
        @DisplayName("should treat 404 as not found")
        void shouldTreatMissingAsNotFound() {
            respond("/users/ghost", 404, "{}");

            assertTrue(directory.findActive(credential("ghost")).await().atMost(AWAIT).isEmpty());
        }

        @Test
        @DisplayName("should treat a deactivated user as not found")
        void shouldTreatInactiveAsNotFound() {
            respond("/users/u-2", 200, "{\"role\": \"donor\", \"active\": false}");

            assertTrue(directory.findActive(credential("u-2")).await().atMost(AWAIT).isEmpty());
        }

        @Test
        @DisplayName("should encode the user id into the path")
        void shouldEncodeUserId() {
            respond("/users/jane%40example.org", 200, "{\"role\": \"donor\"}");

            var identity = directory.findActive(credential("jane@example.org")).await().atMost(AWAIT);

            assertTrue(identity.isPresent());
        }
    }

    @Nested
    @DisplayName("Failed lookups")
    class FailureTests {

        @Test
        @DisplayName("should fail on unexpected statuses")
        void shouldFailOnServerError() {
            respond("/users/u-3", 503, "{}");

            assertThrows(
                    DirectoryLookupException.class,
                    () -> directory.findActive(credential("u-3")).await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should fail when the directory is too slow")
        void shouldFailOnTimeout() {
            wireMockServer.stubFor(get(urlEqualTo("/users/u-4"))
                    .willReturn(aResponse().withStatus(200).withBody("{}").withFixedDelay(4000)));

            var error = assertThrows(
                    DirectoryLookupException.class,
                    () -> directory.findActive(credential("u-4")).await().atMost(AWAIT));

            assertTrue(error.getMessage().startsWith("Identity directory unavailable"));
        }

        @Test
        @DisplayName("should fail when the directory cannot be reached")
        void shouldFailWhenUnreachable() {
            wireMockServer.stop();

            assertThrows(
                    DirectoryLookupException.class,
                    () -> directory.findActive(credential("u-5")).await().atMost(AWAIT));
        }
    }
}
