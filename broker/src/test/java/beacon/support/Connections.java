package beacon.support;

import java.time.Instant;
import java.util.UUID;

import beacon.core.model.connection.ClientInfo;
import beacon.core.model.connection.Connection;
import beacon.core.model.identity.Identity;

/**
 * Factories for test identities and connections.
 */
public final class Connections {

    private Connections() {}

    public static Identity identity(String userId, String role) {
        return Identity.of(userId, userId + "@example.org", role, null);
    }

    public static Identity identity(String userId, String role, String organizationId) {
        return Identity.of(userId, userId + "@example.org", role, organizationId);
    }

    public static Connection connection(Identity identity, RecordingClientSocket socket) {
        return connection(identity, socket, Instant.now());
    }

    public static Connection connection(Identity identity, RecordingClientSocket socket, Instant connectedAt) {
        return new Connection(
                UUID.randomUUID().toString(), identity, ClientInfo.from("JUnit", null, "127.0.0.1"), socket, connectedAt);
    }
}
