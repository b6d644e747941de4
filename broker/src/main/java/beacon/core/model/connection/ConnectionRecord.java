package beacon.core.model.connection;

/**
 * Replicated form of a connection, as stored in the shared store.
 *
 * @param sessionId         transport session id
 * @param userId            owning identity
 * @param displayName       email or display handle
 * @param role              role of the identity
 * @param organizationId    organization id, or null
 * @param device            device classification name
 * @param userAgent         client user agent
 * @param connectedAtMillis connect time in epoch milliseconds
 * @param lastActivityMillis last activity in epoch milliseconds
 */
public record ConnectionRecord(
        String sessionId,
        String userId,
        String displayName,
        String role,
        String organizationId,
        String device,
        String userAgent,
        long connectedAtMillis,
        long lastActivityMillis) {}
