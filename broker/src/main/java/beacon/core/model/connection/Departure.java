package beacon.core.model.connection;

/**
 * Result of removing a connection from the registry.
 *
 * @param connection       the removed connection
 * @param lastForIdentity  true when the identity has no connections left
 */
public record Departure(Connection connection, boolean lastForIdentity) {}
