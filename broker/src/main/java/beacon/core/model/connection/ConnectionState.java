package beacon.core.model.connection;

/**
 * Lifecycle of a client connection.
 *
 * <p>States only move forward. {@link #DISCONNECTED} is terminal and reachable from every state.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    REGISTERED,
    ACTIVE,
    DISCONNECTED;

    public boolean canTransitionTo(ConnectionState next) {
        if (this == DISCONNECTED) {
            return false;
        }
        return next == DISCONNECTED || next.ordinal() == ordinal() + 1;
    }
}
