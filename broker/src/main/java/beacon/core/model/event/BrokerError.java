package beacon.core.model.event;

/**
 * Error taxonomy reported to clients in {@code error} events.
 *
 * <p>Connection-time errors end the handshake. Event-time errors are sent to the caller only
 * and leave the transport open.
 */
public enum BrokerError {
    UNAUTHENTICATED("Invalid authentication token", true),
    IDENTITY_NOT_FOUND("User not found", true),
    UNKNOWN_EVENT("Unknown event", false),
    AUTHENTICATION_REQUIRED("Authentication required", false),
    FORBIDDEN("Insufficient permissions", false),
    RATE_LIMITED("Rate limit exceeded", false),
    INVALID_CHANNEL("Invalid channel", false),
    INVALID_PAYLOAD("Invalid payload", false),
    INTERNAL_ERROR("Internal server error", false);

    private final String defaultMessage;
    private final boolean connectionFatal;

    BrokerError(String defaultMessage, boolean connectionFatal) {
        this.defaultMessage = defaultMessage;
        this.connectionFatal = connectionFatal;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean isConnectionFatal() {
        return connectionFatal;
    }
}
