package beacon.core.model.event;

/**
 * Failure raised while handling a client event, carrying the error reported to the client.
 */
public class BrokerException extends RuntimeException {

    private final BrokerError error;

    public BrokerException(BrokerError error, String message) {
        super(message);
        this.error = error;
    }

    public BrokerError getError() {
        return error;
    }

    public static BrokerException forbidden(String message) {
        return new BrokerException(BrokerError.FORBIDDEN, message);
    }

    public static BrokerException invalidPayload(String message) {
        return new BrokerException(BrokerError.INVALID_PAYLOAD, message);
    }
}
