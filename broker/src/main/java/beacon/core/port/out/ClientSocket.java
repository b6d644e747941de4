package beacon.core.port.out;

/**
 * Outbound side of a client transport.
 *
 * <p>Implementations must be non-blocking; writes are queued by the transport.
 */
public interface ClientSocket {

    /**
     * Queue a text frame.
     *
     * @param frame the encoded frame
     * @return true if the frame was accepted by the transport
     */
    boolean send(String frame);

    /**
     * Close the transport.
     *
     * @param code   WebSocket close code
     * @param reason close reason
     */
    void close(short code, String reason);

    /**
     * Check whether frames can still be written.
     *
     * @return true while the transport is open
     */
    boolean isOpen();
}
