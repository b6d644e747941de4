package beacon.core.model.ratelimit;

import java.time.Instant;

/**
 * Counter key scoped to (identity, event, window).
 *
 * @param identityId   the identity the counter belongs to
 * @param eventName    the event being limited
 * @param windowIndex  epoch milliseconds divided by the window length
 * @param windowMillis the window length the index was computed with
 */
public record RateLimitKey(String identityId, String eventName, long windowIndex, long windowMillis) {

    private static final String PREFIX = "ratelimit:";

    /** Event name used for handshake limits. */
    public static final String CONNECT_EVENT = "connection";

    public RateLimitKey {
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("Identity id cannot be blank");
        }
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be blank");
        }
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("Window must be positive");
        }
    }

    /**
     * Create the key for the window containing {@code now}.
     *
     * @param identityId identity id
     * @param eventName  event name
     * @param policy     the policy whose window applies
     * @param now        current time
     * @return the key
     */
    public static RateLimitKey forWindow(String identityId, String eventName, RateLimitPolicy policy, Instant now) {
        final var windowMillis = policy.windowMillis();
        return new RateLimitKey(identityId, eventName, Math.floorDiv(now.toEpochMilli(), windowMillis), windowMillis);
    }

    /**
     * Key used in the shared store.
     *
     * @return {@code ratelimit:{identity}:{event}:{window}}
     */
    public String toStoreKey() {
        return PREFIX + identityId + ":" + eventName + ":" + windowIndex;
    }

    /**
     * Instant at which this window ends.
     */
    public Instant windowEnd() {
        return Instant.ofEpochMilli((windowIndex + 1) * windowMillis);
    }
}
