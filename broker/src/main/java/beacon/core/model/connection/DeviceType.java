package beacon.core.model.connection;

import java.util.Locale;

/**
 * Coarse device classification used for statistics.
 */
public enum DeviceType {
    WEB,
    MOBILE;

    /**
     * Classify a client from its handshake headers.
     *
     * @param userAgent the User-Agent header (may be null)
     * @param platform  the x-platform header (may be null)
     * @return the device type
     */
    public static DeviceType classify(String userAgent, String platform) {
        if (platform != null) {
            final var normalized = platform.toLowerCase(Locale.ROOT);
            if (normalized.equals("ios") || normalized.equals("android") || normalized.equals("mobile")) {
                return MOBILE;
            }
        }
        if (userAgent != null && userAgent.contains("Mobile")) {
            return MOBILE;
        }
        return WEB;
    }
}
