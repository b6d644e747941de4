package beacon.core.model.connection;

import java.util.Map;

/**
 * Point-in-time connection statistics for one broker instance.
 *
 * @param totalConnections number of live connections
 * @param uniqueIdentities number of distinct identities with at least one connection
 * @param byRole           connection count per role
 * @param byDevice         connection count per device type
 */
public record ConnectionStats(
        int totalConnections, int uniqueIdentities, Map<String, Integer> byRole, Map<DeviceType, Integer> byDevice) {

    public ConnectionStats {
        byRole = byRole != null ? Map.copyOf(byRole) : Map.of();
        byDevice = byDevice != null ? Map.copyOf(byDevice) : Map.of();
    }
}
